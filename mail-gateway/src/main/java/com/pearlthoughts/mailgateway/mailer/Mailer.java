package com.pearlthoughts.mailgateway.mailer;

/**
 * Outbound delivery capability backed by the mail relay.
 */
public interface Mailer {

    /**
     * Deliver a single message to the relay.
     *
     * @param message the message to deliver
     * @return the receipt carrying the relay-assigned message id and response line
     * @throws TransportException if the connection, authentication or relay rejects the message
     */
    DeliveryReceipt deliver(MailMessage message) throws TransportException;

    /**
     * Perform a protocol handshake with the relay without sending a message.
     *
     * @throws TransportException if the relay cannot be reached or rejects the handshake
     */
    void healthCheck() throws TransportException;

    /**
     * Snapshot of the current connection usage.
     */
    PoolStats getStats();
}
