package com.pearlthoughts.mailgateway.mailer.pool;

import jakarta.mail.MessagingException;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import org.eclipse.angus.mail.smtp.SMTPTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A relay transport owned by the pool. Only the borrowing thread touches it
 * between acquire and release.
 */
class PooledConnection {

    private static final Logger logger = LoggerFactory.getLogger(PooledConnection.class);

    private final long id;
    private final Transport transport;
    private int deliveries;

    PooledConnection(long id, Transport transport) {
        this.id = id;
        this.transport = transport;
    }

    long getId() {
        return id;
    }

    int getDeliveries() {
        return deliveries;
    }

    void send(MimeMessage message) throws MessagingException {
        transport.sendMessage(message, message.getAllRecipients());
        deliveries++;
    }

    boolean isConnected() {
        return transport.isConnected();
    }

    boolean isReusable(int maxMessagesPerConnection) {
        return deliveries < maxMessagesPerConnection && isConnected();
    }

    /**
     * Last reply line from the relay, e.g. {@code 250 2.0.0 Ok: queued as 4F2A}.
     */
    String lastServerResponse() {
        if (transport instanceof SMTPTransport smtpTransport) {
            String response = smtpTransport.getLastServerResponse();
            return response != null ? response.trim() : null;
        }
        return null;
    }

    void close() {
        try {
            transport.close();
        } catch (MessagingException e) {
            logger.debug("Error closing relay connection #{}: {}", id, e.getMessage());
        }
    }
}
