package com.pearlthoughts.mailgateway.mailer.pool;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;

/**
 * Opens authenticated transport connections to the relay.
 */
public interface RelayConnector {

    /**
     * Session used to compose messages for transports opened by this connector.
     */
    Session getSession();

    /**
     * Open and authenticate a new transport connection.
     *
     * @return a connected transport
     * @throws MessagingException if the relay refuses the connection or the credentials
     */
    Transport connect() throws MessagingException;
}
