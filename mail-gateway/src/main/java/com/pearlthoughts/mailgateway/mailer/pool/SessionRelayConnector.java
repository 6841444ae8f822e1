package com.pearlthoughts.mailgateway.mailer.pool;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;

import java.util.Properties;

/**
 * {@link RelayConnector} backed by a Jakarta Mail SMTP session.
 */
public class SessionRelayConnector implements RelayConnector {

    private final RelaySettings settings;
    private final Session session;

    public SessionRelayConnector(RelaySettings settings) {
        this.settings = settings;
        this.session = Session.getInstance(toProperties(settings));
    }

    @Override
    public Session getSession() {
        return session;
    }

    @Override
    public Transport connect() throws MessagingException {
        Transport transport = session.getTransport("smtp");
        if (settings.hasCredentials()) {
            transport.connect(settings.getHost(), settings.getPort(),
                    settings.getUsername(), settings.getPassword());
        } else {
            transport.connect(settings.getHost(), settings.getPort(), null, null);
        }
        return transport;
    }

    static Properties toProperties(RelaySettings settings) {
        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", settings.getHost());
        props.put("mail.smtp.port", String.valueOf(settings.getPort()));
        props.put("mail.smtp.auth", String.valueOf(settings.hasCredentials()));
        props.put("mail.smtp.starttls.enable", String.valueOf(settings.isStarttlsEnabled()));
        props.put("mail.smtp.starttls.required", String.valueOf(settings.isStarttlsRequired()));
        props.put("mail.smtp.connectiontimeout", String.valueOf(settings.getConnectionTimeoutMs()));
        props.put("mail.smtp.timeout", String.valueOf(settings.getTimeoutMs()));
        props.put("mail.smtp.writetimeout", String.valueOf(settings.getTimeoutMs()));
        return props;
    }
}
