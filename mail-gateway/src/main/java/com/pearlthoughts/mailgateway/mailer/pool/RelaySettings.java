package com.pearlthoughts.mailgateway.mailer.pool;

import lombok.Getter;
import lombok.Setter;

/**
 * Relay endpoint, credentials and pool limits.
 */
@Getter
@Setter
public class RelaySettings {

    private String host = "localhost";
    private int port = 587;
    private String username;
    private String password;
    private boolean starttlsEnabled = true;
    private boolean starttlsRequired = false;

    private int poolSize = 5;
    private int maxMessagesPerConnection = 100;
    private long acquireTimeoutMs = 30000;

    private int connectionTimeoutMs = 10000;
    private int timeoutMs = 30000;

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }
}
