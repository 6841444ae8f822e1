package com.pearlthoughts.mailgateway.config;

import com.pearlthoughts.mailgateway.mailer.pool.RelaySettings;
import com.pearlthoughts.mailgateway.mailer.pool.SmtpMailerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Relay connection pool wiring. The pool lives for the whole application context.
 */
@Configuration
public class MailerConfig {

    private static final Logger logger = LoggerFactory.getLogger(MailerConfig.class);

    @Value("${mail.relay.host:localhost}")
    private String host;

    @Value("${mail.relay.port:587}")
    private int port;

    @Value("${mail.relay.username:}")
    private String username;

    @Value("${mail.relay.password:}")
    private String password;

    @Value("${mail.relay.starttls-enabled:true}")
    private boolean starttlsEnabled;

    @Value("${mail.relay.starttls-required:false}")
    private boolean starttlsRequired;

    @Value("${mail.relay.pool-size:5}")
    private int poolSize;

    @Value("${mail.relay.max-messages-per-connection:100}")
    private int maxMessagesPerConnection;

    @Value("${mail.relay.acquire-timeout-ms:30000}")
    private long acquireTimeoutMs;

    @Value("${mail.relay.connection-timeout-ms:10000}")
    private int connectionTimeoutMs;

    @Value("${mail.relay.timeout-ms:30000}")
    private int timeoutMs;

    @Bean(destroyMethod = "shutdown")
    public SmtpMailerPool mailerPool() {
        RelaySettings settings = new RelaySettings();
        settings.setHost(host);
        settings.setPort(port);
        settings.setUsername(username);
        settings.setPassword(password);
        settings.setStarttlsEnabled(starttlsEnabled);
        settings.setStarttlsRequired(starttlsRequired);
        settings.setPoolSize(poolSize);
        settings.setMaxMessagesPerConnection(maxMessagesPerConnection);
        settings.setAcquireTimeoutMs(acquireTimeoutMs);
        settings.setConnectionTimeoutMs(connectionTimeoutMs);
        settings.setTimeoutMs(timeoutMs);

        logger.info("SMTP relay {}:{} (auth: {}, starttls: {})",
                host, port, settings.hasCredentials(), starttlsEnabled);
        return SmtpMailerPool.create(settings);
    }
}
