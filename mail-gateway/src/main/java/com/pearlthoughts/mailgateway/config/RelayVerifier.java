package com.pearlthoughts.mailgateway.config;

import com.pearlthoughts.mailgateway.mailer.Mailer;
import com.pearlthoughts.mailgateway.mailer.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Checks the relay once the application is up. Startup continues if the relay is down.
 */
@Component
public class RelayVerifier {

    private static final Logger logger = LoggerFactory.getLogger(RelayVerifier.class);

    private final Mailer mailer;

    public RelayVerifier(Mailer mailer) {
        this.mailer = mailer;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void verifyRelay() {
        try {
            mailer.healthCheck();
            logger.info("SMTP server is ready to take our messages");
        } catch (TransportException e) {
            logger.error("SMTP connection error: {}", e.getMessage());
        }
    }
}
