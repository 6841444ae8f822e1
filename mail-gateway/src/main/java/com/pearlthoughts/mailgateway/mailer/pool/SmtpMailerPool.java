package com.pearlthoughts.mailgateway.mailer.pool;

import com.pearlthoughts.mailgateway.mailer.DeliveryReceipt;
import com.pearlthoughts.mailgateway.mailer.MailAttachment;
import com.pearlthoughts.mailgateway.mailer.MailMessage;
import com.pearlthoughts.mailgateway.mailer.Mailer;
import com.pearlthoughts.mailgateway.mailer.PoolStats;
import com.pearlthoughts.mailgateway.mailer.TransportException;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of relay connections.
 *
 * <p>A fair semaphore caps the number of connections in use at {@code poolSize}; callers wait
 * up to {@code acquireTimeoutMs} for a permit. Idle connections are reused most-recently-used
 * first. A connection is retired after {@code maxMessagesPerConnection} deliveries, when it is
 * found disconnected, or after a transport-level failure, and a new one is opened lazily on the
 * next acquire.
 */
public class SmtpMailerPool implements Mailer {

    private static final Logger logger = LoggerFactory.getLogger(SmtpMailerPool.class);

    private final RelayConnector connector;
    private final int poolSize;
    private final int maxMessagesPerConnection;
    private final long acquireTimeoutMs;

    private final Semaphore permits;
    private final Deque<PooledConnection> idleConnections = new ConcurrentLinkedDeque<>();
    private final AtomicInteger openConnections = new AtomicInteger();
    private final AtomicLong connectionSequence = new AtomicLong();
    private final AtomicLong deliveredMessages = new AtomicLong();
    private final AtomicLong failedDeliveries = new AtomicLong();
    private volatile boolean shutdown;

    public SmtpMailerPool(RelayConnector connector, int poolSize, int maxMessagesPerConnection,
                          long acquireTimeoutMs) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1");
        }
        if (maxMessagesPerConnection < 1) {
            throw new IllegalArgumentException("maxMessagesPerConnection must be at least 1");
        }
        this.connector = connector;
        this.poolSize = poolSize;
        this.maxMessagesPerConnection = maxMessagesPerConnection;
        this.acquireTimeoutMs = acquireTimeoutMs;
        this.permits = new Semaphore(poolSize, true);

        logger.info("SmtpMailerPool initialized with poolSize={}, maxMessagesPerConnection={}, acquireTimeoutMs={}",
                poolSize, maxMessagesPerConnection, acquireTimeoutMs);
    }

    public static SmtpMailerPool create(RelaySettings settings) {
        return new SmtpMailerPool(new SessionRelayConnector(settings), settings.getPoolSize(),
                settings.getMaxMessagesPerConnection(), settings.getAcquireTimeoutMs());
    }

    @Override
    public DeliveryReceipt deliver(MailMessage message) throws TransportException {
        MimeMessage mimeMessage = compose(message);
        PooledConnection connection = acquire();
        boolean reusable = false;
        try {
            connection.send(mimeMessage);
            reusable = true;
            deliveredMessages.incrementAndGet();

            String messageId = mimeMessage.getMessageID();
            String response = connection.lastServerResponse();
            logger.debug("Delivered {} to {} over connection #{} ({} deliveries)",
                    messageId, message.getTo(), connection.getId(), connection.getDeliveries());
            return new DeliveryReceipt(messageId, response);

        } catch (SendFailedException e) {
            // Relay rejected the message or its recipients; the session itself is still usable
            reusable = connection.isConnected();
            failedDeliveries.incrementAndGet();
            throw RelayErrors.toTransportException(e);

        } catch (MessagingException e) {
            failedDeliveries.incrementAndGet();
            throw RelayErrors.toTransportException(e);

        } finally {
            release(connection, reusable);
        }
    }

    /**
     * Opens a dedicated connection, completes the handshake and closes it again.
     */
    @Override
    public void healthCheck() throws TransportException {
        Transport transport;
        try {
            transport = connector.connect();
        } catch (MessagingException e) {
            throw RelayErrors.toTransportException(e);
        }
        try {
            transport.close();
        } catch (MessagingException e) {
            logger.debug("Error closing health check connection: {}", e.getMessage());
        }
    }

    @Override
    public PoolStats getStats() {
        return new PoolStats(poolSize, maxMessagesPerConnection, openConnections.get(),
                idleConnections.size(), deliveredMessages.get(), failedDeliveries.get());
    }

    /**
     * Close every idle connection and refuse further deliveries. Borrowed connections are
     * closed when their delivery completes.
     */
    public void shutdown() {
        shutdown = true;
        PooledConnection connection;
        int closed = 0;
        while ((connection = idleConnections.pollFirst()) != null) {
            discard(connection);
            closed++;
        }
        logger.info("SmtpMailerPool shut down, closed {} idle connections", closed);
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int getMaxMessagesPerConnection() {
        return maxMessagesPerConnection;
    }

    private PooledConnection acquire() throws TransportException {
        if (shutdown) {
            throw new TransportException("Mailer pool is shut down", false);
        }

        try {
            if (!permits.tryAcquire(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new TransportException(
                        "Timed out after " + acquireTimeoutMs + " ms waiting for a relay connection", true);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for a relay connection", e, true);
        }

        try {
            PooledConnection connection;
            while ((connection = idleConnections.pollFirst()) != null) {
                if (connection.isReusable(maxMessagesPerConnection)) {
                    return connection;
                }
                logger.debug("Retiring stale relay connection #{}", connection.getId());
                discard(connection);
            }
            return open();
        } catch (MessagingException e) {
            permits.release();
            throw RelayErrors.toTransportException(e);
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    private PooledConnection open() throws MessagingException {
        Transport transport = connector.connect();
        PooledConnection connection = new PooledConnection(connectionSequence.incrementAndGet(), transport);
        int open = openConnections.incrementAndGet();
        logger.debug("Opened relay connection #{} ({} open)", connection.getId(), open);
        return connection;
    }

    private void release(PooledConnection connection, boolean reusable) {
        try {
            if (reusable && !shutdown && connection.getDeliveries() < maxMessagesPerConnection) {
                idleConnections.offerFirst(connection);
            } else {
                logger.debug("Retiring relay connection #{} after {} deliveries",
                        connection.getId(), connection.getDeliveries());
                discard(connection);
            }
        } finally {
            permits.release();
        }
    }

    private void discard(PooledConnection connection) {
        connection.close();
        openConnections.decrementAndGet();
    }

    private MimeMessage compose(MailMessage message) throws TransportException {
        MimeMessage mimeMessage = new MimeMessage(connector.getSession());
        boolean multipart = message.hasAttachments()
                || (message.getTextBody() != null && message.getHtmlBody() != null);
        try {
            MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, multipart,
                    StandardCharsets.UTF_8.name());
            if (message.getFrom() != null && !message.getFrom().isBlank()) {
                helper.setFrom(message.getFrom());
            }
            if (message.getTo() != null) {
                helper.setTo(message.getTo().toArray(new String[0]));
            }
            if (message.getSubject() != null) {
                helper.setSubject(message.getSubject());
            }

            if (message.getTextBody() != null && message.getHtmlBody() != null) {
                helper.setText(message.getTextBody(), message.getHtmlBody());
            } else if (message.getHtmlBody() != null) {
                helper.setText(message.getHtmlBody(), true);
            } else if (message.getTextBody() != null) {
                helper.setText(message.getTextBody(), false);
            } else {
                // no body given: send an empty text part
                helper.setText("", false);
            }

            if (message.hasAttachments()) {
                for (MailAttachment attachment : message.getAttachments()) {
                    ByteArrayResource resource = new ByteArrayResource(attachment.getContent());
                    if (attachment.getContentType() != null) {
                        helper.addAttachment(attachment.getFilename(), resource, attachment.getContentType());
                    } else {
                        helper.addAttachment(attachment.getFilename(), resource);
                    }
                }
            }

            // assigns the Message-ID header
            mimeMessage.saveChanges();
            return mimeMessage;

        } catch (MessagingException e) {
            throw new TransportException("Invalid message: " + RelayErrors.reason(e), e, false);
        }
    }
}
