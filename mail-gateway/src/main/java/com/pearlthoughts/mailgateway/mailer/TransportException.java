package com.pearlthoughts.mailgateway.mailer;

/**
 * Thrown when the relay connection, authentication or delivery fails.
 * The transient flag classifies the failure; the gateway never retries on it.
 */
public class TransportException extends Exception {

    private final boolean transientFailure;

    public TransportException(String reason) {
        super(reason);
        this.transientFailure = false;
    }

    public TransportException(String reason, boolean transientFailure) {
        super(reason);
        this.transientFailure = transientFailure;
    }

    public TransportException(String reason, Throwable cause, boolean transientFailure) {
        super(reason, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
