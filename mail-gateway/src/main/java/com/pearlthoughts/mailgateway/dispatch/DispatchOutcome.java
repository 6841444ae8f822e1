package com.pearlthoughts.mailgateway.dispatch;

import lombok.Getter;

/**
 * Outcome of one recipient's delivery within a bulk send.
 */
@Getter
public class DispatchOutcome {

    public enum Status {
        SUCCESS,
        FAILURE
    }

    private final String recipientEmail;
    private final Status status;
    private final String messageId;
    private final String error;

    private DispatchOutcome(String recipientEmail, Status status, String messageId, String error) {
        this.recipientEmail = recipientEmail;
        this.status = status;
        this.messageId = messageId;
        this.error = error;
    }

    public static DispatchOutcome success(String recipientEmail, String messageId) {
        return new DispatchOutcome(recipientEmail, Status.SUCCESS, messageId, null);
    }

    public static DispatchOutcome failure(String recipientEmail, String error) {
        return new DispatchOutcome(recipientEmail, Status.FAILURE, null, error);
    }

    public boolean isSuccessful() {
        return status == Status.SUCCESS;
    }

    @Override
    public String toString() {
        return "DispatchOutcome{" +
                "recipientEmail='" + recipientEmail + '\'' +
                ", status=" + status +
                (isSuccessful() ? ", messageId='" + messageId + '\'' : ", error='" + error + '\'') +
                '}';
    }
}
