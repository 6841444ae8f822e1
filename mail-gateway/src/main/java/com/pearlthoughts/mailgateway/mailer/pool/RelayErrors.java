package com.pearlthoughts.mailgateway.mailer.pool;

import com.pearlthoughts.mailgateway.mailer.TransportException;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import org.eclipse.angus.mail.smtp.SMTPAddressFailedException;
import org.eclipse.angus.mail.smtp.SMTPSendFailedException;

/**
 * Maps Jakarta Mail failures onto {@link TransportException}.
 */
final class RelayErrors {

    private RelayErrors() {
    }

    static TransportException toTransportException(MessagingException e) {
        return new TransportException(reason(e), e, isTransient(e));
    }

    static String reason(MessagingException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        Exception next = e.getNextException();
        if (next != null && next.getMessage() != null && !message.contains(next.getMessage())) {
            return message + ": " + next.getMessage().trim();
        }
        return message;
    }

    /**
     * 4xx replies and connection-level failures are transient; 5xx and auth failures are not.
     */
    static boolean isTransient(MessagingException e) {
        if (e instanceof AuthenticationFailedException) {
            return false;
        }
        int code = replyCode(e);
        if (code > 0) {
            return code >= 400 && code < 500;
        }
        return true;
    }

    static int replyCode(MessagingException e) {
        Exception current = e;
        while (current instanceof MessagingException) {
            if (current instanceof SMTPSendFailedException sendFailed) {
                return sendFailed.getReturnCode();
            }
            if (current instanceof SMTPAddressFailedException addressFailed) {
                return addressFailed.getReturnCode();
            }
            current = ((MessagingException) current).getNextException();
        }
        return -1;
    }
}
