package com.pearlthoughts.mailgateway.mailer;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Outbound message handed to the {@link Mailer}. At least one of the bodies is expected;
 * the transport reports the message as invalid otherwise.
 */
@Getter
@Builder
public class MailMessage {

    private final String from;

    private final List<String> to;

    private final String subject;

    private final String textBody;

    private final String htmlBody;

    private final List<MailAttachment> attachments;

    public boolean hasAttachments() {
        return attachments != null && !attachments.isEmpty();
    }
}
