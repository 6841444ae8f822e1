package com.pearlthoughts.mailgateway.mailer;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MailAttachment {

    private final String filename;

    // null lets the transport guess from the file name
    private final String contentType;

    private final byte[] content;
}
