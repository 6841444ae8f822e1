package com.pearlthoughts.mailgateway.mailer;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of a successful delivery: the Message-ID and the last relay response line.
 */
@Getter
@AllArgsConstructor
public class DeliveryReceipt {

    private final String messageId;
    private final String response;
}
