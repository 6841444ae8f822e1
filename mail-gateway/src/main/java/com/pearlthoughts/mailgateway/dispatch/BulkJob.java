package com.pearlthoughts.mailgateway.dispatch;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Templated fan-out: one message per recipient, rendered from the shared and recipient data.
 */
@Getter
@AllArgsConstructor
public class BulkJob {

    private final String from;
    private final String subjectTemplate;
    private final String bodyTemplate;
    private final List<Recipient> recipients;
    private final Map<String, String> sharedData;
}
