package com.pearlthoughts.mailgateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pearlthoughts.mailgateway.dispatch.BatchResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Bulk send response: counts plus the per-recipient results.
 */
@Getter
@AllArgsConstructor
public class BulkSendResponse {

    private final int total;
    private final int successful;
    private final int failed;
    private final Results results;

    public static BulkSendResponse from(BatchResult batch) {
        List<RecipientResult> sent = batch.getSuccesses().stream()
                .map(o -> new RecipientResult(o.getRecipientEmail(), o.getMessageId(), null))
                .collect(Collectors.toList());
        List<RecipientResult> failed = batch.getFailures().stream()
                .map(o -> new RecipientResult(o.getRecipientEmail(), null, o.getError()))
                .collect(Collectors.toList());
        return new BulkSendResponse(batch.getTotal(), batch.getSuccessful(), batch.getFailed(),
                new Results(sent, failed));
    }

    @Getter
    @AllArgsConstructor
    public static class Results {
        private final List<RecipientResult> success;
        private final List<RecipientResult> failed;
    }

    @Getter
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RecipientResult {
        private final String email;
        private final String messageId;
        private final String error;
    }
}
