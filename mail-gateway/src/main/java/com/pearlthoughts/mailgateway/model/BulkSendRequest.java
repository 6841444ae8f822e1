package com.pearlthoughts.mailgateway.model;

import com.pearlthoughts.mailgateway.dispatch.BulkJob;
import com.pearlthoughts.mailgateway.dispatch.Recipient;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Bulk send request: one templated message per recipient.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class BulkSendRequest {

    @NotBlank(message = "Sender email is required")
    @Email(message = "Invalid from email")
    private String from;

    @NotNull(message = "Recipients must be an array")
    private List<@NotNull(message = "Recipient is required") @Valid RecipientRequest> recipients;

    @NotBlank(message = "Subject is required")
    private String subject;

    @NotBlank(message = "Template is required")
    private String template;

    private Map<String, String> templateData;

    public BulkJob toBulkJob() {
        List<Recipient> jobRecipients = recipients.stream()
                .map(r -> new Recipient(r.getEmail(), r.getData()))
                .collect(Collectors.toList());
        return new BulkJob(from, subject, template, jobRecipients, templateData);
    }
}
