package com.pearlthoughts.mailgateway.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Single send request. {@code to} accepts a single address or an array.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class SendEmailRequest {

    @NotBlank(message = "Sender email is required")
    @Email(message = "Invalid from email")
    private String from;

    @NotEmpty(message = "At least one recipient is required")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<@NotBlank(message = "Recipient email is required") @Email(message = "Invalid to email") String> to;

    @NotBlank(message = "Subject is required")
    private String subject;

    private String text;

    private String html;

    private List<@Valid AttachmentRequest> attachments;

    public SendEmailRequest(String from, List<String> to, String subject, String text) {
        this.from = from;
        this.to = to;
        this.subject = subject;
        this.text = text;
    }
}
