package com.pearlthoughts.mailgateway.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ReportRequest {

    @NotBlank(message = "Report type is required")
    private String reportType;

    @NotBlank(message = "Cluster name is required")
    private String cluster;

    @NotEmpty(message = "Recipients must be a non-empty array")
    private List<@NotBlank(message = "Recipient email is required") @Email(message = "Invalid recipient email") String> recipients;

    @NotNull(message = "Report data is required")
    @Valid
    private ReportData data;

    private String subject;

    @Email(message = "Invalid from email")
    private String from;
}
