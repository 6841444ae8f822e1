package com.pearlthoughts.mailgateway.model;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Map;

/**
 * Report payload. Map order follows the JSON document.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ReportData {

    private Map<String, Object> metrics;

    private List<Map<String, Object>> details;

    private List<@Valid AttachmentRequest> attachments;
}
