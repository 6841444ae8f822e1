package com.pearlthoughts.mailgateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

/**
 * Response of a report send
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportResponse {

    private boolean success;
    private String messageId;
    private String reportType;
    private String cluster;
    private String timestamp;
    private String error;

    public static ReportResponse success(String messageId, String reportType, String cluster, String timestamp) {
        ReportResponse response = new ReportResponse();
        response.setSuccess(true);
        response.setMessageId(messageId);
        response.setReportType(reportType);
        response.setCluster(cluster);
        response.setTimestamp(timestamp);
        return response;
    }

    public static ReportResponse failure(String error) {
        ReportResponse response = new ReportResponse();
        response.setSuccess(false);
        response.setError(error);
        return response;
    }
}
