package com.pearlthoughts.mailgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.pearlthoughts.mailgateway.mailer.PoolStats;
import lombok.Getter;
import lombok.Setter;

/**
 * Pool status as reported by {@code GET /api/queue/status}.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueueStatusResponse {

    public static final String OPERATIONAL = "operational";
    public static final String ERROR = "error";

    private String status;
    private Integer poolSize;
    private Integer maxConnections;
    private Integer maxMessagesPerConnection;
    private Integer activeConnections;
    private Integer idleConnections;
    private String error;

    public static QueueStatusResponse operational(PoolStats stats) {
        QueueStatusResponse response = new QueueStatusResponse();
        response.setStatus(OPERATIONAL);
        response.setPoolSize(stats.getPoolSize());
        response.setMaxConnections(stats.getPoolSize());
        response.setMaxMessagesPerConnection(stats.getMaxMessagesPerConnection());
        response.setActiveConnections(stats.getActiveConnections());
        response.setIdleConnections(stats.getIdleConnections());
        return response;
    }

    public static QueueStatusResponse error(String error) {
        QueueStatusResponse response = new QueueStatusResponse();
        response.setStatus(ERROR);
        response.setError(error);
        return response;
    }

    @JsonIgnore
    public boolean isOperational() {
        return OPERATIONAL.equals(status);
    }
}
