package com.pearlthoughts.mailgateway.mailer;

/**
 * Connection pool statistics holder
 */
public class PoolStats {

    private final int poolSize;
    private final int maxMessagesPerConnection;
    private final int openConnections;
    private final int idleConnections;
    private final long deliveredMessages;
    private final long failedDeliveries;

    public PoolStats(int poolSize, int maxMessagesPerConnection, int openConnections,
                     int idleConnections, long deliveredMessages, long failedDeliveries) {
        this.poolSize = poolSize;
        this.maxMessagesPerConnection = maxMessagesPerConnection;
        this.openConnections = openConnections;
        this.idleConnections = idleConnections;
        this.deliveredMessages = deliveredMessages;
        this.failedDeliveries = failedDeliveries;
    }

    // Getters
    public int getPoolSize() { return poolSize; }
    public int getMaxMessagesPerConnection() { return maxMessagesPerConnection; }
    public int getOpenConnections() { return openConnections; }
    public int getIdleConnections() { return idleConnections; }
    public long getDeliveredMessages() { return deliveredMessages; }
    public long getFailedDeliveries() { return failedDeliveries; }

    public int getActiveConnections() {
        return Math.max(0, openConnections - idleConnections);
    }

    @Override
    public String toString() {
        return String.format("PoolStats{poolSize=%d, maxMessagesPerConnection=%d, openConnections=%d, " +
                        "idleConnections=%d, deliveredMessages=%d, failedDeliveries=%d}",
                poolSize, maxMessagesPerConnection, openConnections, idleConnections,
                deliveredMessages, failedDeliveries);
    }
}
