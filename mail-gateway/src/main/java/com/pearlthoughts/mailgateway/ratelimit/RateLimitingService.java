package com.pearlthoughts.mailgateway.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-client rate limiting for the API endpoints
 * Implements sliding window rate limiting
 */
@Service
public class RateLimitingService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitingService.class);

    @Value("${mail.gateway.rate-limit.max-requests:100}")
    private int maxRequests;

    @Value("${mail.gateway.rate-limit.window-seconds:900}")
    private int windowSeconds;

    private final Clock clock;
    private final ConcurrentMap<String, SlidingWindow> rateLimitWindows = new ConcurrentHashMap<>();

    public RateLimitingService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Count a request against the client's window if there is room left
     *
     * @param clientKey the client identifier, usually the remote address
     * @return true if the request is allowed, false if the window is exhausted
     */
    public boolean tryAcquire(String clientKey) {
        while (true) {
            SlidingWindow window = rateLimitWindows.computeIfAbsent(clientKey, k -> new SlidingWindow());

            synchronized (window) {
                if (rateLimitWindows.get(clientKey) != window) {
                    // evicted between lookup and lock
                    continue;
                }

                Instant now = clock.instant();
                window.cleanupOldEntries(now);

                if (window.getCurrentCount() >= maxRequests) {
                    logger.warn("Rate limit exceeded for client: {}", clientKey);
                    return false;
                }

                window.addRequest(now);
                logger.debug("Rate limit check passed for client: {} (current count: {})", clientKey, window.getCurrentCount());
                return true;
            }
        }
    }

    /**
     * Get current request count for a client
     */
    public int getCurrentRequestCount(String clientKey) {
        SlidingWindow window = rateLimitWindows.get(clientKey);
        if (window == null) {
            return 0;
        }

        synchronized (window) {
            window.cleanupOldEntries(clock.instant());
            return window.getCurrentCount();
        }
    }

    /**
     * Drop windows of clients that have been quiet for a full window
     */
    @Scheduled(fixedDelayString = "${mail.gateway.rate-limit.eviction-interval-ms:60000}")
    public void evictIdleWindows() {
        Instant now = clock.instant();
        int before = rateLimitWindows.size();
        rateLimitWindows.entrySet().removeIf(entry -> {
            SlidingWindow window = entry.getValue();
            synchronized (window) {
                window.cleanupOldEntries(now);
                return window.getCurrentCount() == 0;
            }
        });
        int evicted = before - rateLimitWindows.size();
        if (evicted > 0) {
            logger.debug("Evicted {} idle rate limit windows", evicted);
        }
    }

    /**
     * Get rate limit configuration
     */
    public RateLimitConfig getRateLimitConfig() {
        return new RateLimitConfig(maxRequests, windowSeconds);
    }

    int getTrackedClientCount() {
        return rateLimitWindows.size();
    }

    /**
     * Sliding window implementation for rate limiting
     */
    private class SlidingWindow {
        private final ConcurrentMap<Instant, AtomicInteger> timeSlots = new ConcurrentHashMap<>();

        public void addRequest(Instant timestamp) {
            // Round to the second for grouping
            Instant roundedTime = timestamp.truncatedTo(ChronoUnit.SECONDS);
            timeSlots.computeIfAbsent(roundedTime, k -> new AtomicInteger(0)).incrementAndGet();
        }

        public int getCurrentCount() {
            return timeSlots.values().stream()
                    .mapToInt(AtomicInteger::get)
                    .sum();
        }

        public void cleanupOldEntries(Instant now) {
            Instant cutoff = now.minusSeconds(windowSeconds);
            timeSlots.entrySet().removeIf(entry -> !entry.getKey().isAfter(cutoff));
        }
    }

    /**
     * Rate limit configuration holder
     */
    public static class RateLimitConfig {
        private final int maxRequests;
        private final int windowSeconds;

        public RateLimitConfig(int maxRequests, int windowSeconds) {
            this.maxRequests = maxRequests;
            this.windowSeconds = windowSeconds;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public int getWindowSeconds() {
            return windowSeconds;
        }

        @Override
        public String toString() {
            return String.format("RateLimitConfig{maxRequests=%d, windowSeconds=%d}", maxRequests, windowSeconds);
        }
    }
}
