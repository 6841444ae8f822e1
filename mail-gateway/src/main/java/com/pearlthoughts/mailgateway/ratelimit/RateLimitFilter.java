package com.pearlthoughts.mailgateway.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;

/**
 * Applies the per-IP request budget to {@code /api/**}. Runs before the API key check.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RateLimitFilter extends OncePerRequestFilter {

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String TOO_MANY_REQUESTS = "Too many requests from this IP, please try again later.";

    private final RateLimitingService rateLimitingService;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(RateLimitingService rateLimitingService, ObjectMapper objectMapper) {
        this.rateLimitingService = rateLimitingService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String clientKey = request.getRemoteAddr();
        boolean allowed = rateLimitingService.tryAcquire(clientKey);

        RateLimitingService.RateLimitConfig config = rateLimitingService.getRateLimitConfig();
        int remaining = Math.max(0, config.getMaxRequests() - rateLimitingService.getCurrentRequestCount(clientKey));
        response.setHeader(LIMIT_HEADER, String.valueOf(config.getMaxRequests()));
        response.setHeader(REMAINING_HEADER, String.valueOf(remaining));

        if (!allowed) {
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), Map.of("error", TOO_MANY_REQUESTS));
            return;
        }

        filterChain.doFilter(request, response);
    }
}
