package com.pearlthoughts.mailgateway.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Requires a known {@code x-api-key} header on every {@code /api/**} request.
 * With no keys configured every request is rejected.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class ApiKeyFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyFilter.class);

    public static final String API_KEY_HEADER = "x-api-key";

    private final Set<String> apiKeys;
    private final ObjectMapper objectMapper;

    public ApiKeyFilter(@Value("${mail.gateway.api-keys:}") String apiKeys, ObjectMapper objectMapper) {
        this.apiKeys = Arrays.stream(apiKeys.split(","))
                .map(String::trim)
                .filter(key -> !key.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.objectMapper = objectMapper;

        if (this.apiKeys.isEmpty()) {
            logger.warn("No API keys configured; all /api requests will be rejected");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String apiKey = request.getHeader(API_KEY_HEADER);

        if (apiKey == null || apiKey.isEmpty()) {
            reject(response, HttpStatus.UNAUTHORIZED, "API key is required");
            return;
        }
        if (!apiKeys.contains(apiKey)) {
            logger.warn("Rejected request to {} with an unknown API key from {}",
                    request.getRequestURI(), request.getRemoteAddr());
            reject(response, HttpStatus.FORBIDDEN, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, HttpStatus status, String error) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), Map.of("error", error));
    }
}
