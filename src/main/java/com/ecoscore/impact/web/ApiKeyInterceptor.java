package com.ecoscore.impact.web;

import com.ecoscore.impact.config.EcoScoreProperties;
import com.ecoscore.impact.exception.InvalidApiKeyException;
import com.ecoscore.impact.exception.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Checks the {@code X-API-Key} header, then the per-key rate limit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyInterceptor implements HandlerInterceptor {

    public static final String API_KEY_HEADER = "X-API-Key";

    private final EcoScoreProperties properties;
    private final ApiKeyRateLimiter rateLimiter;

    @Override
    public boolean preHandle(HttpServletRequest req, HttpServletResponse res, Object handler) {
        String apiKey = req.getHeader(API_KEY_HEADER);
        if (apiKey == null || apiKey.isBlank()) {
            throw new InvalidApiKeyException("Missing API key. Provide X-API-Key header.");
        }
        if (!properties.getApiKeys().contains(apiKey.trim())) {
            log.warn("Rejected request to {} with unknown API key", req.getRequestURI());
            throw new InvalidApiKeyException("Invalid API key.");
        }
        if (!rateLimiter.tryAcquire(apiKey.trim())) {
            throw new RateLimitExceededException(
                    "Too many requests. Max " + rateLimiter.getMaxRequests() + " per "
                            + properties.getRateLimit().getWindow().toMillis() + " ms per API key.");
        }
        return true;
    }
}
