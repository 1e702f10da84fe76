package com.ecoscore.impact.web;

import com.ecoscore.impact.config.EcoScoreProperties;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Token bucket per API key: {@code maxRequests} tokens, refilled in full once per window.
 * In-memory only, so limits apply per instance.
 */
@Component
public class ApiKeyRateLimiter {

    private final int maxRequests;
    private final Duration window;
    private final TimeMeter timeMeter;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    @Autowired
    public ApiKeyRateLimiter(EcoScoreProperties properties) {
        this(properties.getRateLimit().getMaxRequests(),
                properties.getRateLimit().getWindow(),
                TimeMeter.SYSTEM_NANOTIME);
    }

    ApiKeyRateLimiter(int maxRequests, Duration window, LongSupplier nanoClock) {
        this(maxRequests, window, new TimeMeter() {
            @Override
            public long currentTimeNanos() {
                return nanoClock.getAsLong();
            }

            @Override
            public boolean isWallClockBased() {
                return false;
            }
        });
    }

    private ApiKeyRateLimiter(int maxRequests, Duration window, TimeMeter timeMeter) {
        this.maxRequests = maxRequests;
        this.window = window;
        this.timeMeter = timeMeter;
    }

    /**
     * Takes one token from the key's bucket.
     *
     * @return false when the bucket is empty; nothing is consumed then
     */
    public boolean tryAcquire(String apiKey) {
        return resolveBucket(apiKey).tryConsume(1);
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    private Bucket resolveBucket(String apiKey) {
        return buckets.computeIfAbsent(apiKey, k -> {
            Bandwidth limit = Bandwidth.classic(maxRequests, Refill.intervally(maxRequests, window));
            return Bucket.builder()
                    .addLimit(limit)
                    .withCustomTimePrecision(timeMeter)
                    .build();
        });
    }
}
