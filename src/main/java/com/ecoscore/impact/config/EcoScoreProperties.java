package com.ecoscore.impact.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "ecoscore")
public class EcoScoreProperties {

    public static final String DEVELOPMENT_API_KEY = "demo-api-key-change-in-production";

    // Keys accepted in the X-API-Key header
    private List<String> apiKeys = new ArrayList<>(List.of(DEVELOPMENT_API_KEY));

    private RateLimit rateLimit = new RateLimit();

    private Demo demo = new Demo();

    /**
     * Trims the configured keys and drops blank ones. An empty result falls back
     * to {@link #DEVELOPMENT_API_KEY}, so {@code API_KEY=""} behaves like an unset key.
     */
    public void setApiKeys(List<String> apiKeys) {
        List<String> keys = new ArrayList<>();
        if (apiKeys != null) {
            for (String key : apiKeys) {
                if (key != null && !key.isBlank()) {
                    keys.add(key.trim());
                }
            }
        }
        if (keys.isEmpty()) {
            keys.add(DEVELOPMENT_API_KEY);
        }
        this.apiKeys = keys;
    }

    @Data
    public static class RateLimit {
        private int maxRequests = 5;
        private Duration window = Duration.ofSeconds(1);
    }

    @Data
    public static class Demo {
        private boolean enabled = false;
    }
}
