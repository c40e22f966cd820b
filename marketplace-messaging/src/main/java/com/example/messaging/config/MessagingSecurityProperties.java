package com.example.messaging.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "messaging.security")
public class MessagingSecurityProperties {

    /**
     * Toggle to enable or disable the inbound HTTP rate limiter.
     */
    private boolean rateLimitingEnabled = true;

    /**
     * HS256 secret shared with the login service. At least 32 bytes.
     */
    @NotBlank
    @Size(min = 32)
    private String tokenSecret = "change-me-local-development-token-secret";

    /**
     * Browser origins allowed to call the HTTP API.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:5173"));

    private final RateLimit rateLimit = new RateLimit();

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public String getTokenSecret() {
        return tokenSecret;
    }

    public void setTokenSecret(String tokenSecret) {
        this.tokenSecret = tokenSecret;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    @Validated
    public static class RateLimit {

        /**
         * Maximum number of requests allowed per refill period.
         */
        private long capacity = 120;

        /**
         * Number of tokens replenished every {@link #refillPeriod}.
         */
        private long refillTokens = 120;

        /**
         * Interval at which tokens are replenished.
         */
        private Duration refillPeriod = Duration.ofSeconds(60);

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getRefillTokens() {
            return refillTokens;
        }

        public void setRefillTokens(long refillTokens) {
            this.refillTokens = refillTokens;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }
    }
}
