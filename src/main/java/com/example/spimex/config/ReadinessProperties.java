package com.example.spimex.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Backoff settings for waiting on the store and the broker.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "spimex.readiness")
public class ReadinessProperties {

    private Backoff store = new Backoff(30, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10));

    /**
     * Zero attempts means retry forever
     */
    private Backoff broker = new Backoff(0, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));

    @Data
    public static class Backoff {

        /**
         * Maximum attempts, 0 for unbounded
         */
        @Min(0)
        private int maxAttempts;

        private Duration initialInterval;

        @DecimalMin("1.0")
        private double multiplier;

        private Duration maxInterval;

        public Backoff() {
        }

        public Backoff(int maxAttempts, Duration initialInterval, double multiplier, Duration maxInterval) {
            this.maxAttempts = maxAttempts;
            this.initialInterval = initialInterval;
            this.multiplier = multiplier;
            this.maxInterval = maxInterval;
        }

        public int effectiveMaxAttempts() {
            return maxAttempts <= 0 ? Integer.MAX_VALUE : maxAttempts;
        }
    }
}
