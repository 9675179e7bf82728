package com.example.spimex.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Redis task queue and its workers.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "spimex.tasks")
public class TaskQueueProperties {

    /**
     * Prefix for every broker key owned by this service
     */
    @NotBlank
    private String keyPrefix = "spimex:tasks";

    /**
     * Number of concurrent consumer threads per worker process
     */
    @Min(1)
    private int workerConcurrency = 2;

    /**
     * How long a blocking claim waits before re-checking the shutdown flag
     */
    @Min(1)
    private int claimTimeoutSeconds = 5;

    /**
     * Time a claimed task may run before it is considered abandoned and redelivered
     */
    @Min(1)
    private int visibilityTimeoutMinutes = 30;

    /**
     * Default maximum attempts before a task is dead-lettered
     */
    @Min(1)
    private int defaultMaxRetries = 5;

    /**
     * First retry delay; doubles with each further attempt
     */
    @Min(1)
    private long retryInitialDelaySeconds = 60;

    /**
     * Upper bound for the retry delay
     */
    @Min(1)
    private long retryMaxDelaySeconds = 3600;

    /**
     * How long task status records and completion markers are kept
     */
    @Min(1)
    private int statusTtlHours = 168;

    public String key(String suffix) {
        return keyPrefix + ":" + suffix;
    }
}
