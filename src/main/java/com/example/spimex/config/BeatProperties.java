package com.example.spimex.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Periodic dispatch settings for the beat process.
 * The cron expression itself is read by the {@code @Scheduled} annotation.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "spimex.beat")
public class BeatProperties {

    private String importCron = "0 0 19 * * MON-FRI";

    private String zone = "Europe/Moscow";

    /**
     * Days before today included in every scheduled import, so a missed run is caught up
     */
    @Min(0)
    private int importLookbackDays = 3;
}
