package com.example.spimex.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * SPIMEX bulletin source configuration
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "spimex.bulletin")
public class SpimexProperties {

    /**
     * Bulletin URL up to the date, e.g. https://spimex.com/upload/reports/oil_xls/oil_xls_
     */
    @NotBlank
    private String baseUrl = "https://spimex.com/upload/reports/oil_xls/oil_xls_";

    /**
     * Appended after the yyyyMMdd date
     */
    @NotBlank
    private String fileSuffix = "162000.xls";

    @Min(1)
    private int timeoutSeconds = 30;

    /**
     * Exchange time zone; "today" for date ranges is evaluated here
     */
    @NotBlank
    private String zone = "Europe/Moscow";

    /**
     * Largest accepted import range in days
     */
    @Min(1)
    private int maxImportDays = 366;
}
