package com.example.spimex.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "spimex.topology")
public class TopologyProperties {

    /**
     * Compose file checked by the topology-check role
     */
    @NotBlank
    private String file = "docker-compose.yml";

    /**
     * Fail on warnings as well as errors
     */
    private boolean strict = false;
}
