package com.example.spimex.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS configuration for the public API.
 */
@Slf4j
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String rawOrigins;

    public WebConfig(@Value("${BACKEND_CORS_ORIGINS:}") String rawOrigins) {
        this.rawOrigins = rawOrigins;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        var origins = CorsOrigins.parse(rawOrigins);
        log.info("Allowing CORS origins {}", origins);

        var mapping = registry.addMapping("/**")
                .allowedMethods("*")
                .allowedHeaders("*");

        // Credentials cannot be combined with a wildcard origin
        if (origins.contains("*")) {
            mapping.allowedOriginPatterns("*");
        } else {
            mapping.allowedOrigins(origins.toArray(String[]::new));
        }
        mapping.allowCredentials(true);
    }
}
