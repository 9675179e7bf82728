package com.example.spimex.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;

/**
 * Maps the deployment's connection variables onto {@code spring.datasource.*}.
 * <p>
 * Runs before the application context is created, so conflicting settings abort
 * startup before any bean touches the store.
 */
public class DatabaseEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE_NAME = "spimexDatabaseConnection";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        new ConnectionSettingsResolver(environment).resolve().ifPresent(dsn -> {
            var properties = new HashMap<String, Object>();
            properties.put("spring.datasource.url", dsn.toJdbcUrl());
            properties.put("spring.datasource.username", dsn.getUser());
            if (dsn.getPassword() != null) {
                properties.put("spring.datasource.password", dsn.getPassword());
            }
            environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, properties));
        });
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
