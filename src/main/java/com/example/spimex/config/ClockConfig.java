package com.example.spimex.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Trading days are counted in the exchange's time zone
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock exchangeClock(SpimexProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
