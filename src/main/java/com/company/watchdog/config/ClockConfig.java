package com.company.watchdog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * System clock in the configured zone. Schedule matching reads the zone from this clock.
     */
    @Bean
    public Clock clock(WatchdogProperties properties) {
        return Clock.system(properties.getZone());
    }
}
