package com.company.watchdog.config;

import com.company.watchdog.repository.StoredEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final StoredEventRepository eventRepository;

    @Bean
    public MeterBinder storedEventMetrics() {
        return (registry) -> {
            Gauge.builder("dwmon.events.stored", eventRepository, repo -> {
                        try {
                            return repo.countAll();
                        } catch (Exception e) {
                            log.warn("Failed to count stored events", e);
                            return 0;
                        }
                    })
                    .description("Number of events currently held in the result store")
                    .register(registry);

            log.info("Custom metrics registered");
        };
    }
}
