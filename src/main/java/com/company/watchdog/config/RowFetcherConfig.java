package com.company.watchdog.config;

import com.company.watchdog.plugin.JdbcRowFetcher;
import com.company.watchdog.plugin.RowFetcher;
import com.company.watchdog.plugin.TimeLimitedRowFetcher;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class RowFetcherConfig {

    @Bean
    public TimeLimiter rowFetchTimeLimiter(WatchdogProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getFetchTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("rowFetcher", config);
    }

    @Bean(destroyMethod = "close")
    public TimeLimitedRowFetcher rowFetcher(WatchdogProperties properties, TimeLimiter rowFetchTimeLimiter) {
        log.info("Row fetcher configured with {} sources, timeout {}, {} workers",
                properties.getSources().size(), properties.getFetchTimeout(), properties.getMaxConcurrentFetches());
        RowFetcher jdbcFetcher = new JdbcRowFetcher(properties.getSources(), properties.getFetchTimeout());
        return new TimeLimitedRowFetcher(jdbcFetcher, rowFetchTimeLimiter, properties.getMaxConcurrentFetches());
    }
}
