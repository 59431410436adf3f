package com.company.watchdog.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings under the {@code dwmon} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "dwmon")
public class WatchdogProperties {

    /** Directory scanned for {@code *.dwmon} checker configs. */
    @NotBlank
    private String configsDir = "./checker_configs";

    /** Zone in which schedule patterns are evaluated and local times rendered. */
    @NotNull
    private ZoneId zone = ZoneId.systemDefault();

    /** Upper bound on a single row fetch from an external source. */
    @NotNull
    private Duration fetchTimeout = Duration.ofSeconds(30);

    /** Cap on fetch worker threads; a fetch stuck past its timeout keeps its worker until the driver returns. */
    @Positive
    private int maxConcurrentFetches = 4;

    @Valid
    private Check check = new Check();

    @Valid
    private Purge purge = new Purge();

    /** Named JDBC sources that checker queries run against, keyed by the config's source name. */
    @Valid
    private Map<String, Source> sources = new HashMap<>();

    @Data
    public static class Check {
        private boolean enabled = true;

        @Positive
        private long intervalMs = 60000;

        @PositiveOrZero
        private long initialDelayMs = 5000;

        /** When true a failing checker is logged and the rest of the pass still runs. */
        private boolean isolateFailures = false;
    }

    @Data
    public static class Purge {
        /** Used when a checker's extra config has no retention_seconds; 0 disables purging. */
        @PositiveOrZero
        private long defaultRetentionSeconds = 0;

        /** Chance that a purge is actually requested after a check, to limit table scans. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double probability = 1.0;
    }

    @Data
    public static class Source {
        @NotBlank
        private String url;
        private String username;
        private String password;
        private String driverClassName;
    }
}
