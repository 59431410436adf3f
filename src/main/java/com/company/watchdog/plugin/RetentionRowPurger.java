package com.company.watchdog.plugin;

import com.company.watchdog.config.WatchdogProperties;
import com.company.watchdog.domain.PurgeDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Keeps the last {@code retention_seconds} of events per checker.
 *
 * <p>Retention comes from the checker's extra config, falling back to
 * {@code dwmon.purge.default-retention-seconds}. Purges are only requested with probability
 * {@code dwmon.purge.probability} so the delete does not scan the table after every check.
 */
@Component
@Slf4j
public class RetentionRowPurger implements RowPurger {

    static final String RETENTION_KEY = "retention_seconds";

    private final WatchdogProperties properties;
    private final Clock clock;
    private final DoubleSupplier random;

    @Autowired
    public RetentionRowPurger(WatchdogProperties properties, Clock clock) {
        this(properties, clock, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetentionRowPurger(WatchdogProperties properties, Clock clock, DoubleSupplier random) {
        this.properties = properties;
        this.clock = clock;
        this.random = random;
    }

    @Override
    public PurgeDecision identifyOld(String checkerName, Map<String, Object> extraConfig) {
        long retentionSeconds = retentionFor(checkerName, extraConfig);
        if (retentionSeconds <= 0) {
            return PurgeDecision.skip();
        }

        if (random.getAsDouble() >= properties.getPurge().getProbability()) {
            return PurgeDecision.skip();
        }

        return PurgeDecision.deleteOlderThan(clock.instant().getEpochSecond() - retentionSeconds);
    }

    private long retentionFor(String checkerName, Map<String, Object> extraConfig) {
        Object configured = extraConfig != null ? extraConfig.get(RETENTION_KEY) : null;
        if (configured == null) {
            return properties.getPurge().getDefaultRetentionSeconds();
        }
        if (configured instanceof Number) {
            return ((Number) configured).longValue();
        }
        log.warn("Ignoring non-numeric {} for checker {}: {}", RETENTION_KEY, checkerName, configured);
        return properties.getPurge().getDefaultRetentionSeconds();
    }
}
