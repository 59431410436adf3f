package com.company.watchdog.scheduled;

import com.company.watchdog.service.CheckOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * The polling loop: one pass over all checkers, then a fixed delay before the next one.
 * Fixed delay means passes never overlap.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "dwmon.check.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class CheckPassJob {

    private final CheckOrchestrator orchestrator;
    private final MeterRegistry meterRegistry;

    @Scheduled(
            fixedDelayString = "${dwmon.check.interval-ms:60000}",
            initialDelayString = "${dwmon.check.initial-delay-ms:5000}"
    )
    public void runPass() {
        Instant startTime = Instant.now();

        try {
            int checks = orchestrator.checkAll().size();
            log.info("Check pass finished: {} checks in {}ms",
                    checks, Duration.between(startTime, Instant.now()).toMillis());
        } catch (Exception e) {
            // The pass is abandoned; the next tick starts a fresh one
            log.error("Check pass aborted", e);
            meterRegistry.counter("dwmon.pass.failures").increment();
        } finally {
            meterRegistry.timer("dwmon.pass.duration").record(Duration.between(startTime, Instant.now()));
            log.info("Sleeping...");
        }
    }
}
