package com.company.watchdog.service;

import com.company.watchdog.config.WatchdogProperties;
import com.company.watchdog.domain.CheckAudit;
import com.company.watchdog.domain.CheckResult;
import com.company.watchdog.domain.Checker;
import com.company.watchdog.domain.FetchedRow;
import com.company.watchdog.domain.PurgeDecision;
import com.company.watchdog.domain.Requirement;
import com.company.watchdog.exception.ConfigParseException;
import com.company.watchdog.plugin.CheckHandler;
import com.company.watchdog.plugin.CheckerConfigSource;
import com.company.watchdog.plugin.RowFetcher;
import com.company.watchdog.plugin.RowPurger;
import com.company.watchdog.repository.CheckAuditRepository;
import com.company.watchdog.repository.StoredEventRepository;
import com.company.watchdog.schedule.EligibilityCalculator;
import com.company.watchdog.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the checks of every checker.
 *
 * <p>For each requirement of a checker: find the eligible minutes, refresh the event store from
 * the checker's source once if any minute is due, then for every eligible minute count the window,
 * hand the result to the {@link CheckHandler}, record the minute in the audit log and give the
 * {@link RowPurger} a chance to trim old events.
 *
 * <p>Errors propagate. A minute is only audited after its count and handler call succeeded, so
 * a failed refresh or count never marks a minute as checked, while minutes audited earlier in
 * the same loop stay recorded.
 *
 * <p>Eligible minutes are handled newest first. Once the newest one is audited it becomes the
 * checker's floor, so if a later, older minute of the same loop fails, that minute and the older
 * ones after it are below the floor on the next pass and are never retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CheckOrchestrator {

    private final CheckerConfigSource configSource;
    private final EligibilityCalculator eligibilityCalculator;
    private final RowFetcher rowFetcher;
    private final EventMergeService mergeService;
    private final WindowCountService windowCountService;
    private final CheckHandler checkHandler;
    private final RowPurger rowPurger;
    private final CheckAuditRepository auditRepository;
    private final StoredEventRepository eventRepository;
    private final WatchdogProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, ReentrantLock> checkerLocks = new ConcurrentHashMap<>();

    /**
     * One pass over all discovered checkers, in name order.
     *
     * <p>By default the first failing checker aborts the pass. With
     * {@code dwmon.check.isolate-failures} the failure is logged and the next checker runs.
     */
    public List<CheckResult> checkAll() {
        List<String> checkerNames = configSource.listCheckerNames();
        if (checkerNames.isEmpty()) {
            log.warn("No checker names found. Is the configs dir {} empty?", properties.getConfigsDir());
            return List.of();
        }

        List<CheckResult> results = new ArrayList<>();
        int failureCount = 0;

        for (String checkerName : checkerNames) {
            try {
                results.addAll(checkChecker(checkerName));
            } catch (RuntimeException e) {
                meterRegistry.counter("dwmon.checker.failures", "checker", checkerName).increment();
                if (!properties.getCheck().isIsolateFailures()) {
                    throw e;
                }
                failureCount++;
                log.error("Checks failed for checker {}, continuing with the remaining checkers",
                        checkerName, e);
            }
        }

        log.info("Check pass completed: {} checkers, {} checks run, {} failed checkers",
                checkerNames.size(), results.size(), failureCount);
        return results;
    }

    public List<CheckResult> checkChecker(String checkerName) {
        Checker checker;
        try {
            checker = configSource.load(checkerName);
        } catch (ConfigParseException e) {
            log.error("Couldn't parse config for checker {}: {}", checkerName, e.getMessage());
            throw e;
        }
        return runChecks(checker);
    }

    /**
     * Run every requirement of an already loaded checker. A second concurrent call for the same
     * checker is skipped rather than interleaved with the running one.
     */
    public List<CheckResult> runChecks(Checker checker) {
        ReentrantLock lock = checkerLocks.computeIfAbsent(checker.getName(), name -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.warn("Checks for checker {} already in progress, skipping", checker.getName());
            return List.of();
        }

        try {
            List<CheckResult> results = new ArrayList<>();
            for (Requirement requirement : checker.getRequirements()) {
                results.addAll(runRequirement(checker, requirement));
            }
            return results;
        } finally {
            lock.unlock();
        }
    }

    private List<CheckResult> runRequirement(Checker checker, Requirement requirement) {
        String checkerName = checker.getName();

        // The floor is shared by all requirements of the checker
        OptionalLong lastChecked = auditRepository.findLatestMinute(checkerName);
        List<Long> eligibleMinutes = eligibilityCalculator.eligibleMinutes(requirement, lastChecked);

        if (eligibleMinutes.isEmpty()) {
            log.debug("No eligible minutes for checker {}", checkerName);
            return List.of();
        }

        refreshEvents(checker);

        long now = clock.instant().getEpochSecond();
        List<CheckResult> results = new ArrayList<>();

        for (long minuteEpoch : eligibleMinutes) {
            log.info("Checking history for {}: eligible minute is {} minutes ago",
                    checkerName, TimeUtils.minutesBetween(minuteEpoch, now));

            CheckResult result = windowCountService.checkMinute(checkerName, minuteEpoch, requirement);
            checkHandler.handle(result, extraConfigOf(checker));
            auditRepository.save(CheckAudit.builder()
                    .checker(checkerName)
                    .minuteEpoch(minuteEpoch)
                    .build());

            meterRegistry.counter("dwmon.checks",
                    "checker", checkerName,
                    "status", result.getStatus().name()
            ).increment();
            results.add(result);

            purgeOldEvents(checker);
        }

        return results;
    }

    private void refreshEvents(Checker checker) {
        List<FetchedRow> rows = rowFetcher.fetch(checker.getQueryDetails());
        int inserted = mergeService.merge(checker.getName(), rows);

        log.info("Refreshed checker {} from source {}: {} rows fetched, {} new",
                checker.getName(), checker.getQueryDetails().getSource(), rows.size(), inserted);
    }

    private void purgeOldEvents(Checker checker) {
        PurgeDecision decision = rowPurger.identifyOld(checker.getName(), extraConfigOf(checker));
        if (decision == null || !decision.shouldDelete()) {
            return;
        }

        log.info("Purging old rows for checker {}", checker.getName());
        int deleted = eventRepository.deleteOlderThan(checker.getName(), decision.getDeleteOlderThanEpoch());
        meterRegistry.counter("dwmon.events.purged", "checker", checker.getName()).increment(deleted);
    }

    private static Map<String, Object> extraConfigOf(Checker checker) {
        return checker.getExtraConfig() != null ? checker.getExtraConfig() : Map.of();
    }
}
