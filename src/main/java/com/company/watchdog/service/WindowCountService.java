package com.company.watchdog.service;

import com.company.watchdog.domain.CheckResult;
import com.company.watchdog.domain.Requirement;
import com.company.watchdog.domain.enums.CheckStatus;
import com.company.watchdog.repository.StoredEventRepository;
import com.company.watchdog.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Evaluates one checker at one (possibly past) minute.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WindowCountService {

    private final StoredEventRepository eventRepository;
    private final Clock clock;

    /**
     * Count events in [minuteEpoch - lookback, minuteEpoch] and classify the count against the
     * requirement's inclusive bounds. An empty window is a count of 0.
     */
    public CheckResult checkMinute(String checkerName, long minuteEpoch, Requirement requirement) {
        long lookbackSeconds = requirement.getLookbackSeconds();
        long eventCount = eventRepository.countInWindow(
                checkerName, minuteEpoch - lookbackSeconds, minuteEpoch);

        log.info("Found {} events in the {}s window ending {} for checker {}",
                eventCount, lookbackSeconds, minuteEpoch, checkerName);

        return CheckResult.builder()
                .checkerName(checkerName)
                .minuteEpoch(minuteEpoch)
                .minuteLocalTime(TimeUtils.formatLocal(minuteEpoch, clock.getZone()))
                .eventCount(eventCount)
                .minRequired(requirement.getMinNum())
                .maxAllowed(requirement.getMaxNum())
                .status(CheckStatus.forCount(eventCount, requirement.getMinNum(), requirement.getMaxNum()))
                .lookbackSeconds(lookbackSeconds)
                .build();
    }
}
