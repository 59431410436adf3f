package com.company.watchdog.schedule;

import com.company.watchdog.domain.Requirement;
import com.company.watchdog.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Decides which past whole minutes are due for a check.
 *
 * <p>The checking loop may run late, so instead of only looking at "now" it walks back over
 * ten times the lookback width (in minutes) and asks, for every minute, whether a check would
 * have been scheduled at that moment. Minutes at or before the last audited minute are never
 * returned again.
 *
 * <p>Candidates are produced newest first and the returned list keeps that order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EligibilityCalculator {

    static final int RETROACTIVE_FACTOR = 10;

    private final Clock clock;

    public List<Long> eligibleMinutes(Requirement requirement, OptionalLong lastChecked) {
        return eligibleMinutes(requirement, lastChecked, clock.instant().getEpochSecond());
    }

    public List<Long> eligibleMinutes(Requirement requirement, OptionalLong lastChecked, long nowEpochSecond) {
        long minuteNow = TimeUtils.floorToMinute(nowEpochSecond);
        long candidateCount = TimeUtils.ceilMinutes(requirement.getLookbackSeconds()) * RETROACTIVE_FACTOR;

        List<Long> eligible = new ArrayList<>();
        for (long i = 0; i < candidateCount; i++) {
            long minuteEpoch = minuteNow - TimeUtils.SECONDS_PER_MINUTE * i;
            if (lastChecked.isPresent() && minuteEpoch <= lastChecked.getAsLong()) {
                // Every remaining candidate is older still
                break;
            }
            if (matchesTimePattern(requirement, minuteEpoch)) {
                eligible.add(minuteEpoch);
            }
        }

        log.debug("{} of {} candidate minutes eligible (last checked: {})",
                eligible.size(), candidateCount, lastChecked.isPresent() ? lastChecked.getAsLong() : "never");
        return eligible;
    }

    /**
     * Whether the epoch falls on a minute, hour and day of week selected by the requirement,
     * evaluated in the clock's zone.
     */
    public boolean matchesTimePattern(Requirement requirement, long epochSecond) {
        ZonedDateTime time = TimeUtils.atZone(epochSecond, clock.getZone());

        int minute = time.getMinute();
        if (requirement.hasMinuteStride()) {
            if (minute % requirement.getMinutesStride() != 0) {
                return false;
            }
        } else if (minute < requirement.getMinutesLower() || minute > requirement.getMinutesUpper()) {
            return false;
        }

        int hour = time.getHour();
        if (hour < requirement.getHoursLower() || hour > requirement.getHoursUpper()) {
            return false;
        }

        boolean weekend = isWeekend(time.getDayOfWeek());
        return weekend ? requirement.isIncludeWeekends() : requirement.isIncludeWeekdays();
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
