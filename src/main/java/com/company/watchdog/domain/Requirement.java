package com.company.watchdog.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One schedule + threshold rule of a checker.
 * The minute rule is either a range (minutesLower/minutesUpper) or a stride (minutesStride), never both.
 */
@Value
@Builder
public class Requirement {
    int hoursLower;
    int hoursUpper;
    Integer minutesLower;
    Integer minutesUpper;
    Integer minutesStride;
    boolean includeWeekdays;
    boolean includeWeekends;
    long minNum;
    long maxNum;
    long lookbackSeconds;

    public boolean hasMinuteStride() {
        return minutesStride != null;
    }
}
