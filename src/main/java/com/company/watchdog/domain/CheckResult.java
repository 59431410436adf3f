package com.company.watchdog.domain;

import com.company.watchdog.domain.enums.CheckStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CheckResult {
    String checkerName;
    long minuteEpoch;
    String minuteLocalTime;
    long eventCount;
    long minRequired;
    long maxAllowed;
    CheckStatus status;
    long lookbackSeconds;
}
