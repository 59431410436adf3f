package com.company.watchdog.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckAuditResponse {
    private String checker;
    private long minuteEpoch;
    private String minuteLocalTime;
}
