package com.company.watchdog.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistogramBucketResponse {
    /** ISO day of week, 1 = Monday. */
    private int dayOfWeek;
    private int hour;
    private String minLocalTime;
    private long count;
}
