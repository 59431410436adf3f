package com.company.watchdog.service;

import com.company.watchdog.domain.StoredEvent;
import com.company.watchdog.dto.response.HistogramBucketResponse;
import com.company.watchdog.repository.StoredEventRepository;
import com.company.watchdog.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Hour-of-week histogram of stored events, used to pick sensible MINNUM/MAXNUM values.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistogramService {

    private final StoredEventRepository eventRepository;
    private final Clock clock;

    /**
     * Bucket the checker's events from the last {@code lookbackSeconds} by (day of week, hour)
     * in the configured zone, ordered by day then hour.
     */
    public List<HistogramBucketResponse> histogram(String checkerName, long lookbackSeconds, boolean weekdaysOnly) {
        long epochLower = clock.instant().getEpochSecond() - lookbackSeconds;
        ZoneId zone = clock.getZone();

        // key = dayOfWeek * 100 + hour keeps the TreeMap in day/hour order
        Map<Integer, Bucket> buckets = new TreeMap<>();
        List<StoredEvent> events = eventRepository.findSince(checkerName, epochLower);

        for (StoredEvent event : events) {
            ZonedDateTime time = TimeUtils.atZone(event.getTimestamp(), zone);
            DayOfWeek day = time.getDayOfWeek();
            if (weekdaysOnly && (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY)) {
                continue;
            }
            int key = day.getValue() * 100 + time.getHour();
            buckets.computeIfAbsent(key, k -> new Bucket(event.getTimestamp())).add(event.getTimestamp());
        }

        List<HistogramBucketResponse> response = new ArrayList<>();
        buckets.forEach((key, bucket) -> response.add(HistogramBucketResponse.builder()
                .dayOfWeek(key / 100)
                .hour(key % 100)
                .minLocalTime(TimeUtils.formatLocal(bucket.minTimestamp, zone))
                .count(bucket.count)
                .build()));

        log.debug("Histogram for {} over {}s: {} events in {} buckets",
                checkerName, lookbackSeconds, events.size(), response.size());
        return response;
    }

    private static class Bucket {
        private long minTimestamp;
        private long count;

        Bucket(long firstTimestamp) {
            this.minTimestamp = firstTimestamp;
        }

        void add(long timestamp) {
            minTimestamp = Math.min(minTimestamp, timestamp);
            count++;
        }
    }
}
