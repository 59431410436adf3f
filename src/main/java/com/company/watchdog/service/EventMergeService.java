package com.company.watchdog.service;

import com.company.watchdog.domain.FetchedRow;
import com.company.watchdog.domain.StoredEvent;
import com.company.watchdog.repository.StoredEventRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges freshly fetched rows into the event store with per-checker dedup on the unique id.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EventMergeService {

    private final StoredEventRepository eventRepository;
    private final MeterRegistry meterRegistry;

    /**
     * Insert the rows whose unique id is neither stored for the checker nor repeated earlier in the batch.
     * Duplicates are dropped, never updated.
     *
     * @return number of events inserted
     */
    @Transactional
    public int merge(String checkerName, List<FetchedRow> rows) {
        Set<String> existingIds = eventRepository.findUniqueIds(checkerName);
        Set<String> seenInBatch = new HashSet<>();
        List<StoredEvent> toInsert = new ArrayList<>();

        for (FetchedRow row : rows) {
            String id = row.getUniqueId();
            if (id == null || existingIds.contains(id) || !seenInBatch.add(id)) {
                continue;
            }
            toInsert.add(StoredEvent.builder()
                    .checker(checkerName)
                    .uniqueId(id)
                    .timestamp(row.getTimestamp())
                    .build());
        }

        int inserted = eventRepository.insertAll(toInsert);
        log.debug("Merged {} rows for checker {}: {} new", rows.size(), checkerName, inserted);
        meterRegistry.counter("dwmon.events.inserted", "checker", checkerName).increment(inserted);
        return inserted;
    }
}
