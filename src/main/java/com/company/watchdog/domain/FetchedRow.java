package com.company.watchdog.domain;

import lombok.Value;

/**
 * A row returned by a row fetcher: only the unique id and the epoch-seconds timestamp are kept.
 */
@Value
public class FetchedRow {
    String uniqueId;
    long timestamp;
}
