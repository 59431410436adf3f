package com.company.watchdog.domain;

import lombok.Value;

/**
 * Answer of a row purger. A null epoch means nothing should be deleted this time.
 */
@Value
public class PurgeDecision {
    Long deleteOlderThanEpoch;

    public static PurgeDecision skip() {
        return new PurgeDecision(null);
    }

    public static PurgeDecision deleteOlderThan(long epoch) {
        return new PurgeDecision(epoch);
    }

    public boolean shouldDelete() {
        return deleteOlderThanEpoch != null;
    }
}
