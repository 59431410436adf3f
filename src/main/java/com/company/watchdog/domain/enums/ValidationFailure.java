package com.company.watchdog.domain.enums;

/**
 * Kinds of requirement validation failures, so callers can test the kind instead of the message.
 */
public enum ValidationFailure {
    BAD_CHARACTERS,
    UNKNOWN_TOKEN,
    DUPLICATE_KEYWORD,
    MALFORMED_VALUE,
    MISSING_KEYWORD,
    MISSING_DAY_OF_WEEK,
    BAD_HOURS_RELATIONSHIP,
    HOURS_OUT_OF_RANGE,
    BAD_MINUTES_RELATIONSHIP,
    MINUTES_OUT_OF_RANGE,
    BAD_MINUTE_STRIDE,
    BAD_MIN_MAX,
    BAD_LOOKBACK
}
