package com.company.watchdog.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public class TimeUtils {

    public static final long SECONDS_PER_MINUTE = 60;

    private static final DateTimeFormatter LOCAL_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TimeUtils() {
    }

    /**
     * Round an epoch second down to the start of its minute.
     */
    public static long floorToMinute(long epochSecond) {
        return Math.floorDiv(epochSecond, SECONDS_PER_MINUTE) * SECONDS_PER_MINUTE;
    }

    /**
     * Number of whole minutes needed to cover the given seconds, rounding up.
     */
    public static long ceilMinutes(long seconds) {
        return -Math.floorDiv(-seconds, SECONDS_PER_MINUTE);
    }

    public static ZonedDateTime atZone(long epochSecond, ZoneId zone) {
        return Instant.ofEpochSecond(epochSecond).atZone(zone);
    }

    public static String formatLocal(long epochSecond, ZoneId zone) {
        LocalDateTime local = LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSecond), zone);
        return LOCAL_TIME_FORMAT.format(local);
    }

    public static long minutesBetween(long earlierEpochSecond, long laterEpochSecond) {
        return (laterEpochSecond - earlierEpochSecond) / SECONDS_PER_MINUTE;
    }
}
