package com.example.notification.shared.util;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Conversions between local date-times and UTC epoch milliseconds.
 * <p>
 * The two directions are exact inverses for any local time that maps to a single instant.
 * Local times inside a daylight-saving gap or overlap are resolved the way
 * {@link LocalDateTime#atZone(ZoneId)} resolves them and may not round-trip.
 * <p>
 * Values beyond the range of a {@code long} millisecond count saturate to {@link Long#MAX_VALUE} or
 * {@link Long#MIN_VALUE} instead of overflowing.
 */
public final class EpochTimeUtils {

    private static final Instant MAX_MILLI_INSTANT = Instant.ofEpochMilli(Long.MAX_VALUE);
    private static final Instant MIN_MILLI_INSTANT = Instant.ofEpochMilli(Long.MIN_VALUE);
    private static final Duration MAX_MILLI_DURATION = Duration.ofMillis(Long.MAX_VALUE);
    private static final Duration MIN_MILLI_DURATION = Duration.ofMillis(Long.MIN_VALUE);

    private EpochTimeUtils() {}

    public static long toEpochMilli(LocalDateTime dateTime) {
        return toEpochMilli(dateTime, ZoneId.systemDefault());
    }

    /**
     * Converts a local date-time to epoch milliseconds, flooring any sub-millisecond part.
     *
     * @param dateTime the local date-time, interpreted in {@code zone}
     * @param zone     the zone the date-time is expressed in
     * @return milliseconds since 1970-01-01T00:00:00Z
     */
    public static long toEpochMilli(LocalDateTime dateTime, ZoneId zone) {
        Instant instant = dateTime.atZone(zone).toInstant();
        if (instant.isAfter(MAX_MILLI_INSTANT)) {
            return Long.MAX_VALUE;
        }
        if (instant.isBefore(MIN_MILLI_INSTANT)) {
            return Long.MIN_VALUE;
        }
        // Instant.toEpochMilli floors towards negative infinity for pre-epoch values too
        return instant.toEpochMilli();
    }

    /**
     * Converts a duration to whole milliseconds, saturating at the {@code long} range.
     */
    public static long toMillis(Duration duration) {
        if (duration.compareTo(MAX_MILLI_DURATION) > 0) {
            return Long.MAX_VALUE;
        }
        if (duration.compareTo(MIN_MILLI_DURATION) < 0) {
            return Long.MIN_VALUE;
        }
        return duration.toMillis();
    }

    public static LocalDateTime fromEpochMilli(long epochMilli) {
        return fromEpochMilli(epochMilli, ZoneId.systemDefault());
    }

    public static LocalDateTime fromEpochMilli(long epochMilli, ZoneId zone) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMilli), zone);
    }
}
