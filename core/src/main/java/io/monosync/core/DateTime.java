// file: core/src/main/java/io/monosync/core/DateTime.java
package io.monosync.core;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Author date: a Unix timestamp plus the author's timezone offset.
 * <p>
 * The offset is the number of seconds to add to local time to get UTC
 * (so UTC+2 is -7200), and must lie within +/-18 hours.
 */
public record DateTime(long epochSeconds, int tzOffsetSeconds) {

    private static final int MAX_OFFSET = 18 * 3600;

    public DateTime {
        if (tzOffsetSeconds < -MAX_OFFSET || tzOffsetSeconds > MAX_OFFSET) {
            throw new IllegalArgumentException("timezone offset out of range: " + tzOffsetSeconds);
        }
    }

    public static DateTime ofEpochSeconds(long epochSeconds) {
        return new DateTime(epochSeconds, 0);
    }

    public OffsetDateTime toOffsetDateTime() {
        return Instant.ofEpochSecond(epochSeconds).atOffset(ZoneOffset.ofTotalSeconds(-tzOffsetSeconds));
    }

    @Override
    public String toString() {
        return toOffsetDateTime().toString();
    }
}
