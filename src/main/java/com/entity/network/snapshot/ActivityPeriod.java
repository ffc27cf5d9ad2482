package com.entity.network.snapshot;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * Bucket width of an activity timeline. Buckets are UTC days, or weeks starting on Monday.
 */
public enum ActivityPeriod {
    DAY,
    WEEK;

    public LocalDate bucketOf(Instant instant) {
        LocalDate day = instant.atZone(ZoneOffset.UTC).toLocalDate();
        return this == DAY ? day : day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }
}
