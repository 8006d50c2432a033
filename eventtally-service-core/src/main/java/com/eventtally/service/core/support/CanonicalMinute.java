package com.eventtally.service.core.support;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Canonical minute key used by {@code events_aggregation.minute}.
 *
 * <p>Minutes are stored as UTC text in the form {@code 2021-03-01 14:20:00+00:00}. The fixed width keeps
 * lexicographic order equal to chronological order, so range predicates can compare the text directly.
 */
public final class CanonicalMinute {

    /** Earliest minute the four-digit year form can hold. */
    public static final Instant MIN = Instant.parse("0000-01-01T00:00:00Z");

    /** Latest minute the four-digit year form can hold. */
    public static final Instant MAX = Instant.parse("9999-12-31T23:59:00Z");

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss'+00:00'");

    private CanonicalMinute() {}

    /** Normalises to UTC and truncates seconds and sub-second fields. */
    public static Instant of(OffsetDateTime timestamp) {
        return of(timestamp.toInstant());
    }

    public static Instant of(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MINUTES);
    }

    /** First whole minute at or after the instant. */
    public static Instant ceil(Instant instant) {
        Instant floor = of(instant);
        return floor.equals(instant) ? floor : floor.plus(1, ChronoUnit.MINUTES);
    }

    /** True when the instant falls in a minute between {@link #MIN} and {@link #MAX}. */
    public static boolean isSupported(Instant instant) {
        Instant minute = of(instant);
        return !minute.isBefore(MIN) && !minute.isAfter(MAX);
    }

    public static String format(Instant minute) {
        if (!isSupported(minute)) {
            throw new IllegalArgumentException("Minute outside years 0000-9999: " + minute);
        }
        return FORMAT.format(LocalDateTime.ofInstant(of(minute), ZoneOffset.UTC));
    }

    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Minute text cannot be null or empty");
        }
        try {
            return LocalDateTime.parse(text.trim(), FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Not a canonical minute: " + text, ex);
        }
    }
}
