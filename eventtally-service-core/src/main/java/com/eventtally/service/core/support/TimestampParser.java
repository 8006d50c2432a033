package com.eventtally.service.core.support;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Parses RFC 3339 style timestamps with an explicit offset.
 *
 * <p>Accepts a space or {@code T} between date and time, an optional fraction of up to nine digits and
 * offsets written as {@code Z}, {@code +HH}, {@code +HHMM} or {@code +HH:MM}. Source files commonly carry
 * the short {@code +00} form.
 */
public final class TimestampParser {

    private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .optionalEnd()
            .optionalStart()
            .appendLiteral(' ')
            .optionalEnd()
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .appendPattern("[XXX][XX][X]")
            .toFormatter();

    private TimestampParser() {}

    public static OffsetDateTime parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Timestamp cannot be null or empty");
        }
        OffsetDateTime parsed;
        try {
            parsed = OffsetDateTime.parse(input.trim(), FORMATTER);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Unsupported timestamp format: " + input, ex);
        }
        if (!CanonicalMinute.isSupported(parsed.toInstant())) {
            throw new IllegalArgumentException("Timestamp outside years 0000-9999 UTC: " + input);
        }
        return parsed;
    }
}
