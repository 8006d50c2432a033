package com.eventtally.service.core.query;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;

/**
 * Bucket widths a range query can fold minute counts into. All widths divide a UTC day evenly, so
 * alignment by epoch arithmetic matches calendar alignment.
 */
public enum BucketInterval {
    M1("1m", Duration.ofMinutes(1)),
    M5("5m", Duration.ofMinutes(5)),
    M15("15m", Duration.ofMinutes(15)),
    M30("30m", Duration.ofMinutes(30)),
    H1("1h", Duration.ofHours(1)),
    D1("1d", Duration.ofDays(1));

    private final String label;
    private final Duration duration;

    BucketInterval(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    public String label() {
        return label;
    }

    public Duration duration() {
        return duration;
    }

    /** Aligns the instant down to the start of the containing bucket. */
    public Instant alignToFloor(Instant instant) {
        long bucketSeconds = duration.toSeconds();
        long aligned = Math.floorDiv(instant.getEpochSecond(), bucketSeconds) * bucketSeconds;
        return Instant.ofEpochSecond(aligned);
    }

    /**
     * Start of the bucket holding the last instant before {@code endExclusive}. When the end sits exactly on a
     * boundary the bucket that starts there is not part of the half-open range.
     */
    public Instant lastBucketBefore(Instant endExclusive) {
        Instant aligned = alignToFloor(endExclusive);
        return aligned.equals(endExclusive) ? aligned.minus(duration) : aligned;
    }

    /** Number of buckets from {@code first} to {@code last}, both aligned and inclusive. */
    public long bucketsBetween(Instant first, Instant last) {
        return Duration.between(first, last).toSeconds() / duration.toSeconds() + 1;
    }

    public static BucketInterval fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return H1;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (BucketInterval interval : values()) {
            if (interval.name().equals(normalized)
                    || interval.label.toUpperCase(Locale.ROOT).equals(normalized)) {
                return interval;
            }
        }
        Duration parsed;
        try {
            parsed = Duration.parse(normalized);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Unsupported bucket interval: " + value);
        }
        return Arrays.stream(values())
                .filter(interval -> interval.duration.equals(parsed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported bucket interval: " + value));
    }
}
