package com.eventtally.service.core.query;

import java.time.Instant;

/** Raised when a range query does not satisfy {@code start < end}. */
public class InvalidTimeRangeException extends IllegalArgumentException {

    private final Instant start;
    private final Instant end;

    public InvalidTimeRangeException(Instant start, Instant end) {
        super("The requested end time must be after start (start=" + start + ", end=" + end + ")");
        this.start = start;
        this.end = end;
    }

    public Instant start() {
        return start;
    }

    public Instant end() {
        return end;
    }
}
