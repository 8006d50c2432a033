package com.eventtally.service.core.aggregation;

/**
 * Storage failure during ingestion. Flushes committed before the failure stay applied; {@link #appliedEvents()}
 * tells how many events of the call were counted.
 */
public class AggregationIngestException extends RuntimeException {

    private final long appliedEvents;

    public AggregationIngestException(String message, long appliedEvents, Throwable cause) {
        super(message, cause);
        this.appliedEvents = appliedEvents;
    }

    public long appliedEvents() {
        return appliedEvents;
    }
}
