package com.eventtally.service.core.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/** One observed customer event, as decoded from the source. Never persisted. */
public record RawEvent(String customerId, OffsetDateTime timestamp) {

    public RawEvent {
        Objects.requireNonNull(customerId, "customerId");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
