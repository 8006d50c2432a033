package com.eventtally.service.core.query;

import java.time.Duration;
import java.time.Instant;

/**
 * One bucket of a range query, labelled by its aligned start. The first and last bucket of a result may only
 * have counted part of their span when the requested range starts or ends mid-bucket.
 */
public record HourBucket(Instant start, Duration width, long count) {

    public Instant end() {
        return start.plus(width);
    }
}
