package com.eventtally.service.core.query;

import java.time.Instant;
import java.util.List;

public record HourlyCountResult(
        String customerId, Instant start, Instant end, BucketInterval interval, List<HourBucket> buckets) {

    public long total() {
        return buckets.stream().mapToLong(HourBucket::count).sum();
    }
}
