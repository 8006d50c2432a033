package com.eventtally.controller.rest;

import com.eventtally.service.core.query.HourBucket;
import com.eventtally.service.core.query.HourlyCountResult;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * JSON body for bucketed counts. Buckets carry only their aligned start; {@code start} and {@code end} echo the
 * request so clients can tell whether the first and last bucket were clamped.
 */
public record HourlyCountResponse(
        String customerId, String start, String end, String interval, List<Bucket> buckets, long total) {

    private static final DateTimeFormatter ISO_INSTANT = DateTimeFormatter.ISO_INSTANT;

    public record Bucket(String start, long count) {}

    public static HourlyCountResponse from(HourlyCountResult result) {
        List<Bucket> buckets = result.buckets().stream()
                .map(HourlyCountResponse::toBucket)
                .toList();
        return new HourlyCountResponse(
                result.customerId(),
                ISO_INSTANT.format(result.start()),
                ISO_INSTANT.format(result.end()),
                result.interval().label(),
                buckets,
                result.total());
    }

    private static Bucket toBucket(HourBucket bucket) {
        return new Bucket(ISO_INSTANT.format(bucket.start()), bucket.count());
    }
}
