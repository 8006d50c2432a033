package com.eventtally.service.core.query;

import com.eventtally.service.core.aggregation.MinuteCountRepository;
import com.eventtally.service.core.config.EventTallyProperties;
import com.eventtally.service.core.support.CanonicalMinute;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rebuilds bucketed counts from stored minute counts.
 *
 * <p>A query over {@code [start, end)} yields one bucket per aligned interval from the bucket containing
 * {@code start} to the bucket containing the last instant before {@code end}, zero-filled where nothing was
 * recorded. Only minutes inside the requested range are counted, so the first and last bucket are clamped
 * when the range starts or ends mid-bucket.
 *
 * <p>Bounds must lie between {@link CanonicalMinute#MIN} and {@link CanonicalMinute#MAX}, and the range may
 * span at most {@code eventtally.query.max-buckets} buckets.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HourlyCountQueryService {

    private final MinuteCountRepository repository;
    private final EventTallyProperties properties;

    public HourlyCountResult hourlyCounts(String customerId, Instant start, Instant end) {
        return bucketedCounts(customerId, start, end, BucketInterval.H1);
    }

    public HourlyCountResult bucketedCounts(String customerId, Instant start, Instant end, BucketInterval interval) {
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("customerId is required");
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
        if (interval == null) {
            throw new IllegalArgumentException("interval is required");
        }
        if (!end.isAfter(start)) {
            throw new InvalidTimeRangeException(start, end);
        }
        if (start.isBefore(CanonicalMinute.MIN) || end.isAfter(CanonicalMinute.MAX)) {
            throw new IllegalArgumentException("start and end must lie between " + CanonicalMinute.MIN + " and "
                    + CanonicalMinute.MAX);
        }

        Instant firstBucket = interval.alignToFloor(start);
        Instant lastBucket = interval.lastBucketBefore(end);
        long span = interval.bucketsBetween(firstBucket, lastBucket);
        int maxBuckets = properties.getQuery().getMaxBuckets();
        if (span > maxBuckets) {
            throw new IllegalArgumentException("Range spans " + span + " buckets of " + interval.label()
                    + ", more than the allowed " + maxBuckets);
        }
        int bucketCount = (int) span;
        long bucketSeconds = interval.duration().toSeconds();
        long[] counts = new long[bucketCount];

        // a whole minute m lies in [start, end) exactly when ceil(start) <= m < ceil(end)
        repository.forEachMinute(customerId, CanonicalMinute.ceil(start), CanonicalMinute.ceil(end), row -> {
            long offset = Duration.between(firstBucket, row.minute()).toSeconds() / bucketSeconds;
            counts[(int) offset] += row.eventCount();
        });

        Duration width = interval.duration();
        List<HourBucket> buckets = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            buckets.add(new HourBucket(firstBucket.plus(width.multipliedBy(i)), width, counts[i]));
        }
        HourlyCountResult result = new HourlyCountResult(customerId, start, end, interval, List.copyOf(buckets));
        log.debug(
                "Bucketed count customer={} interval={} buckets={} total={}",
                customerId,
                interval.label(),
                bucketCount,
                result.total());
        return result;
    }
}
