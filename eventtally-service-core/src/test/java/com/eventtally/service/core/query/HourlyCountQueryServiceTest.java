package com.eventtally.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.eventtally.service.core.aggregation.EventAggregationService;
import com.eventtally.service.core.model.MinuteCount;
import com.eventtally.service.core.model.RawEvent;
import com.eventtally.service.core.storage.SqliteTestDatabase;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HourlyCountQueryServiceTest {

    @TempDir
    Path tempDir;

    private SqliteTestDatabase database;
    private EventAggregationService aggregationService;
    private HourlyCountQueryService queryService;

    @BeforeEach
    void setUp() {
        database = new SqliteTestDatabase(tempDir);
        aggregationService = new EventAggregationService(database.repository(), database.properties());
        queryService = new HourlyCountQueryService(database.repository(), database.properties());
    }

    @Test
    void clampsFirstBucketAndZeroFillsGaps() {
        aggregationService.ingest(List.of(
                event("C1", "2021-03-01T14:20:00Z"),
                event("C1", "2021-03-01T14:50:00Z"),
                event("C1", "2021-03-01T15:10:00Z"),
                event("C1", "2021-03-01T15:40:00Z"),
                event("C1", "2021-03-01T17:05:00Z"),
                event("C1", "2021-03-01T14:05:00Z"),
                event("C1", "2021-03-01T18:00:00Z"),
                event("C2", "2021-03-01T15:15:00Z")));

        HourlyCountResult result =
                queryService.hourlyCounts("C1", at("2021-03-01T14:15:00Z"), at("2021-03-01T18:00:00Z"));

        assertThat(result.buckets())
                .extracting(HourBucket::start, HourBucket::count)
                .containsExactly(
                        tuple(at("2021-03-01T14:00:00Z"), 2L),
                        tuple(at("2021-03-01T15:00:00Z"), 2L),
                        tuple(at("2021-03-01T16:00:00Z"), 0L),
                        tuple(at("2021-03-01T17:00:00Z"), 1L));
        assertThat(result.total()).isEqualTo(5);
        assertThat(result.interval()).isEqualTo(BucketInterval.H1);
    }

    @Test
    void clampsLastBucketWhenEndIsMidHour() {
        aggregationService.ingest(List.of(
                event("C1", "2021-03-01T17:05:00Z"),
                event("C1", "2021-03-01T17:29:00Z"),
                event("C1", "2021-03-01T17:30:00Z"),
                event("C1", "2021-03-01T17:45:00Z")));

        HourlyCountResult result =
                queryService.hourlyCounts("C1", at("2021-03-01T16:00:00Z"), at("2021-03-01T17:30:00Z"));

        assertThat(result.buckets()).extracting(HourBucket::count).containsExactly(0L, 2L);
        assertThat(result.buckets().get(1).start()).isEqualTo(at("2021-03-01T17:00:00Z"));
    }

    @Test
    void hourBoundaryBelongsToTheRangeThatStartsThere() {
        aggregationService.ingest(List.of(event("C1", "2021-03-01T15:00:00Z")));

        HourlyCountResult endingAtBoundary =
                queryService.hourlyCounts("C1", at("2021-03-01T14:00:00Z"), at("2021-03-01T15:00:00Z"));
        HourlyCountResult startingAtBoundary =
                queryService.hourlyCounts("C1", at("2021-03-01T15:00:00Z"), at("2021-03-01T16:00:00Z"));

        assertThat(endingAtBoundary.buckets()).hasSize(1);
        assertThat(endingAtBoundary.total()).isZero();
        assertThat(startingAtBoundary.buckets()).hasSize(1);
        assertThat(startingAtBoundary.total()).isEqualTo(1);
    }

    @Test
    void subMinuteBoundsOnlyCountWholeMinutesInsideTheRange() {
        aggregationService.ingest(List.of(
                event("C1", "2021-03-01T14:15:10Z"),
                event("C1", "2021-03-01T14:16:00Z"),
                event("C1", "2021-03-01T14:40:30Z")));

        HourlyCountResult result =
                queryService.hourlyCounts("C1", at("2021-03-01T14:15:30Z"), at("2021-03-01T14:40:30Z"));

        // minute 14:15 starts before the range, minute 14:40 starts inside it
        assertThat(result.total()).isEqualTo(2);
    }

    @Test
    void unknownCustomerYieldsZeroFilledBuckets() {
        aggregationService.ingest(List.of(event("C1", "2021-03-01T14:20:00Z")));

        HourlyCountResult result =
                queryService.hourlyCounts("nobody", at("2021-03-01T10:30:00Z"), at("2021-03-01T14:30:00Z"));

        assertThat(result.buckets()).hasSize(5).allSatisfy(bucket -> assertThat(bucket.count()).isZero());
    }

    @Test
    void rejectsEmptyAndInvertedRanges() {
        Instant instant = at("2021-03-01T14:00:00Z");

        assertThatThrownBy(() -> queryService.hourlyCounts("C1", instant, instant))
                .isInstanceOf(InvalidTimeRangeException.class);
        assertThatThrownBy(() -> queryService.hourlyCounts("C1", instant.plusSeconds(1), instant))
                .isInstanceOf(InvalidTimeRangeException.class)
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(database.repository().findAll()).isEmpty();
    }

    @Test
    void rejectsMissingArguments() {
        Instant start = at("2021-03-01T14:00:00Z");
        Instant end = at("2021-03-01T15:00:00Z");

        assertThatThrownBy(() -> queryService.hourlyCounts(" ", start, end))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queryService.hourlyCounts("C1", null, end))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queryService.bucketedCounts("C1", start, end, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bucketTotalsMatchStoredMinutesInRange() {
        Random random = new Random(42L);
        Instant base = at("2021-03-01T00:00:00Z");
        List<RawEvent> events = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            Instant when = base.plusSeconds(random.nextInt(48 * 3600));
            String customer = random.nextBoolean() ? "C1" : "C2";
            events.add(new RawEvent(customer, OffsetDateTime.ofInstant(when, ZoneOffset.UTC)));
        }
        aggregationService.ingest(events);
        List<MinuteCount> stored = database.repository().findAll();

        for (int i = 0; i < 20; i++) {
            Instant start = base.plusSeconds(random.nextInt(40 * 3600));
            Instant end = start.plusSeconds(1 + random.nextInt(10 * 3600));
            HourlyCountResult result = queryService.hourlyCounts("C1", start, end);

            long expected = stored.stream()
                    .filter(row -> row.customerId().equals("C1"))
                    .filter(row -> !row.minute().isBefore(start) && row.minute().isBefore(end))
                    .mapToLong(MinuteCount::eventCount)
                    .sum();
            Instant firstHour = BucketInterval.H1.alignToFloor(start);
            Instant lastHour = BucketInterval.H1.lastBucketBefore(end);
            assertThat(result.total()).isEqualTo(expected);
            assertThat(result.buckets()).hasSize((int) BucketInterval.H1.bucketsBetween(firstHour, lastHour));
            assertThat(result.buckets().get(0).start()).isEqualTo(firstHour);
            assertThat(result.buckets().get(result.buckets().size() - 1).start()).isEqualTo(lastHour);
        }
    }

    @Test
    void rebucketsStoredMinutesIntoQuarterHours() {
        aggregationService.ingest(List.of(
                event("C1", "2021-03-01T14:20:00Z"),
                event("C1", "2021-03-01T14:29:59Z"),
                event("C1", "2021-03-01T14:30:00Z"),
                event("C1", "2021-03-01T14:50:00Z")));

        HourlyCountResult result = queryService.bucketedCounts(
                "C1", at("2021-03-01T14:20:00Z"), at("2021-03-01T15:00:00Z"), BucketInterval.M15);

        assertThat(result.buckets())
                .extracting(HourBucket::start)
                .containsExactly(
                        at("2021-03-01T14:15:00Z"), at("2021-03-01T14:30:00Z"), at("2021-03-01T14:45:00Z"));
        assertThat(result.buckets()).extracting(HourBucket::count).containsExactly(2L, 1L, 1L);
        assertThat(result.buckets().get(0).end()).isEqualTo(at("2021-03-01T14:30:00Z"));
    }

    @Test
    void rejectsBoundsBeyondFourDigitYears() {
        aggregationService.ingest(List.of(event("C1", "2021-03-01T14:20:00Z")));

        assertThatThrownBy(() -> queryService.bucketedCounts(
                        "C1", at("2021-03-01T00:00:00Z"), at("+10000-01-01T00:00:00Z"), BucketInterval.D1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("9999-12-31T23:59:00Z");
        assertThatThrownBy(() -> queryService.hourlyCounts(
                        "C1", at("-0001-12-31T00:00:00Z"), at("2021-03-01T00:00:00Z")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void countsMinutesUpToTheLastRepresentableMinute() {
        aggregationService.ingest(List.of(
                event("C1", "9999-12-31T23:57:00Z"),
                event("C1", "9999-12-31T23:58:30Z"),
                event("C1", "9999-12-31T23:59:00Z")));

        HourlyCountResult result = queryService.bucketedCounts(
                "C1", at("9999-12-01T00:00:00Z"), at("9999-12-31T23:59:00Z"), BucketInterval.D1);

        assertThat(result.buckets()).hasSize(31);
        assertThat(result.total()).isEqualTo(2);
    }

    @Test
    void rejectsRangesWithMoreBucketsThanAllowed() {
        database.properties().getQuery().setMaxBuckets(10);
        Instant start = at("2021-03-01T14:00:00Z");

        assertThat(queryService.bucketedCounts("C1", start, start.plusSeconds(600), BucketInterval.M1).buckets())
                .hasSize(10);
        assertThatThrownBy(() ->
                        queryService.bucketedCounts("C1", start, start.plusSeconds(601), BucketInterval.M1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("11 buckets of 1m");
    }

    @Test
    void defaultLimitRejectsMinuteBucketsOverACentury() {
        assertThatThrownBy(() -> queryService.bucketedCounts(
                        "C1", at("1921-01-01T00:00:00Z"), at("2021-01-01T00:00:00Z"), BucketInterval.M1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("more than the allowed 100000");
        assertThatThrownBy(() -> queryService.hourlyCounts(
                        "C1", at("2021-03-01T00:00:00Z"), at("9999-01-01T00:00:00Z")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static RawEvent event(String customerId, String timestamp) {
        return new RawEvent(customerId, OffsetDateTime.parse(timestamp));
    }

    private static Instant at(String instant) {
        return Instant.parse(instant);
    }
}
