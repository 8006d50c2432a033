package com.eventtally.service.core.aggregation;

import com.eventtally.service.core.config.EventTallyProperties;
import com.eventtally.service.core.model.RawEvent;
import com.eventtally.service.core.support.CanonicalMinute;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Folds raw events into per-customer, per-minute counters. Input order does not matter: every event becomes
 * an atomic increment of its (customer, minute) row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventAggregationService {

    private final MinuteCountRepository repository;
    private final EventTallyProperties properties;

    public void ingest(Iterable<RawEvent> events) {
        Objects.requireNonNull(events, "events");
        EventTallyProperties.Ingest settings = properties.getIngest();
        int batchSize = Math.max(1, settings.getBatchSize());
        int attempts = Math.max(1, settings.getBusyRetries());

        MinuteCountBuffer buffer = new MinuteCountBuffer();
        long applied = 0;
        int flushes = 0;
        for (RawEvent event : events) {
            if (buffer.size() >= batchSize) {
                applied += flush(buffer, applied, attempts);
                flushes++;
            }
            buffer.increment(event.customerId(), CanonicalMinute.of(event.timestamp()));
        }
        if (!buffer.isEmpty()) {
            applied += flush(buffer, applied, attempts);
            flushes++;
        }
        log.info("Ingest complete events={} flushes={}", applied, flushes);
    }

    private long flush(MinuteCountBuffer buffer, long appliedSoFar, int attempts) {
        List<MinuteCountRepository.MinuteDelta> batch = buffer.drain();
        long events = buffer.events();
        try {
            repository.upsertBatch(batch, attempts);
        } catch (DataAccessException ex) {
            throw new AggregationIngestException(
                    "Ingestion aborted after " + appliedSoFar + " applied events", appliedSoFar, ex);
        }
        buffer.clear();
        log.debug("Flushed minute counts keys={} events={}", batch.size(), events);
        return events;
    }
}
