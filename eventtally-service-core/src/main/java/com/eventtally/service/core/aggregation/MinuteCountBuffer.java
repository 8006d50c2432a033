package com.eventtally.service.core.aggregation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pre-aggregates raw events of one ingest call by (customer, minute) so each key costs a single upsert per
 * flush. Not thread-safe; each ingest call owns its buffer.
 */
class MinuteCountBuffer {

    record MinuteKey(String customerId, Instant minute) {}

    private final Map<MinuteKey, Long> counts = new HashMap<>();
    private long events;

    void increment(String customerId, Instant minute) {
        counts.merge(new MinuteKey(customerId, minute), 1L, Long::sum);
        events++;
    }

    int size() {
        return counts.size();
    }

    long events() {
        return events;
    }

    boolean isEmpty() {
        return counts.isEmpty();
    }

    /** Buffered deltas ordered by customer then minute. */
    List<MinuteCountRepository.MinuteDelta> drain() {
        List<MinuteCountRepository.MinuteDelta> batch = new ArrayList<>(counts.size());
        counts.forEach((key, delta) ->
                batch.add(new MinuteCountRepository.MinuteDelta(key.customerId(), key.minute(), delta)));
        batch.sort(Comparator.comparing(MinuteCountRepository.MinuteDelta::customerId)
                .thenComparing(MinuteCountRepository.MinuteDelta::minute));
        return batch;
    }

    void clear() {
        counts.clear();
        events = 0;
    }
}
