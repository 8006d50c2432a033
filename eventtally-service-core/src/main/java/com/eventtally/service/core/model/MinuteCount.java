package com.eventtally.service.core.model;

import java.time.Instant;

/** Persisted count of events for one customer within one UTC minute. */
public record MinuteCount(String customerId, Instant minute, long eventCount) {}
