package com.eventtally.service.core.aggregation;

import com.eventtally.service.core.model.MinuteCount;
import com.eventtally.service.core.support.CanonicalMinute;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

/** JDBC access to {@code events_aggregation}. */
@Repository
@RequiredArgsConstructor
@Slf4j
public class MinuteCountRepository {

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private static final String UPSERT_SQL =
            """
            INSERT INTO events_aggregation (customer_id, minute, event_count)
            VALUES (?, ?, ?)
            ON CONFLICT (customer_id, minute)
            DO UPDATE SET event_count = event_count + excluded.event_count
            """;

    private static final String RANGE_SQL =
            """
            SELECT customer_id, minute, event_count
            FROM events_aggregation
            WHERE customer_id = :customerId
              AND minute >= :fromInclusive
              AND minute < :toExclusive
            ORDER BY minute
            """;

    private static final String ALL_SQL =
            """
            SELECT customer_id, minute, event_count
            FROM events_aggregation
            ORDER BY customer_id, minute
            """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionTemplate txTemplate;

    /**
     * Adds every delta to its (customer, minute) row in one transaction, creating rows that do not exist yet.
     * A busy database is retried as a whole; the rolled back attempt leaves no partial increments behind.
     */
    public void upsertBatch(List<MinuteDelta> batch, int maxAttempts) {
        if (batch.isEmpty()) {
            return;
        }
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                txTemplate.executeWithoutResult(status -> executeBatch(batch));
                return;
            } catch (DataAccessException ex) {
                if (attempts >= maxAttempts || !isBusy(ex)) {
                    throw ex;
                }
                long base = 50L << Math.min(attempts, 6);
                long backoffMs = Math.min(ThreadLocalRandom.current().nextLong(base, base * 2), 5_000L);
                log.warn(
                        "Database busy while upserting {} minute counts. Retrying attempt {}/{} after {} ms",
                        batch.size(),
                        attempts + 1,
                        maxAttempts,
                        backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ex;
                }
            }
        }
    }

    private void executeBatch(List<MinuteDelta> batch) {
        jdbcTemplate.batchUpdate(UPSERT_SQL, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                MinuteDelta item = batch.get(i);
                ps.setString(1, item.customerId());
                ps.setString(2, CanonicalMinute.format(item.minute()));
                ps.setLong(3, item.delta());
            }

            @Override
            public int getBatchSize() {
                return batch.size();
            }
        });
    }

    /** Streams the customer's minute rows in {@code [fromInclusive, toExclusive)}, oldest first. */
    public void forEachMinute(
            String customerId, Instant fromInclusive, Instant toExclusive, Consumer<MinuteCount> consumer) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("customerId", customerId)
                .addValue("fromInclusive", CanonicalMinute.format(fromInclusive))
                .addValue("toExclusive", CanonicalMinute.format(toExclusive));
        namedJdbcTemplate.query(RANGE_SQL, params, rs -> {
            consumer.accept(new MinuteCount(
                    rs.getString("customer_id"),
                    CanonicalMinute.parse(rs.getString("minute")),
                    rs.getLong("event_count")));
        });
    }

    public List<MinuteCount> findAll() {
        return jdbcTemplate.query(
                ALL_SQL,
                (rs, rowNum) -> new MinuteCount(
                        rs.getString("customer_id"),
                        CanonicalMinute.parse(rs.getString("minute")),
                        rs.getLong("event_count")));
    }

    private boolean isBusy(Throwable ex) {
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof SQLException sqlEx) {
                int primary = sqlEx.getErrorCode() & 0xFF;
                if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
                    return true;
                }
            }
            cause = cause.getCause();
        }
        return false;
    }

    public record MinuteDelta(String customerId, Instant minute, long delta) {}
}
