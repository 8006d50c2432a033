package com.eventtally.service.core.ingest;

import com.eventtally.service.core.model.RawEvent;
import com.eventtally.service.core.support.TimestampParser;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.Iterator;
import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes header-less {@code customer_id,event_type,transaction_id,timestamp} rows into {@link RawEvent}s.
 * Rows without a customer id or with an unreadable timestamp are skipped and counted as rejected.
 */
@Component
@Slf4j
public class RawEventCsvReader {

    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn("customer_id")
            .addColumn("event_type")
            .addColumn("transaction_id")
            .addColumn("timestamp")
            .build()
            .withoutHeader();

    private final ObjectReader rowReader;

    public RawEventCsvReader() {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
        this.rowReader = mapper.readerFor(EventRow.class).with(SCHEMA);
    }

    public DecodedEvents open(Path file) {
        try {
            return read(Files.newBufferedReader(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot open event file " + file, ex);
        }
    }

    /** Lazily decodes rows from the reader; the returned handle owns and closes it. */
    public DecodedEvents read(Reader reader) {
        try {
            return new DecodedEvents(rowReader.readValues(reader));
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read event rows", ex);
        }
    }

    record EventRow(
            @JsonProperty("customer_id") String customerId,
            @JsonProperty("event_type") String eventType,
            @JsonProperty("transaction_id") String transactionId,
            @JsonProperty("timestamp") String timestamp) {}

    /** Single-pass view over decoded rows. */
    public static final class DecodedEvents implements Iterable<RawEvent>, AutoCloseable {

        private final MappingIterator<EventRow> rows;
        private long accepted;
        private long rejected;
        private boolean consumed;

        DecodedEvents(MappingIterator<EventRow> rows) {
            this.rows = rows;
        }

        public long accepted() {
            return accepted;
        }

        public long rejected() {
            return rejected;
        }

        @Override
        public Iterator<RawEvent> iterator() {
            if (consumed) {
                throw new IllegalStateException("Event rows can only be iterated once");
            }
            consumed = true;
            return new Iterator<>() {
                private RawEvent next;

                @Override
                public boolean hasNext() {
                    if (next == null) {
                        next = advance();
                    }
                    return next != null;
                }

                @Override
                public RawEvent next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    RawEvent current = next;
                    next = null;
                    return current;
                }
            };
        }

        private RawEvent advance() {
            try {
                while (rows.hasNextValue()) {
                    EventRow row = rows.nextValue();
                    RawEvent event = toEvent(row);
                    if (event != null) {
                        accepted++;
                        return event;
                    }
                    rejected++;
                }
                return null;
            } catch (IOException ex) {
                throw new UncheckedIOException("Malformed event file", ex);
            }
        }

        private RawEvent toEvent(EventRow row) {
            long line = rows.getCurrentLocation().getLineNr();
            if (row.customerId() == null || row.customerId().isBlank()) {
                log.warn("Skipping event row near line {}: missing customer id", line);
                return null;
            }
            try {
                OffsetDateTime timestamp = TimestampParser.parse(row.timestamp());
                return new RawEvent(row.customerId(), timestamp);
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping event row near line {}: {}", line, ex.getMessage());
                return null;
            }
        }

        @Override
        public void close() {
            try {
                rows.close();
            } catch (IOException ex) {
                throw new UncheckedIOException("Cannot close event file", ex);
            }
        }
    }
}
