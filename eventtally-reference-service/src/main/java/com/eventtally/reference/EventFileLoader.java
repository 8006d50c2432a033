package com.eventtally.reference;

import com.eventtally.service.core.aggregation.EventAggregationService;
import com.eventtally.service.core.ingest.RawEventCsvReader;
import com.eventtally.service.core.ingest.RawEventCsvReader.DecodedEvents;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Aggregates the event file named by the first positional argument before anything else runs. */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class EventFileLoader implements ApplicationRunner {

    private final RawEventCsvReader csvReader;
    private final EventAggregationService aggregationService;

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();
        if (files.isEmpty()) {
            log.warn("No event file given; serving previously stored counts only");
            return;
        }
        Path file = Path.of(files.get(0));
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Event file not found: " + file);
        }
        long started = System.nanoTime();
        try (DecodedEvents events = csvReader.open(file)) {
            aggregationService.ingest(events);
            log.info(
                    "Loaded {} accepted={} rejected={} in {} ms",
                    file,
                    events.accepted(),
                    events.rejected(),
                    (System.nanoTime() - started) / 1_000_000);
        }
    }
}
