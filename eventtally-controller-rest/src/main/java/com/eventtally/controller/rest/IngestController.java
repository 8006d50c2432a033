package com.eventtally.controller.rest;

import com.eventtally.service.core.aggregation.EventAggregationService;
import com.eventtally.service.core.ingest.RawEventCsvReader;
import com.eventtally.service.core.ingest.RawEventCsvReader.DecodedEvents;
import java.io.StringReader;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Accepts an additional batch of event rows in the same CSV layout as the startup file. */
@RestController
@RequestMapping("/api")
public class IngestController {
    private final EventAggregationService aggregationService;
    private final RawEventCsvReader csvReader;

    public IngestController(EventAggregationService aggregationService, RawEventCsvReader csvReader) {
        this.aggregationService = aggregationService;
        this.csvReader = csvReader;
    }

    @PostMapping(path = "/ingest/events", consumes = {"text/csv", "text/plain"})
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> ingestCsv(@RequestBody String body) {
        try (DecodedEvents events = csvReader.read(new StringReader(body))) {
            aggregationService.ingest(events);
            return Map.of("accepted", events.accepted(), "rejected", events.rejected());
        }
    }
}
