package com.eventtally.controller.rest;

import com.eventtally.service.core.query.BucketInterval;
import com.eventtally.service.core.query.HourlyCountQueryService;
import com.eventtally.service.core.query.HourlyCountResult;
import com.eventtally.service.core.support.TimestampParser;
import java.time.Instant;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** GET /hourly?customer_id=..&start=2021-03-01 00:30:00+00:00&end=2021-03-01 02:00:00+00:00 */
@RestController
public class HourlyCountController {

    private final HourlyCountQueryService queryService;

    public HourlyCountController(HourlyCountQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping(path = "/hourly", produces = MediaType.APPLICATION_JSON_VALUE)
    public HourlyCountResponse hourly(
            @RequestParam("customer_id") String customerId,
            @RequestParam("start") String start,
            @RequestParam("end") String end,
            @RequestParam(name = "interval", required = false) String interval) {
        Instant from = TimestampParser.parse(start).toInstant();
        Instant to = TimestampParser.parse(end).toInstant();
        HourlyCountResult result =
                queryService.bucketedCounts(customerId, from, to, BucketInterval.fromConfigValue(interval));
        return HourlyCountResponse.from(result);
    }
}
