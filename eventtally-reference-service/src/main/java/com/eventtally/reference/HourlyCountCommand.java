package com.eventtally.reference;

import com.eventtally.service.core.query.HourBucket;
import com.eventtally.service.core.query.HourlyCountQueryService;
import com.eventtally.service.core.query.HourlyCountResult;
import com.eventtally.service.core.support.TimestampParser;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Answers the hourly count query given on the command line when not running as a server. */
@Component
@Order(2)
public class HourlyCountCommand implements ApplicationRunner {

    static final String SERVER_OPTION = "server";
    static final String USAGE = "Missing one of required args: customer_id, start or end";

    private final HourlyCountQueryService queryService;
    private final PrintStream out;

    @Autowired
    public HourlyCountCommand(HourlyCountQueryService queryService) {
        this(queryService, System.out);
    }

    HourlyCountCommand(HourlyCountQueryService queryService, PrintStream out) {
        this.queryService = queryService;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(SERVER_OPTION)) {
            return;
        }
        String customerId = option(args, "customer_id");
        String start = option(args, "start");
        String end = option(args, "end");
        if (customerId == null || start == null || end == null) {
            out.println(USAGE);
            return;
        }
        Instant from = TimestampParser.parse(start).toInstant();
        Instant to = TimestampParser.parse(end).toInstant();
        HourlyCountResult result = queryService.hourlyCounts(customerId, from, to);
        for (HourBucket bucket : result.buckets()) {
            out.println(bucket.start() + " " + bucket.count());
        }
        out.println("total " + result.total());
    }

    private String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
