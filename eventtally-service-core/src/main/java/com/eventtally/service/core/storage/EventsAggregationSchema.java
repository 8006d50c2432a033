package com.eventtally.service.core.storage;

import com.eventtally.service.core.config.EventTallyProperties;
import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

/** Creates the {@code events_aggregation} table, optionally dropping the previous contents first. */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventsAggregationSchema {

    static final String SCHEMA = "db/schema/events_aggregation.sql";
    static final String RESET = "db/schema/events_aggregation-reset.sql";

    private final DataSource dataSource;
    private final EventTallyProperties properties;

    @PostConstruct
    void initialise() {
        if (properties.getStorage().isResetOnStartup()) {
            reset();
        } else {
            create();
        }
    }

    public void create() {
        new ResourceDatabasePopulator(new ClassPathResource(SCHEMA)).execute(dataSource);
        log.info("events_aggregation schema ensured");
    }

    /** Drops every stored minute count and recreates the empty table. */
    public void reset() {
        new ResourceDatabasePopulator(new ClassPathResource(RESET), new ClassPathResource(SCHEMA))
                .execute(dataSource);
        log.info("events_aggregation table dropped and recreated");
    }
}
