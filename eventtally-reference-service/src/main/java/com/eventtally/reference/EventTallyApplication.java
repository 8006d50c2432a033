package com.eventtally.reference;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Usage: {@code EventTallyApplication <events.csv> [--server] [--customer_id=..] [--start=..] [--end=..]}.
 *
 * <p>The event file is aggregated at startup. With {@code --server} the HTTP API is served, otherwise the
 * query given on the command line is answered and the process exits.
 */
@Slf4j
@SpringBootApplication(scanBasePackages = {"com.eventtally"})
public class EventTallyApplication {

    public static void main(String[] args) {
        WebApplicationType type = webApplicationType(args);
        log.info("Starting eventtally in {} mode", type == WebApplicationType.SERVLET ? "server" : "command-line");
        new SpringApplicationBuilder(EventTallyApplication.class).web(type).run(args);
    }

    static WebApplicationType webApplicationType(String... args) {
        return new DefaultApplicationArguments(args).containsOption(HourlyCountCommand.SERVER_OPTION)
                ? WebApplicationType.SERVLET
                : WebApplicationType.NONE;
    }
}
