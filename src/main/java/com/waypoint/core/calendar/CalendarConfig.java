package com.waypoint.core.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CalendarConfig {

    private static final Logger log = LoggerFactory.getLogger(CalendarConfig.class);

    /**
     * Fallback when no calendar backend bean is provided. Items live only as long as the process.
     */
    @Bean
    @ConditionalOnMissingBean(CalendarGateway.class)
    public CalendarGateway inMemoryCalendarGateway() {
        log.info("No calendar backend configured; using in-memory calendar");
        return new InMemoryCalendarGateway();
    }
}
