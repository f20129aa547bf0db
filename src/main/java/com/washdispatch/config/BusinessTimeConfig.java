package com.washdispatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Time sources. Everything persisted is an instant; the business zone only decides calendar dates
 * printed for people (receipt numbers, emails).
 */
@Configuration
public class BusinessTimeConfig {

    @Bean
    public ZoneId businessZoneId(DispatchProperties dispatchProperties) {
        return dispatchProperties.getBusinessZone();
    }

    // grace windows and audit timestamps
    @Bean
    public Clock businessClock() {
        return Clock.systemUTC();
    }
}
