package com.eventharvester.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * "Today" for year inference, fetch windows and the future-only filter is taken in the venues' zone.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${harvester.zone:Europe/Vienna}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
