package com.updesk.helpdesk.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Miscellaneous application-wide beans that don't belong in specific features.
 */
@Configuration
public class AppConfig {

    /**
     * Wall clock in the help desk's zone; "today" in triage counters means today there.
     */
    @Bean
    public Clock clock(@Value("${updesk.time-zone:America/Sao_Paulo}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
