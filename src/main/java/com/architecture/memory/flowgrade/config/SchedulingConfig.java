package com.architecture.memory.flowgrade.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class SchedulingConfig {

    /**
     * Time source for cache expiry. UTC, so every process writing the cache table
     * stamps comparable times. Replaced in tests to move time forward.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
