package com.reputationscorer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** UTC clock for envelope emission timestamps. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
