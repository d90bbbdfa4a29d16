package com.chainpulse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** UTC wall clock; analytics that depend on "now" take it so tests can pin time. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
