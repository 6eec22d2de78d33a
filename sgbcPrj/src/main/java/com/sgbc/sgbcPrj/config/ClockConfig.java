package com.sgbc.sgbcPrj.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // loan dates and the overdue predicate read "now" from here
    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}
