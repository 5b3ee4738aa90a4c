package com.prakash.studyplanner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // The user's local day and time; no per-user zones
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
