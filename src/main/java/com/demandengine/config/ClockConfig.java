package com.demandengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** Forecast dates and snapshot ages are computed in UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
