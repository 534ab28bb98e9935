package com.example.timesheet.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TimesheetPolicy.class)
public class TimeConfig {

    /**
     * The only source of "now" for audit fields and decisions.
     */
    @Bean
    public Clock clock(TimesheetPolicy policy) {
        return Clock.system(policy.zone());
    }
}
