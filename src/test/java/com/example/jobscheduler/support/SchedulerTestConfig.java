package com.example.jobscheduler.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@TestConfiguration
public class SchedulerTestConfig {

    public static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    @Bean
    @Primary
    public ManualTaskScheduler manualTaskScheduler() {
        return new ManualTaskScheduler(START);
    }

    @Bean
    @Primary
    public Clock tickingClock() {
        return new TickingClock(START, Duration.ofMillis(7));
    }
}
