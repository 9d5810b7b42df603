package com.example.jobscheduler.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class JobStats {
    String jobName;
    int windowDays;
    Instant from;
    Instant to;
    long totalExecutions;
    long successfulExecutions;
    long failedExecutions;
    long runningExecutions;
    double successRate;
    long avgDurationMs;
    long totalItemsProcessed;
}
