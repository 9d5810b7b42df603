package com.example.jobscheduler.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 列表/详情视图：定义 + 是否持有定时器 + 运维计数器。
 */
@Value
@Builder
public class JobView {
    String name;
    String displayName;
    String description;
    String cronExpression;
    boolean enabled;
    @JsonProperty("isRunning")
    boolean running;
    String jobType;
    String service;
    String endpoint;
    Map<String, Object> config;
    Instant nextRunAt;
    Instant lastRunAt;
    ExecutionStatus lastRunStatus;
    Long lastRunDurationMs;
    long totalRuns;
    long successfulRuns;
    long failedRuns;
}
