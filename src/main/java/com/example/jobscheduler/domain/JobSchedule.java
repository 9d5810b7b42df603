package com.example.jobscheduler.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import javax.persistence.*;
import java.time.Instant;
import java.util.Map;

/**
 * 作业定义持久化行。run 计数器只是给运维看的缓存，权威数据在 job_executions。
 */
@Entity
@Table(name = "job_schedules", indexes = {@Index(name = "idx_sched_enabled", columnList = "enabled")})
@Getter @Setter @ToString
public class JobSchedule {
    @Id
    @Column(name = "job_name", length = 128)
    private String name;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "cron_expression", length = 64, nullable = false)
    private String cronExpression;

    @Column(name = "enabled", nullable = false)
    private Boolean enabled = Boolean.TRUE;

    @Column(name = "job_type", length = 64)
    private String jobType;

    @Column(name = "service", length = 128, nullable = false)
    private String service;

    @Column(name = "endpoint", length = 512, nullable = false)
    private String endpoint;

    @Lob
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "config")
    private Map<String, Object> config;

    @Column(name = "total_runs", nullable = false)
    private Long totalRuns = 0L;

    @Column(name = "successful_runs", nullable = false)
    private Long successfulRuns = 0L;

    @Column(name = "failed_runs", nullable = false)
    private Long failedRuns = 0L;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_run_status", length = 16)
    private ExecutionStatus lastRunStatus;

    @Column(name = "last_run_duration_ms")
    private Long lastRunDurationMs;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }
}
