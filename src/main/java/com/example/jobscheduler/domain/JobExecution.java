package com.example.jobscheduler.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import javax.persistence.*;
import java.time.Instant;
import java.util.Map;

/**
 * 一次作业执行的台账行：创建时为 RUNNING，仅允许一次更新到终态。
 * job_name 不做外键，作业被删除后历史仍保留。
 */
@Entity
@Table(name = "job_executions", indexes = {
        @Index(name = "idx_exec_job_started", columnList = "job_name, started_at"),
        @Index(name = "idx_exec_status_started", columnList = "status, started_at")})
@Getter @Setter @ToString
public class JobExecution {
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "job_name", length = 128, nullable = false)
    private String jobName;

    @Column(name = "job_type", length = 64)
    private String jobType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "items_processed", nullable = false)
    private Integer itemsProcessed = 0;

    @Column(name = "items_succeeded", nullable = false)
    private Integer itemsSucceeded = 0;

    @Column(name = "items_failed", nullable = false)
    private Integer itemsFailed = 0;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Lob
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata")
    private Map<String, Object> metadata;

    @Enumerated(EnumType.STRING)
    @Column(name = "triggered_by", nullable = false, length = 16)
    private TriggerSource triggeredBy;

    @Column(name = "triggered_by_user", length = 64)
    private String triggeredByUser;
}
