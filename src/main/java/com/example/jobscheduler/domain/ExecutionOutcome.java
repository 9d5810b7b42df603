package com.example.jobscheduler.domain;

import lombok.Builder;
import lombok.Value;

/**
 * 一次派发的结果。派发失败不抛异常，而是以 FAILED 状态体现在这里。
 */
@Value
@Builder
public class ExecutionOutcome {
    String executionId;
    String jobName;
    TriggerSource triggeredBy;
    ExecutionStatus status;
    long durationMs;
    JobResult result;

    public boolean isCompleted() {
        return status == ExecutionStatus.COMPLETED;
    }
}
