package com.example.jobscheduler.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExecutionPage {
    List<JobExecution> executions;
    int limit;
    int offset;
    long total;

    public boolean isHasMore() {
        return (long) offset + limit < total;
    }
}
