package com.example.jobscheduler.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
    RUNNING,     // 已派发，等待协作服务返回
    COMPLETED,   // 协作服务返回 2xx
    FAILED;      // 非 2xx / 网络错误 / 超时 / 过期清理

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
