package com.example.jobscheduler.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 执行的触发来源：cron 定时、操作员手动、管理员强制。
 */
public enum TriggerSource {
    SCHEDULER,
    MANUAL,
    ADMIN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TriggerSource fromWire(String value) {
        if (value == null || value.trim().isEmpty()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown trigger source: " + value);
        }
    }
}
