package com.example.jobscheduler.service;

/**
 * 台账写入失败。审计记录丢失不能静默，调用方负责记录 ERROR 日志。
 */
public class ExecutionLedgerException extends SchedulerException {
    public ExecutionLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
