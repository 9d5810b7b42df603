package com.example.jobscheduler.service;

public class InvalidScheduleException extends SchedulerException {
    private final String cronExpression;

    public InvalidScheduleException(String cronExpression, String reason) {
        super("Invalid cron expression \"" + cronExpression + "\": " + reason);
        this.cronExpression = cronExpression;
    }

    public String getCronExpression() {
        return cronExpression;
    }
}
