package com.example.jobscheduler.service;

public class UnknownServiceException extends SchedulerException {
    public UnknownServiceException(String service) {
        super("No base URL configured for service '" + service + "' (scheduler.services." + service + ")");
    }
}
