package com.example.jobscheduler.service;

public class JobNotFoundException extends SchedulerException {
    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("Job " + jobName + " does not exist");
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
