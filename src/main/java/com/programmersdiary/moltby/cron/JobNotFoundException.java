package com.programmersdiary.moltby.cron;

public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found");
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
