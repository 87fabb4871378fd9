package com.programmersdiary.moltby.cron;

public class JobValidationException extends RuntimeException {

    public static final String MISSING_FIELDS = "Missing required fields";
    public static final String INVALID_SCHEDULE = "Invalid cron expression";

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
