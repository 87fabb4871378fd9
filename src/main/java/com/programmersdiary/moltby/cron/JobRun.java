package com.programmersdiary.moltby.cron;

import java.time.Instant;

public record JobRun(Instant ranAt, RunOutcome outcome, String error) {

    public static JobRun success(Instant ranAt) {
        return new JobRun(ranAt, RunOutcome.SUCCESS, null);
    }

    public static JobRun failure(Instant ranAt, String error) {
        return new JobRun(ranAt, RunOutcome.FAILURE, error);
    }
}
