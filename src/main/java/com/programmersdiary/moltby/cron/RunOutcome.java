package com.programmersdiary.moltby.cron;

public enum RunOutcome {
    SUCCESS,
    FAILURE
}
