package com.programmersdiary.moltby.cron;

public enum DispatchResult {
    SENT,
    FAILED,
    SKIPPED
}
