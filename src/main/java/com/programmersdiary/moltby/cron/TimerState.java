package com.programmersdiary.moltby.cron;

public enum TimerState {
    ABSENT,
    ARMED,
    DISARMED
}
