package com.programmersdiary.moltby.cron;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.util.concurrent.ScheduledFuture;

/**
 * A restartable recurring timer for one job. Stopping cancels the pending
 * future but keeps the trigger, so a later start resumes the same schedule.
 */
class CronTimer {

    private final Trigger trigger;
    private final TaskScheduler taskScheduler;
    private final Runnable task;
    private ScheduledFuture<?> future;
    private boolean running;

    CronTimer(Trigger trigger, TaskScheduler taskScheduler, Runnable task) {
        this.trigger = trigger;
        this.taskScheduler = taskScheduler;
        this.task = task;
    }

    synchronized boolean start() {
        if (running) {
            return false;
        }
        future = taskScheduler.schedule(task, trigger);
        running = true;
        return true;
    }

    synchronized boolean stop() {
        if (!running) {
            return false;
        }
        if (future != null) {
            // an in-flight fire is allowed to finish
            future.cancel(false);
            future = null;
        }
        running = false;
        return true;
    }

    synchronized boolean isRunning() {
        return running;
    }
}
