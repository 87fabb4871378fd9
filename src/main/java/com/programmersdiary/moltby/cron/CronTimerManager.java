package com.programmersdiary.moltby.cron;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns at most one timer per job id. Disarmed timers are kept for cheap re-arming;
 * only {@link #destroy(String)} discards them.
 */
@Component
public class CronTimerManager {

    private static final Logger log = LoggerFactory.getLogger(CronTimerManager.class);

    private final TaskScheduler taskScheduler;
    private final CronDispatcher dispatcher;
    private final Clock clock;
    private final Map<String, CronTimer> timers = new ConcurrentHashMap<>();

    public CronTimerManager(TaskScheduler taskScheduler, CronDispatcher dispatcher, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * Arms the job's timer, creating it when absent and restarting it when disarmed.
     */
    public void arm(CronJob job) {
        var timer = timers.computeIfAbsent(job.id(), id -> newTimer(job));
        if (timer.start()) {
            var next = CronSchedule.parse(job.schedule()).nextFireAfter(clock.instant());
            log.info("Armed cron job '{}' ({}) with schedule '{}' UTC, next fire at {}",
                    job.name(), job.id(), job.schedule(), next);
        }
    }

    public boolean disarm(String jobId) {
        var timer = timers.get(jobId);
        if (timer == null) {
            return false;
        }
        if (timer.stop()) {
            log.info("Stopped timer for cron job {}", jobId);
        }
        return true;
    }

    public void destroy(String jobId) {
        var timer = timers.remove(jobId);
        if (timer != null) {
            timer.stop();
            log.info("Destroyed timer for cron job {}", jobId);
        }
    }

    public TimerState state(String jobId) {
        var timer = timers.get(jobId);
        if (timer == null) {
            return TimerState.ABSENT;
        }
        return timer.isRunning() ? TimerState.ARMED : TimerState.DISARMED;
    }

    public long armedCount() {
        return timers.values().stream().filter(CronTimer::isRunning).count();
    }

    @PreDestroy
    void shutdown() {
        timers.values().forEach(CronTimer::stop);
        timers.clear();
    }

    private CronTimer newTimer(CronJob job) {
        var jobId = job.id();
        return new CronTimer(CronSchedule.parse(job.schedule()).trigger(), taskScheduler,
                () -> dispatcher.fire(jobId));
    }
}
