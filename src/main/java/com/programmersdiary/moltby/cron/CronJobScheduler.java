package com.programmersdiary.moltby.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Entry point for cron job management. Keeps the registry and the timers in step:
 * timers transition first and the registry change is applied last, with the timer
 * rolled back if the registry change fails.
 */
@Service
public class CronJobScheduler {

    private static final Logger log = LoggerFactory.getLogger(CronJobScheduler.class);

    private final CronJobRegistry registry;
    private final CronTimerManager timerManager;
    private final CronDispatcher dispatcher;
    private final Map<String, ReentrantLock> jobLocks = new ConcurrentHashMap<>();

    public CronJobScheduler(CronJobRegistry registry, CronTimerManager timerManager, CronDispatcher dispatcher) {
        this.registry = registry;
        this.timerManager = timerManager;
        this.dispatcher = dispatcher;
    }

    public CronJob createJob(JobDefinition definition) {
        var job = registry.prepare(definition);
        return withJobLock(job.id(), () -> {
            if (job.enabled()) {
                timerManager.arm(job);
            }
            try {
                registry.register(job);
            } catch (RuntimeException e) {
                timerManager.destroy(job.id());
                throw e;
            }
            log.info("Created cron job '{}' ({}) targeting {}, enabled={}",
                    job.name(), job.id(), job.target(), job.enabled());
            return job;
        });
    }

    public CronJob getJob(String id) {
        return registry.get(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    public List<CronJob> listJobs() {
        return registry.list();
    }

    public void deleteJob(String id) {
        getJob(id);
        try {
            withJobLock(id, () -> {
                if (registry.get(id).isEmpty()) {
                    throw new JobNotFoundException(id);
                }
                timerManager.destroy(id);
                registry.delete(id);
                dispatcher.release(id);
                log.info("Deleted cron job {}", id);
                return null;
            });
        } finally {
            jobLocks.remove(id);
        }
    }

    public CronJob toggleJob(String id) {
        getJob(id);
        try {
            return toggleLocked(id);
        } catch (JobNotFoundException e) {
            jobLocks.remove(id);
            throw e;
        }
    }

    private CronJob toggleLocked(String id) {
        return withJobLock(id, () -> {
            var job = registry.get(id).orElseThrow(() -> new JobNotFoundException(id));
            var enable = !job.enabled();
            if (enable) {
                timerManager.arm(job);
            } else {
                timerManager.disarm(id);
            }
            try {
                var updated = registry.setEnabled(id, enable).orElseThrow(() -> new JobNotFoundException(id));
                log.info("Cron job '{}' ({}) {}", job.name(), id, enable ? "enabled" : "disabled");
                return updated;
            } catch (JobNotFoundException e) {
                timerManager.destroy(id);
                throw e;
            } catch (RuntimeException e) {
                if (enable) {
                    timerManager.disarm(id);
                } else {
                    timerManager.arm(job);
                }
                throw e;
            }
        });
    }

    private <T> T withJobLock(String id, Supplier<T> action) {
        var lock = jobLocks.computeIfAbsent(id, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
