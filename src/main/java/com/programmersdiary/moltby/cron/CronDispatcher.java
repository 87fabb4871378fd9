package com.programmersdiary.moltby.cron;

import com.programmersdiary.moltby.bot.TransportException;
import com.programmersdiary.moltby.bot.TransportGateway;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs cron job fires on a dedicated pool so the timer threads never wait on the
 * transport. A fire that arrives while the same job is still dispatching is skipped
 * rather than queued behind it.
 */
@Component
public class CronDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CronDispatcher.class);

    private final CronJobRegistry registry;
    private final TransportGateway gateway;
    private final Clock clock;
    private final ExecutorService executor;
    private final Map<String, ReentrantLock> jobLocks = new ConcurrentHashMap<>();

    public CronDispatcher(CronJobRegistry registry,
                          TransportGateway gateway,
                          Clock clock,
                          @Value("${moltby.cron.dispatch-threads:4}") int dispatchThreads) {
        this.registry = registry;
        this.gateway = gateway;
        this.clock = clock;
        var counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, dispatchThreads), r -> {
            var thread = new Thread(r, "moltby-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public Future<DispatchResult> fire(String jobId) {
        return executor.submit(() -> dispatch(jobId));
    }

    public DispatchResult dispatch(String jobId) {
        var lock = jobLocks.computeIfAbsent(jobId, k -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.warn("Cron job {} fired while its previous run is still in progress, skipping", jobId);
            return DispatchResult.SKIPPED;
        }
        try {
            return dispatchLocked(jobId);
        } finally {
            lock.unlock();
            if (registry.get(jobId).isEmpty()) {
                jobLocks.remove(jobId, lock);
            }
        }
    }

    void release(String jobId) {
        jobLocks.remove(jobId);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private DispatchResult dispatchLocked(String jobId) {
        var job = registry.get(jobId).orElse(null);
        if (job == null || !job.enabled()) {
            log.debug("Cron job {} fired but is deleted or disabled, skipping", jobId);
            return DispatchResult.SKIPPED;
        }
        if (!gateway.isAttached()) {
            log.warn("Cron job '{}' ({}) skipped: bot is not active", job.name(), jobId);
            return DispatchResult.SKIPPED;
        }

        log.info("Executing cron job: {} ({})", job.name(), jobId);
        try {
            gateway.sendMessage(job.target(), job.message());
        } catch (TransportException | RuntimeException e) {
            log.error("Failed to send cron message to {} for job {}: {}", job.target(), jobId, e.getMessage(), e);
            record(jobId, RunOutcome.FAILURE, e.getMessage());
            return DispatchResult.FAILED;
        }
        record(jobId, RunOutcome.SUCCESS, null);
        log.info("Message sent to {}", job.target());
        return DispatchResult.SENT;
    }

    private void record(String jobId, RunOutcome outcome, String error) {
        if (registry.recordRun(jobId, clock.instant(), outcome, error).isEmpty()) {
            log.debug("Cron job {} was deleted during dispatch, discarding {} result", jobId, outcome);
        }
    }
}
