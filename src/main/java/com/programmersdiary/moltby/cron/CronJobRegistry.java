package com.programmersdiary.moltby.cron;

import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store of cron jobs. Jobs are immutable; every update replaces the
 * entry atomically for its id, so readers only ever see complete jobs.
 */
@Repository
public class CronJobRegistry {

    static final String DEFAULT_AGENT_ID = "default";
    static final String DEFAULT_WAKE_MODE = "Next heartbeat";
    static final String DEFAULT_PAYLOAD_TYPE = "System event";

    private final Map<String, CronJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong lastId = new AtomicLong();
    private final Clock clock;

    public CronJobRegistry(Clock clock) {
        this.clock = clock;
    }

    public CronJob create(JobDefinition definition) {
        return register(prepare(definition));
    }

    /**
     * Validates a definition and builds the job it describes without storing it.
     */
    public CronJob prepare(JobDefinition definition) {
        if (definition == null
                || isBlank(definition.name())
                || isBlank(definition.schedule())
                || isBlank(definition.target())
                || isBlank(definition.message())) {
            throw new JobValidationException(JobValidationException.MISSING_FIELDS);
        }
        CronSchedule schedule;
        try {
            schedule = CronSchedule.parse(definition.schedule());
        } catch (IllegalArgumentException e) {
            throw new JobValidationException(JobValidationException.INVALID_SCHEDULE, e);
        }
        return new CronJob(
                nextId(),
                definition.name(),
                definition.description(),
                orDefault(definition.agentId(), DEFAULT_AGENT_ID),
                schedule.expression(),
                definition.target(),
                definition.message(),
                !Boolean.FALSE.equals(definition.enabled()),
                orDefault(definition.wakeMode(), DEFAULT_WAKE_MODE),
                orDefault(definition.payloadType(), DEFAULT_PAYLOAD_TYPE),
                null,
                List.of());
    }

    public CronJob register(CronJob job) {
        var existing = jobs.putIfAbsent(job.id(), job);
        if (existing != null) {
            throw new IllegalStateException("Duplicate cron job id: " + job.id());
        }
        return job;
    }

    public Optional<CronJob> get(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public List<CronJob> list() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(CronJob::id))
                .toList();
    }

    public int size() {
        return jobs.size();
    }

    public boolean delete(String id) {
        return jobs.remove(id) != null;
    }

    public Optional<CronJob> setEnabled(String id, boolean enabled) {
        return Optional.ofNullable(jobs.computeIfPresent(id, (key, job) -> job.withEnabled(enabled)));
    }

    /**
     * Records a dispatch attempt. Never recreates a job that has been deleted.
     */
    public Optional<CronJob> recordRun(String id, Instant timestamp, RunOutcome outcome, String error) {
        var run = new JobRun(timestamp, outcome, outcome == RunOutcome.FAILURE ? error : null);
        return Optional.ofNullable(jobs.computeIfPresent(id, (key, job) -> job.withRun(run)));
    }

    private String nextId() {
        long now = clock.millis();
        return Long.toString(lastId.updateAndGet(previous -> Math.max(previous + 1, now)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }
}
