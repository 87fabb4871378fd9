package com.programmersdiary.moltby.cron;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record CronJob(
        String id,
        String name,
        String description,
        String agentId,
        String schedule,
        String target,
        String message,
        boolean enabled,
        String wakeMode,
        String payloadType,
        Instant lastRun,
        List<JobRun> runHistory) {

    public static final int HISTORY_LIMIT = 10;

    public CronJob {
        runHistory = runHistory != null ? List.copyOf(runHistory) : List.of();
    }

    CronJob withEnabled(boolean enabled) {
        return new CronJob(id, name, description, agentId, schedule, target, message,
                enabled, wakeMode, payloadType, lastRun, runHistory);
    }

    CronJob withRun(JobRun run) {
        var history = new ArrayList<JobRun>(HISTORY_LIMIT + 1);
        history.add(run);
        history.addAll(runHistory);
        if (history.size() > HISTORY_LIMIT) {
            history.subList(HISTORY_LIMIT, history.size()).clear();
        }
        return new CronJob(id, name, description, agentId, schedule, target, message,
                enabled, wakeMode, payloadType, run.ranAt(), history);
    }
}
