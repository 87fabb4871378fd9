package com.programmersdiary.moltby.web;

import com.programmersdiary.moltby.cron.JobDefinition;

public record CreateCronJobRequest(
        String name,
        String description,
        String agentId,
        String schedule,
        String target,
        String message,
        Boolean enabled,
        String wakeMode,
        String payloadType) {

    JobDefinition toDefinition() {
        return new JobDefinition(name, description, agentId, schedule, target, message, enabled, wakeMode, payloadType);
    }
}
