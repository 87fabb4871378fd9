package com.programmersdiary.moltby.cron;

/**
 * Operator-supplied fields for a new cron job. Optional fields may be null.
 */
public record JobDefinition(
        String name,
        String description,
        String agentId,
        String schedule,
        String target,
        String message,
        Boolean enabled,
        String wakeMode,
        String payloadType) {
}
