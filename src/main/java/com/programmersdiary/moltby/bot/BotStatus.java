package com.programmersdiary.moltby.bot;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BotStatus(String status, String username, Instant startTime, Long uptimeSeconds) {

    static BotStatus stopped() {
        return new BotStatus("stopped", null, null, null);
    }
}
