package com.uptime.keeper.monitor.notify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.uptime.keeper.monitor.model.RedeployAttempt;

import java.time.Instant;

public record RedeployAttemptedEvent(
    String targetId,
    RedeployAttempt attempt,
    Instant occurredAt
) implements MonitorEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "redeploy_attempted";
    }
}
