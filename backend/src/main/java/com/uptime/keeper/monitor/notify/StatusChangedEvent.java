package com.uptime.keeper.monitor.notify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.uptime.keeper.monitor.model.HealthStatus;

import java.time.Instant;

public record StatusChangedEvent(
    String targetId,
    HealthStatus oldStatus,
    HealthStatus newStatus,
    String reason,
    Instant occurredAt
) implements MonitorEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "status_changed";
    }

    public boolean isRecovery() {
        return newStatus == HealthStatus.HEALTHY && oldStatus != null && oldStatus.isRecovering();
    }
}
