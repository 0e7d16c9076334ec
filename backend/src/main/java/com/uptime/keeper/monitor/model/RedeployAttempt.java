package com.uptime.keeper.monitor.model;

import java.time.Instant;

public record RedeployAttempt(
    String targetId,
    RedeployTrigger trigger,
    Instant requestedAt,
    RedeployOutcome outcome,
    String reason,
    Instant completedAt
) {
    public static RedeployAttempt throttled(String targetId, RedeployTrigger trigger, Instant at, String reason) {
        return new RedeployAttempt(targetId, trigger, at, RedeployOutcome.THROTTLED, reason, at);
    }
}
