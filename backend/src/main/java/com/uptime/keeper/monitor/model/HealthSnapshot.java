package com.uptime.keeper.monitor.model;

import java.time.Instant;
import java.util.List;

public record HealthSnapshot(
    String targetId,
    HealthStatus status,
    int consecutiveFailures,
    Instant lastTransitionAt,
    Instant lastRedeployAt,
    boolean redeployInFlight,
    ProbeResult lastProbe,
    List<RedeployAttempt> recentRedeploys
) {
}
