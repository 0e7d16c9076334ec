package com.uptime.keeper.monitor.model;

public record SchedulerStatusResponse(
    boolean running,
    int poolSize,
    int scheduledTargets,
    int probesInFlight
) {
}
