package com.uptime.keeper.monitor.model;

public record RedeployRequestResponse(
    String targetId,
    boolean started,
    RedeployAttempt throttled
) {
}
