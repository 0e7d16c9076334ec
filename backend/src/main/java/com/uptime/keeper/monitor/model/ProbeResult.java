package com.uptime.keeper.monitor.model;

import java.time.Duration;
import java.time.Instant;

public record ProbeResult(
    String targetId,
    Instant probedAt,
    ProbeOutcome outcome,
    Integer statusCode,
    Duration latency,
    String detail
) {
    public boolean isSuccess() {
        return outcome == ProbeOutcome.SUCCESS;
    }

    public static ProbeResult success(String targetId, Instant probedAt, int statusCode, Duration latency) {
        return new ProbeResult(targetId, probedAt, ProbeOutcome.SUCCESS, statusCode, latency, null);
    }

    public static ProbeResult httpError(String targetId, Instant probedAt, int statusCode, Duration latency) {
        return new ProbeResult(targetId, probedAt, ProbeOutcome.HTTP_ERROR, statusCode, latency, "http_" + statusCode);
    }

    public static ProbeResult timeout(String targetId, Instant probedAt, Duration latency) {
        return new ProbeResult(targetId, probedAt, ProbeOutcome.TIMEOUT, null, latency, "timeout");
    }

    public static ProbeResult connectionError(String targetId, Instant probedAt, Duration latency, String detail) {
        return new ProbeResult(targetId, probedAt, ProbeOutcome.CONNECTION_ERROR, null, latency, detail);
    }
}
