package com.uptime.keeper.monitor.service;

import com.uptime.keeper.monitor.model.HealthSnapshot;
import com.uptime.keeper.monitor.model.HealthStatus;
import com.uptime.keeper.monitor.model.ProbeResult;
import com.uptime.keeper.monitor.model.RedeployAttempt;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Mutable health and redeploy bookkeeping of one target. Every read and write happens
 * while holding this object's monitor; the health tracker and the redeploy coordinator
 * share that single lock.
 */
public final class TargetHealth {
    private final String targetId;
    private final int historyLimit;
    private final Deque<RedeployAttempt> history = new ArrayDeque<>();

    private HealthStatus status = HealthStatus.UNKNOWN;
    private int consecutiveFailures;
    private Instant lastTransitionAt;
    private Instant lastRedeployAt;
    private boolean redeployInFlight;
    private ProbeResult lastProbe;
    private boolean removed;

    TargetHealth(String targetId, Instant createdAt, List<RedeployAttempt> persistedHistory, int historyLimit) {
        this.targetId = targetId;
        this.historyLimit = Math.max(1, historyLimit);
        this.lastTransitionAt = createdAt;
        for (RedeployAttempt attempt : persistedHistory) {
            appendHistory(attempt);
            if (attempt.outcome() != null
                && attempt.requestedAt() != null
                && (lastRedeployAt == null || attempt.requestedAt().isAfter(lastRedeployAt))) {
                lastRedeployAt = attempt.requestedAt();
            }
        }
    }

    String targetId() {
        return targetId;
    }

    HealthStatus status() {
        return status;
    }

    void setStatus(HealthStatus status, Instant at) {
        this.status = status;
        this.lastTransitionAt = at;
    }

    int incrementFailures() {
        consecutiveFailures++;
        return consecutiveFailures;
    }

    void resetFailures() {
        consecutiveFailures = 0;
    }

    void setLastProbe(ProbeResult lastProbe) {
        this.lastProbe = lastProbe;
    }

    Instant lastRedeployAt() {
        return lastRedeployAt;
    }

    boolean redeployInFlight() {
        return redeployInFlight;
    }

    void markRedeployStarted(Instant startedAt) {
        redeployInFlight = true;
        lastRedeployAt = startedAt;
    }

    void finishRedeploy(RedeployAttempt attempt) {
        redeployInFlight = false;
        appendHistory(attempt);
    }

    List<RedeployAttempt> history() {
        return List.copyOf(history);
    }

    boolean isRemoved() {
        return removed;
    }

    void markRemoved() {
        removed = true;
    }

    HealthSnapshot snapshot() {
        return new HealthSnapshot(
            targetId,
            status,
            consecutiveFailures,
            lastTransitionAt,
            lastRedeployAt,
            redeployInFlight,
            lastProbe,
            List.copyOf(history)
        );
    }

    private void appendHistory(RedeployAttempt attempt) {
        history.addLast(attempt);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
    }
}
