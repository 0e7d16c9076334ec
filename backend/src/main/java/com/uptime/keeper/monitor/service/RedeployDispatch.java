package com.uptime.keeper.monitor.service;

import com.uptime.keeper.monitor.model.RedeployAttempt;

import java.util.concurrent.CompletableFuture;

/**
 * Result of asking the coordinator for a redeploy: either an attempt was started, or it
 * was throttled and {@link #completion()} is already complete with the throttled attempt.
 */
public record RedeployDispatch(
    boolean started,
    CompletableFuture<RedeployAttempt> completion
) {
    public static RedeployDispatch throttled(RedeployAttempt attempt) {
        return new RedeployDispatch(false, CompletableFuture.completedFuture(attempt));
    }

    public static RedeployDispatch started(CompletableFuture<RedeployAttempt> completion) {
        return new RedeployDispatch(true, completion);
    }

    /**
     * The throttled attempt, or null when an attempt was started.
     */
    public RedeployAttempt throttledAttempt() {
        return started ? null : completion.getNow(null);
    }
}
