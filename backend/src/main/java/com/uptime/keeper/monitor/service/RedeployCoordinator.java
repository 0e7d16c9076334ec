package com.uptime.keeper.monitor.service;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.model.RedeployAttempt;
import com.uptime.keeper.monitor.model.RedeployOutcome;
import com.uptime.keeper.monitor.model.RedeployTrigger;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.notify.MonitorNotifier;
import com.uptime.keeper.monitor.notify.RedeployAttemptedEvent;
import com.uptime.keeper.monitor.persistence.RedeployHistoryStore;
import com.uptime.keeper.monitor.provider.HostingProvider;
import com.uptime.keeper.monitor.provider.HostingProviderRegistry;
import com.uptime.keeper.monitor.provider.ProviderResponse;
import com.uptime.keeper.monitor.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Issues redeploy requests to hosting providers, at most one in flight per target and
 * never two starts closer than the target's cooldown.
 */
@Service
public class RedeployCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RedeployCoordinator.class);

    static final String REASON_IN_FLIGHT = "redeploy_in_flight";
    static final String REASON_COOLDOWN = "cooldown";
    static final String REASON_PROVIDER_TIMEOUT = "provider_timeout";

    private final HostingProviderRegistry providers;
    private final RedeployHistoryStore historyStore;
    private final MonitorNotifier notifier;
    private final ExecutorService executor;
    private final KeeperProperties properties;
    private final Clock clock;
    private final Set<CompletableFuture<RedeployAttempt>> inFlight = ConcurrentHashMap.newKeySet();

    public RedeployCoordinator(
        HostingProviderRegistry providers,
        RedeployHistoryStore historyStore,
        MonitorNotifier notifier,
        @Qualifier("redeployExecutor") ExecutorService executor,
        KeeperProperties properties,
        Clock clock
    ) {
        this.providers = providers;
        this.historyStore = historyStore;
        this.notifier = notifier;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Starts a redeploy unless one is in flight or the cooldown has not elapsed. The caller
     * must hold the monitor of {@code health}. {@code onComplete} runs once the provider
     * answers, fails or times out, after the entry lock has been released.
     */
    public RedeployDispatch tryStart(
        Target target,
        TargetHealth health,
        RedeployTrigger trigger,
        Consumer<RedeployAttempt> onComplete
    ) {
        Instant now = clock.instant();
        if (health.redeployInFlight()) {
            return RedeployDispatch.throttled(RedeployAttempt.throttled(target.id(), trigger, now, REASON_IN_FLIGHT));
        }
        Instant lastStarted = health.lastRedeployAt();
        if (lastStarted != null) {
            Duration elapsed = Duration.between(lastStarted, now);
            if (elapsed.compareTo(target.redeployCooldown()) < 0) {
                long remainingSeconds = target.redeployCooldown().minus(elapsed).getSeconds();
                log.debug("Redeploy of {} throttled for another {}s", target.id(), remainingSeconds);
                return RedeployDispatch.throttled(RedeployAttempt.throttled(
                    target.id(), trigger, now, REASON_COOLDOWN + "_remaining_" + remainingSeconds + "s"
                ));
            }
        }

        CompletableFuture<ProviderResponse> call = new CompletableFuture<>();
        CompletableFuture<RedeployAttempt> completion = call
            .handle((response, error) -> toAttempt(target.id(), trigger, now, response, error))
            .thenApply(attempt -> {
                complete(health, attempt, onComplete);
                return attempt;
            });
        try {
            executor.execute(() -> runProvider(target, call));
        } catch (RejectedExecutionException e) {
            log.warn("Redeploy executor rejected {}; coordinator is shutting down", target.id());
            return RedeployDispatch.throttled(RedeployAttempt.throttled(target.id(), trigger, now, "shutting_down"));
        }
        // complete() needs the entry lock held by the caller, so the attempt cannot finish before this point
        health.markRedeployStarted(now);
        log.info("Redeploy of {} started ({}, {})", target.id(), target.provider(), trigger);
        inFlight.add(completion);
        completion.whenComplete((attempt, error) -> inFlight.remove(completion));
        return RedeployDispatch.started(completion);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    @PreDestroy
    public void awaitInFlight() {
        List<CompletableFuture<RedeployAttempt>> pending = List.copyOf(inFlight);
        if (pending.isEmpty()) {
            return;
        }
        int timeoutSeconds = properties.getScheduler().getShutdownTimeoutSeconds();
        log.info("Waiting up to {}s for {} in-flight redeploys", timeoutSeconds, pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException e) {
            log.warn("Abandoning {} redeploys still in flight at shutdown", inFlight.size());
        } catch (ExecutionException e) {
            log.warn("Redeploy failed during shutdown", e.getCause());
        }
    }

    // the provider timeout starts once a redeploy worker picks the call up, not while it is queued
    private void runProvider(Target target, CompletableFuture<ProviderResponse> call) {
        call.orTimeout(properties.getRedeploy().getProviderTimeoutSeconds(), TimeUnit.SECONDS);
        try {
            call.complete(callProvider(target));
        } catch (RuntimeException e) {
            call.completeExceptionally(e);
        }
    }

    private ProviderResponse callProvider(Target target) {
        Optional<HostingProvider> provider = providers.forType(target.provider());
        if (provider.isEmpty()) {
            return ProviderResponse.error(null, "no_provider_for_" + target.provider());
        }
        return provider.get().redeploy(target);
    }

    private RedeployAttempt toAttempt(
        String targetId,
        RedeployTrigger trigger,
        Instant requestedAt,
        ProviderResponse response,
        Throwable error
    ) {
        Instant completedAt = clock.instant();
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            String reason = cause instanceof TimeoutException ? REASON_PROVIDER_TIMEOUT : FailureClassifier.classify(cause);
            return new RedeployAttempt(targetId, trigger, requestedAt, RedeployOutcome.FAILED, reason, completedAt);
        }
        if (response == null) {
            return new RedeployAttempt(targetId, trigger, requestedAt, RedeployOutcome.FAILED, "no_response", completedAt);
        }
        return switch (response.kind()) {
            case ACCEPTED -> new RedeployAttempt(targetId, trigger, requestedAt, RedeployOutcome.SUCCEEDED, null, completedAt);
            case RATE_LIMITED -> new RedeployAttempt(
                targetId, trigger, requestedAt, RedeployOutcome.THROTTLED, response.message(), completedAt
            );
            case ERROR -> new RedeployAttempt(
                targetId, trigger, requestedAt, RedeployOutcome.FAILED, response.message(), completedAt
            );
        };
    }

    private void complete(TargetHealth health, RedeployAttempt attempt, Consumer<RedeployAttempt> onComplete) {
        synchronized (health) {
            health.finishRedeploy(attempt);
            if (health.isRemoved()) {
                log.info("Discarding redeploy outcome {} for removed target {}", attempt.outcome(), attempt.targetId());
                return;
            }
            // saved under the entry lock so removal cannot delete the history in between
            try {
                historyStore.save(attempt.targetId(), health.history());
            } catch (RuntimeException e) {
                log.warn("Failed to persist redeploy history for {}", attempt.targetId(), e);
            }
        }
        notifier.publish(new RedeployAttemptedEvent(attempt.targetId(), attempt, attempt.completedAt()));
        try {
            onComplete.accept(attempt);
        } catch (RuntimeException e) {
            log.warn("Redeploy completion handler failed for {}", attempt.targetId(), e);
        }
    }
}
