package com.uptime.keeper.monitor.service;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.model.HealthSnapshot;
import com.uptime.keeper.monitor.model.HealthStatus;
import com.uptime.keeper.monitor.model.ProbeResult;
import com.uptime.keeper.monitor.model.RedeployAttempt;
import com.uptime.keeper.monitor.model.RedeployOutcome;
import com.uptime.keeper.monitor.model.RedeployTrigger;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.notify.MonitorEvent;
import com.uptime.keeper.monitor.notify.MonitorNotifier;
import com.uptime.keeper.monitor.notify.StatusChangedEvent;
import com.uptime.keeper.monitor.persistence.RedeployHistoryStore;
import com.uptime.keeper.monitor.registry.TargetNotFoundException;
import com.uptime.keeper.monitor.registry.TargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns probe results into health status per target and escalates to the
 * {@link RedeployCoordinator} once a target has failed often enough.
 *
 * <p>Status machine: a success always returns the target to HEALTHY. Failures move a
 * HEALTHY target to DEGRADED at {@code keeper.health.degraded-after-failures} and any
 * target to DOWN at its failure threshold, where an automatic redeploy is requested.
 * While REDEPLOYING, further failures are counted but do not trigger another attempt.
 * The redeploy outcome moves REDEPLOYING to DEGRADED (accepted) or DOWN (failed or throttled).
 */
@Service
public class HealthTracker {
    private static final Logger log = LoggerFactory.getLogger(HealthTracker.class);

    static final String REASON_NOT_DOWN = "target_not_down";

    private final TargetRegistry registry;
    private final TargetHealthTable table;
    private final RedeployCoordinator coordinator;
    private final RedeployHistoryStore historyStore;
    private final MonitorNotifier notifier;
    private final KeeperProperties properties;
    private final Clock clock;

    public HealthTracker(
        TargetRegistry registry,
        TargetHealthTable table,
        RedeployCoordinator coordinator,
        RedeployHistoryStore historyStore,
        MonitorNotifier notifier,
        KeeperProperties properties,
        Clock clock
    ) {
        this.registry = registry;
        this.table = table;
        this.coordinator = coordinator;
        this.historyStore = historyStore;
        this.notifier = notifier;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Applies one probe result. Results for targets that are no longer registered are
     * discarded and yield an empty snapshot.
     */
    public Optional<HealthSnapshot> record(ProbeResult result) {
        Optional<Target> found = registry.find(result.targetId());
        if (found.isEmpty()) {
            log.debug("Discarding probe result for unknown target {}", result.targetId());
            return Optional.empty();
        }
        Target target = found.get();
        Optional<TargetHealth> tracked = trackedEntry(target.id());
        if (tracked.isEmpty()) {
            log.debug("Discarding probe result for removed target {}", target.id());
            return Optional.empty();
        }
        TargetHealth health = tracked.get();
        List<MonitorEvent> events = new ArrayList<>();
        HealthSnapshot snapshot;
        synchronized (health) {
            if (health.isRemoved() || !registry.contains(target.id())) {
                log.debug("Discarding probe result for removed target {}", target.id());
                return Optional.empty();
            }
            health.setLastProbe(result);
            if (result.isSuccess()) {
                health.resetFailures();
                transition(health, HealthStatus.HEALTHY, "probe_succeeded", events);
            } else {
                applyFailure(target, health, result, events);
            }
            snapshot = health.snapshot();
        }
        events.forEach(notifier::publish);
        return Optional.of(snapshot);
    }

    /**
     * Operator-requested redeploy. Only a DOWN target can be redeployed, and the same
     * in-flight and cooldown rules as the automatic path apply. Any other status yields a
     * throttled attempt with reason {@code target_not_down}.
     */
    public RedeployDispatch forceRedeploy(String targetId) {
        Target target = registry.get(targetId);
        TargetHealth health = trackedEntry(target.id()).orElseThrow(() -> new TargetNotFoundException(targetId));
        List<MonitorEvent> events = new ArrayList<>();
        RedeployDispatch dispatch;
        synchronized (health) {
            if (health.isRemoved()) {
                throw new TargetNotFoundException(targetId);
            }
            HealthStatus status = health.status();
            if (status == HealthStatus.DOWN || status == HealthStatus.REDEPLOYING) {
                dispatch = requestRedeploy(target, health, RedeployTrigger.MANUAL, events);
            } else {
                dispatch = RedeployDispatch.throttled(
                    RedeployAttempt.throttled(targetId, RedeployTrigger.MANUAL, clock.instant(), REASON_NOT_DOWN)
                );
            }
        }
        events.forEach(notifier::publish);
        if (!dispatch.started()) {
            log.info("Manual redeploy of {} throttled: {}", targetId, dispatch.throttledAttempt().reason());
        }
        return dispatch;
    }

    public HealthSnapshot snapshot(String targetId) {
        TargetHealth health = trackedEntry(targetId).orElseThrow(() -> new TargetNotFoundException(targetId));
        synchronized (health) {
            return health.snapshot();
        }
    }

    /**
     * Drops all health state of a removed target. A redeploy still in flight completes but
     * its outcome is discarded.
     */
    public void untrack(String targetId) {
        table.remove(targetId);
        try {
            historyStore.delete(targetId);
        } catch (RuntimeException e) {
            log.warn("Failed to delete redeploy history for {}", targetId, e);
        }
    }

    void onRedeployCompleted(RedeployAttempt attempt) {
        Optional<TargetHealth> found = table.find(attempt.targetId());
        if (found.isEmpty()) {
            return;
        }
        TargetHealth health = found.get();
        List<MonitorEvent> events = new ArrayList<>();
        synchronized (health) {
            if (health.isRemoved() || health.status() != HealthStatus.REDEPLOYING) {
                return;
            }
            String reason = "redeploy_" + attempt.outcome().name().toLowerCase(Locale.ROOT);
            if (attempt.outcome() == RedeployOutcome.SUCCEEDED) {
                transition(health, HealthStatus.DEGRADED, reason, events);
            } else {
                transition(health, HealthStatus.DOWN, attempt.reason() == null ? reason : reason + ":" + attempt.reason(), events);
            }
        }
        events.forEach(notifier::publish);
    }

    private void applyFailure(Target target, TargetHealth health, ProbeResult result, List<MonitorEvent> events) {
        int failures = health.incrementFailures();
        HealthStatus status = health.status();
        String reason = result.detail() == null ? result.outcome().name().toLowerCase(Locale.ROOT) : result.detail();
        if (status == HealthStatus.REDEPLOYING) {
            return;
        }
        if (failures >= target.failureThreshold()) {
            if (status != HealthStatus.DOWN) {
                log.warn("Target {} is down after {} consecutive failures ({})", target.id(), failures, reason);
                transition(health, HealthStatus.DOWN, reason, events);
            }
            if (target.autoRedeploy()) {
                requestRedeploy(target, health, RedeployTrigger.AUTOMATIC, events);
            } else if (health.redeployInFlight()) {
                transition(health, HealthStatus.REDEPLOYING, RedeployCoordinator.REASON_IN_FLIGHT, events);
            }
            return;
        }
        if (status == HealthStatus.HEALTHY && failures >= degradedThreshold(target)) {
            transition(health, HealthStatus.DEGRADED, reason, events);
        }
    }

    // caller holds the entry lock
    private RedeployDispatch requestRedeploy(
        Target target,
        TargetHealth health,
        RedeployTrigger trigger,
        List<MonitorEvent> events
    ) {
        RedeployDispatch dispatch = coordinator.tryStart(target, health, trigger, this::onRedeployCompleted);
        // an attempt started earlier may still be running after a recovery and a relapse
        if (health.redeployInFlight() && health.status() == HealthStatus.DOWN) {
            String reason = dispatch.started()
                ? "redeploy_" + trigger.name().toLowerCase(Locale.ROOT)
                : RedeployCoordinator.REASON_IN_FLIGHT;
            transition(health, HealthStatus.REDEPLOYING, reason, events);
        }
        return dispatch;
    }

    private Optional<TargetHealth> trackedEntry(String targetId) {
        if (!registry.contains(targetId)) {
            return Optional.empty();
        }
        TargetHealth health = table.entryFor(targetId);
        if (!registry.contains(targetId)) {
            table.discard(targetId, health);
            return Optional.empty();
        }
        return Optional.of(health);
    }

    private int degradedThreshold(Target target) {
        return Math.min(properties.getHealth().getDegradedAfterFailures(), target.failureThreshold());
    }

    private void transition(TargetHealth health, HealthStatus next, String reason, List<MonitorEvent> events) {
        HealthStatus previous = health.status();
        if (previous == next) {
            return;
        }
        Instant now = clock.instant();
        health.setStatus(next, now);
        events.add(new StatusChangedEvent(health.targetId(), previous, next, reason, now));
    }
}
