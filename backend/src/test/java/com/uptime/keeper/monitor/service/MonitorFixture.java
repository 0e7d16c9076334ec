package com.uptime.keeper.monitor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.config.MonitorConfig;
import com.uptime.keeper.monitor.model.HealthSnapshot;
import com.uptime.keeper.monitor.model.HealthStatus;
import com.uptime.keeper.monitor.model.ProbeResult;
import com.uptime.keeper.monitor.model.ProviderType;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.notify.MonitorEvent;
import com.uptime.keeper.monitor.notify.MonitorNotifier;
import com.uptime.keeper.monitor.notify.StatusChangedEvent;
import com.uptime.keeper.monitor.persistence.InMemoryConfigStore;
import com.uptime.keeper.monitor.persistence.RedeployHistoryStore;
import com.uptime.keeper.monitor.provider.HostingProviderRegistry;
import com.uptime.keeper.monitor.registry.TargetRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

/**
 * Wires the monitoring core with in-memory collaborators and a synchronous notifier.
 */
class MonitorFixture implements AutoCloseable {
    final KeeperProperties properties = new KeeperProperties();
    final MutableClock clock = new MutableClock(Instant.parse("2026-05-01T12:00:00Z"));
    final InMemoryConfigStore store = new InMemoryConfigStore();
    final ObjectMapper objectMapper = new MonitorConfig().objectMapper();
    final ScriptedProvider provider = new ScriptedProvider();
    final List<MonitorEvent> events = new CopyOnWriteArrayList<>();
    final MonitorNotifier notifier = events::add;
    final ExecutorService redeployExecutor;
    final RedeployHistoryStore historyStore = new RedeployHistoryStore(store, objectMapper);
    final TargetRegistry registry = new TargetRegistry(store, objectMapper);
    final TargetHealthTable table;
    final RedeployCoordinator coordinator;
    final HealthTracker tracker;

    MonitorFixture() {
        this(30);
    }

    MonitorFixture(int providerTimeoutSeconds) {
        this(providerTimeoutSeconds, Executors.newCachedThreadPool());
    }

    MonitorFixture(int providerTimeoutSeconds, ExecutorService redeployExecutor) {
        this.redeployExecutor = redeployExecutor;
        properties.getRedeploy().setProviderTimeoutSeconds(providerTimeoutSeconds);
        registry.load();
        table = new TargetHealthTable(historyStore, properties, clock);
        coordinator = new RedeployCoordinator(
            new HostingProviderRegistry(List.of(provider)),
            historyStore,
            notifier,
            redeployExecutor,
            properties,
            clock
        );
        tracker = new HealthTracker(registry, table, coordinator, historyStore, notifier, properties, clock);
    }

    Target register(String id, int threshold, long cooldownSeconds, boolean autoRedeploy) {
        return registry.add(new Target(
            id,
            "https://" + id + ".example.com/health",
            ProviderType.RENDER,
            "https://api.render.com/deploy/srv-" + id + "?key=k",
            null,
            10,
            threshold,
            cooldownSeconds,
            true,
            autoRedeploy
        ));
    }

    /**
     * Registers a target without automatic redeploys and fails it once, leaving it DOWN.
     */
    Target registerDown(String id, long cooldownSeconds) {
        Target target = register(id, 1, cooldownSeconds, false);
        timeout(id);
        return target;
    }

    HealthSnapshot success(String id) {
        return tracker.record(ProbeResult.success(id, clock.instant(), 200, Duration.ofMillis(20))).orElseThrow();
    }

    HealthSnapshot timeout(String id) {
        return tracker.record(ProbeResult.timeout(id, clock.instant(), Duration.ofSeconds(5))).orElseThrow();
    }

    List<StatusChangedEvent> statusEvents(String id) {
        return events.stream()
            .filter(StatusChangedEvent.class::isInstance)
            .map(StatusChangedEvent.class::cast)
            .filter(event -> event.targetId().equals(id))
            .toList();
    }

    void awaitStatus(String id, HealthStatus status) {
        awaitCondition(() -> {
            HealthSnapshot snapshot = tracker.snapshot(id);
            return snapshot.status() == status && !snapshot.redeployInFlight();
        });
    }

    void awaitIdle() {
        awaitCondition(() -> coordinator.inFlightCount() == 0);
    }

    static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 10s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("interrupted while waiting", e);
            }
        }
    }

    @Override
    public void close() {
        provider.release();
        redeployExecutor.shutdownNow();
    }
}
