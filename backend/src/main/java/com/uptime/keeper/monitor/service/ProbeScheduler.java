package com.uptime.keeper.monitor.service;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.http.TargetProber;
import com.uptime.keeper.monitor.model.ProbeResult;
import com.uptime.keeper.monitor.model.SchedulerStatusResponse;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.registry.TargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Drives periodic probes. A single tick thread walks the registry and hands due targets
 * to a fixed probe pool; a per-target gate keeps at most one probe of a target running.
 */
@Service
public class ProbeScheduler {
    private static final Logger log = LoggerFactory.getLogger(ProbeScheduler.class);

    private final TargetRegistry registry;
    private final TargetProber prober;
    private final HealthTracker healthTracker;
    private final KeeperProperties properties;
    private final LongSupplier nanoTime;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final Semaphore poolPermits;
    private final AtomicInteger probesInFlight = new AtomicInteger();
    private final Map<String, Semaphore> probeGates = new ConcurrentHashMap<>();
    private final Map<String, Long> lastDispatchNanos = new ConcurrentHashMap<>();

    private ScheduledExecutorService tickExecutor;
    private ExecutorService probeExecutor;

    @Autowired
    public ProbeScheduler(
        TargetRegistry registry,
        TargetProber prober,
        HealthTracker healthTracker,
        KeeperProperties properties
    ) {
        this(registry, prober, healthTracker, properties, System::nanoTime);
    }

    ProbeScheduler(
        TargetRegistry registry,
        TargetProber prober,
        HealthTracker healthTracker,
        KeeperProperties properties,
        LongSupplier nanoTime
    ) {
        this.registry = registry;
        this.prober = prober;
        this.healthTracker = healthTracker;
        this.properties = properties;
        this.nanoTime = nanoTime;
        this.poolPermits = new Semaphore(properties.getScheduler().getPoolSize(), true);
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int poolSize = properties.getScheduler().getPoolSize();
            int tickMillis = properties.getScheduler().getTickMillis();
            AtomicInteger workerIndex = new AtomicInteger();
            probeExecutor = Executors.newFixedThreadPool(poolSize, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("probe-worker-" + workerIndex.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            tickExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("probe-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            tickExecutor.scheduleWithFixedDelay(this::safeTick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
            log.info("Probe scheduler started (pool={}, tick={}ms)", poolSize, tickMillis);
        }
    }

    /**
     * Suppresses new dispatches, then lets in-flight probes drain until the shutdown deadline.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (tickExecutor != null) {
                tickExecutor.shutdownNow();
                tickExecutor = null;
            }
            if (probeExecutor != null) {
                probeExecutor.shutdown();
                int timeoutSeconds = properties.getScheduler().getShutdownTimeoutSeconds();
                try {
                    if (!probeExecutor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                        log.warn("Probes still running after {}s; interrupting", timeoutSeconds);
                        probeExecutor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    probeExecutor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
                probeExecutor = null;
            }
            lastDispatchNanos.clear();
            log.info("Probe scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public SchedulerStatusResponse getStatus() {
        int scheduled = (int) registry.list().stream().filter(Target::enabled).count();
        return new SchedulerStatusResponse(
            running.get(),
            properties.getScheduler().getPoolSize(),
            scheduled,
            probesInFlight.get()
        );
    }

    /**
     * Probes a target immediately, waiting for a probe of the same target that is already
     * running, and applies the result.
     */
    public ProbeResult probeNow(Target target) throws InterruptedException {
        Semaphore gate = gateFor(target.id());
        gate.acquire();
        try {
            poolPermits.acquire();
            try {
                return runProbe(target);
            } finally {
                poolPermits.release();
            }
        } finally {
            gate.release();
        }
    }

    void tick() {
        if (!running.get()) {
            return;
        }
        long now = nanoTime.getAsLong();
        List<Target> targets = registry.list();
        Set<String> live = new HashSet<>();
        for (Target target : targets) {
            if (!running.get() || Thread.currentThread().isInterrupted()) {
                return;
            }
            live.add(target.id());
            if (!target.enabled()) {
                lastDispatchNanos.remove(target.id());
                continue;
            }
            Long last = lastDispatchNanos.get(target.id());
            if (last != null && Duration.ofNanos(now - last).compareTo(target.probeInterval()) < 0) {
                continue;
            }
            lastDispatchNanos.put(target.id(), now);
            Semaphore gate = gateFor(target.id());
            if (!gate.tryAcquire()) {
                log.info("Skipping probe of {}: previous probe still running", target.id());
                continue;
            }
            if (!dispatch(target, gate)) {
                return;
            }
        }
        lastDispatchNanos.keySet().retainAll(live);
    }

    /**
     * Drops the scheduling state of a removed target.
     */
    public void forget(String targetId) {
        lastDispatchNanos.remove(targetId);
        probeGates.remove(targetId);
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.warn("Probe scheduler tick failed", e);
        }
    }

    private boolean dispatch(Target target, Semaphore gate) {
        try {
            poolPermits.acquire();
        } catch (InterruptedException e) {
            gate.release();
            Thread.currentThread().interrupt();
            return false;
        }
        ExecutorService executor = probeExecutor;
        try {
            if (executor == null) {
                throw new RejectedExecutionException("probe pool stopped");
            }
            executor.execute(() -> {
                try {
                    runProbe(target);
                } catch (Exception e) {
                    log.warn("Probe task for {} failed", target.id(), e);
                } finally {
                    poolPermits.release();
                    gate.release();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            poolPermits.release();
            gate.release();
            log.debug("Probe dispatch of {} rejected: {}", target.id(), e.getMessage());
            return false;
        }
    }

    private ProbeResult runProbe(Target target) {
        probesInFlight.incrementAndGet();
        try {
            ProbeResult result = prober.probe(target);
            healthTracker.record(result);
            return result;
        } finally {
            probesInFlight.decrementAndGet();
        }
    }

    private Semaphore gateFor(String targetId) {
        return probeGates.computeIfAbsent(targetId, id -> new Semaphore(1, true));
    }
}
