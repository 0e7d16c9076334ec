package com.uptime.keeper.monitor.service;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.model.ProbeResult;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.model.TargetHealthView;
import com.uptime.keeper.monitor.model.TargetRequest;
import com.uptime.keeper.monitor.model.TargetUpdate;
import com.uptime.keeper.monitor.registry.InvalidTargetConfigException;
import com.uptime.keeper.monitor.registry.TargetNotFoundException;
import com.uptime.keeper.monitor.registry.TargetRegistry;
import com.uptime.keeper.monitor.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Operations exposed to operators: target configuration, status queries and manual
 * probe/redeploy triggers.
 */
@Service
public class MonitorService {
    private static final Logger log = LoggerFactory.getLogger(MonitorService.class);

    private final TargetRegistry registry;
    private final HealthTracker healthTracker;
    private final ProbeScheduler scheduler;
    private final KeeperProperties properties;
    private final Clock clock;

    public MonitorService(
        TargetRegistry registry,
        HealthTracker healthTracker,
        ProbeScheduler scheduler,
        KeeperProperties properties,
        Clock clock
    ) {
        this.registry = registry;
        this.healthTracker = healthTracker;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    public List<Target> listTargets() {
        return registry.list();
    }

    public Target getTarget(String id) {
        return registry.get(id);
    }

    public Target addTarget(TargetRequest request) {
        if (request == null) {
            throw new InvalidTargetConfigException(List.of("target body is required"));
        }
        KeeperProperties.Defaults defaults = properties.getDefaults();
        Target target = new Target(
            request.id(),
            request.url(),
            request.provider(),
            request.deployHookUrl(),
            request.serviceId(),
            request.probeIntervalSeconds() == null ? defaults.getProbeIntervalSeconds() : request.probeIntervalSeconds(),
            request.failureThreshold() == null ? defaults.getFailureThreshold() : request.failureThreshold(),
            request.redeployCooldownSeconds() == null
                ? defaults.getRedeployCooldownSeconds()
                : request.redeployCooldownSeconds(),
            request.enabled() == null || request.enabled(),
            request.autoRedeploy() == null || request.autoRedeploy()
        );
        return registry.add(target);
    }

    public Target updateTarget(String id, TargetUpdate update) {
        return registry.update(id, update);
    }

    public void removeTarget(String id) {
        registry.remove(id);
        scheduler.forget(id);
        healthTracker.untrack(id);
    }

    public TargetHealthView getHealth(String id) {
        Target target = registry.get(id);
        return new TargetHealthView(target, healthTracker.snapshot(id));
    }

    public List<TargetHealthView> listHealth() {
        List<TargetHealthView> views = new ArrayList<>();
        for (Target target : registry.list()) {
            try {
                views.add(new TargetHealthView(target, healthTracker.snapshot(target.id())));
            } catch (TargetNotFoundException e) {
                log.debug("Target {} removed while listing health", target.id());
            }
        }
        return views;
    }

    public ProbeResult forceProbe(String id) {
        Target target = registry.get(id);
        try {
            return scheduler.probeNow(target);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.connectionError(id, clock.instant(), Duration.ZERO, FailureClassifier.INTERRUPTED);
        }
    }

    public RedeployDispatch forceRedeploy(String id) {
        return healthTracker.forceRedeploy(id);
    }
}
