package com.uptime.keeper.monitor.service;

import com.uptime.keeper.config.KeeperProperties;
import com.uptime.keeper.monitor.persistence.RedeployHistoryStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link TargetHealth} per target id. Entries are created on first use with the
 * persisted redeploy history, so cooldowns survive restarts.
 */
@Component
public class TargetHealthTable {
    private final Map<String, TargetHealth> entries = new ConcurrentHashMap<>();
    private final RedeployHistoryStore historyStore;
    private final KeeperProperties properties;
    private final Clock clock;

    public TargetHealthTable(RedeployHistoryStore historyStore, KeeperProperties properties, Clock clock) {
        this.historyStore = historyStore;
        this.properties = properties;
        this.clock = clock;
    }

    public TargetHealth entryFor(String targetId) {
        TargetHealth existing = entries.get(targetId);
        if (existing != null) {
            return existing;
        }
        TargetHealth created = new TargetHealth(
            targetId,
            clock.instant(),
            historyStore.load(targetId),
            properties.getRedeploy().getHistorySize()
        );
        TargetHealth raced = entries.putIfAbsent(targetId, created);
        return raced == null ? created : raced;
    }

    public Optional<TargetHealth> find(String targetId) {
        return Optional.ofNullable(entries.get(targetId));
    }

    /**
     * Drops {@code entry} only if it is still the one mapped to {@code targetId}.
     */
    public void discard(String targetId, TargetHealth entry) {
        if (entries.remove(targetId, entry)) {
            synchronized (entry) {
                entry.markRemoved();
            }
        }
    }

    public void remove(String targetId) {
        TargetHealth removed = entries.remove(targetId);
        if (removed != null) {
            synchronized (removed) {
                removed.markRemoved();
            }
        }
    }
}
