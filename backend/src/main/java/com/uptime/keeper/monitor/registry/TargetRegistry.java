package com.uptime.keeper.monitor.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptime.keeper.monitor.model.Target;
import com.uptime.keeper.monitor.model.TargetUpdate;
import com.uptime.keeper.monitor.persistence.ConfigEntry;
import com.uptime.keeper.monitor.persistence.ConfigStore;
import com.uptime.keeper.monitor.persistence.ConfigStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the set of monitored targets. Mutations are written through to the
 * {@link ConfigStore} before the in-memory view changes, so a failed write leaves the
 * registry untouched. {@link #list()} hands out immutable snapshots.
 */
@Service
public class TargetRegistry {
    private static final Logger log = LoggerFactory.getLogger(TargetRegistry.class);
    private static final String KEY_PREFIX = "targets/";

    private final ConfigStore store;
    private final ObjectMapper objectMapper;
    private final Object lock = new Object();
    private final Map<String, Target> targets = new LinkedHashMap<>();

    public TargetRegistry(ConfigStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void load() {
        List<ConfigEntry> entries;
        try {
            entries = store.list(KEY_PREFIX);
        } catch (ConfigStoreException e) {
            log.warn("Config store unreachable; starting with an empty target registry", e);
            return;
        }
        synchronized (lock) {
            targets.clear();
            for (ConfigEntry entry : entries) {
                try {
                    Target target = objectMapper.readValue(entry.value(), Target.class);
                    targets.put(target.id(), TargetValidator.validate(target));
                } catch (JsonProcessingException | InvalidTargetConfigException e) {
                    log.warn("Skipping unreadable target entry {}", entry.key(), e);
                }
            }
        }
        log.info("Loaded {} targets from config store", entries.size());
    }

    public Target add(Target candidate) {
        Target target = TargetValidator.validate(candidate);
        synchronized (lock) {
            if (targets.containsKey(target.id())) {
                throw new DuplicateTargetException(target.id());
            }
            persist(target);
            targets.put(target.id(), target);
        }
        log.info("Registered target {} ({}, every {}s)", target.id(), target.url(), target.probeIntervalSeconds());
        return target;
    }

    public Target update(String id, TargetUpdate update) {
        if (update == null) {
            throw new InvalidTargetConfigException(List.of("update body is required"));
        }
        Target updated;
        synchronized (lock) {
            Target current = targets.get(id);
            if (current == null) {
                throw new TargetNotFoundException(id);
            }
            updated = TargetValidator.validate(update.applyTo(current));
            persist(updated);
            targets.put(id, updated);
        }
        log.info("Updated target {}", id);
        return updated;
    }

    public Target remove(String id) {
        Target removed;
        synchronized (lock) {
            if (!targets.containsKey(id)) {
                throw new TargetNotFoundException(id);
            }
            store.delete(keyFor(id));
            removed = targets.remove(id);
        }
        log.info("Removed target {}", id);
        return removed;
    }

    public Target get(String id) {
        return find(id).orElseThrow(() -> new TargetNotFoundException(id));
    }

    public Optional<Target> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(targets.get(id));
        }
    }

    public boolean contains(String id) {
        return find(id).isPresent();
    }

    public List<Target> list() {
        synchronized (lock) {
            return List.copyOf(targets.values());
        }
    }

    private void persist(Target target) {
        String json;
        try {
            json = objectMapper.writeValueAsString(target);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize target " + target.id(), e);
        }
        store.set(keyFor(target.id()), json);
    }

    private String keyFor(String id) {
        return KEY_PREFIX + id;
    }
}
