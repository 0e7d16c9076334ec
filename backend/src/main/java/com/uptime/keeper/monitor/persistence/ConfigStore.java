package com.uptime.keeper.monitor.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Durable key-value store backing target configuration and redeploy history.
 * Writes are synchronous: once a call returns, the change survives a restart.
 */
public interface ConfigStore {

    Optional<String> get(String key);

    void set(String key, String value);

    /**
     * @return true if an entry was deleted
     */
    boolean delete(String key);

    /**
     * Entries whose key starts with {@code prefix}, in the order they were first written.
     */
    List<ConfigEntry> list(String prefix);
}
