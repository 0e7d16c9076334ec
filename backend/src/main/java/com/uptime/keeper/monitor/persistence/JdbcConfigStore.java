package com.uptime.keeper.monitor.persistence;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcConfigStore implements ConfigStore {
    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcConfigStore(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        requireKey(key);
        try {
            List<String> rows = jdbc.query(
                """
                    SELECT entry_value
                    FROM config_entries
                    WHERE entry_key = :key
                    """,
                new MapSqlParameterSource().addValue("key", key),
                (rs, rowNum) -> rs.getString("entry_value")
            );
            return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
        } catch (DataAccessException e) {
            throw new ConfigStoreException("Failed to read config entry " + key, e);
        }
    }

    @Override
    public void set(String key, String value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value must not be null for key " + key);
        }
        Timestamp now = Timestamp.from(clock.instant());
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("value", value)
            .addValue("now", now);
        try {
            int updated = jdbc.update(
                """
                    UPDATE config_entries
                    SET entry_value = :value,
                        updated_at = :now
                    WHERE entry_key = :key
                    """,
                params
            );
            if (updated == 0) {
                jdbc.update(
                    """
                        INSERT INTO config_entries (entry_key, entry_value, created_at, updated_at)
                        VALUES (:key, :value, :now, :now)
                        """,
                    params
                );
            }
        } catch (DataAccessException e) {
            throw new ConfigStoreException("Failed to write config entry " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        requireKey(key);
        try {
            return jdbc.update(
                """
                    DELETE FROM config_entries
                    WHERE entry_key = :key
                    """,
                new MapSqlParameterSource().addValue("key", key)
            ) > 0;
        } catch (DataAccessException e) {
            throw new ConfigStoreException("Failed to delete config entry " + key, e);
        }
    }

    @Override
    public List<ConfigEntry> list(String prefix) {
        String safePrefix = prefix == null ? "" : prefix;
        try {
            List<ConfigEntry> rows = jdbc.query(
                """
                    SELECT entry_key, entry_value
                    FROM config_entries
                    WHERE entry_key LIKE :pattern
                    ORDER BY entry_seq ASC
                    """,
                new MapSqlParameterSource().addValue("pattern", safePrefix + "%"),
                (rs, rowNum) -> new ConfigEntry(rs.getString("entry_key"), rs.getString("entry_value"))
            );
            // LIKE treats '_' as a wildcard
            return rows.stream()
                .filter(entry -> entry.key().startsWith(safePrefix))
                .toList();
        } catch (DataAccessException e) {
            throw new ConfigStoreException("Failed to list config entries under " + safePrefix, e);
        }
    }

    private void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("config key must not be blank");
        }
    }
}
