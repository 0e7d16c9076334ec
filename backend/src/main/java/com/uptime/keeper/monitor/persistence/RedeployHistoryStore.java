package com.uptime.keeper.monitor.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptime.keeper.monitor.model.RedeployAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class RedeployHistoryStore {
    private static final Logger log = LoggerFactory.getLogger(RedeployHistoryStore.class);
    private static final String KEY_PREFIX = "redeploys/";
    private static final TypeReference<List<RedeployAttempt>> ATTEMPT_LIST = new TypeReference<>() {};

    private final ConfigStore store;
    private final ObjectMapper objectMapper;

    public RedeployHistoryStore(ConfigStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public List<RedeployAttempt> load(String targetId) {
        Optional<String> raw;
        try {
            raw = store.get(keyFor(targetId));
        } catch (ConfigStoreException e) {
            log.warn("Redeploy history for {} unavailable, starting empty", targetId, e);
            return List.of();
        }
        if (raw.isEmpty() || raw.get().isBlank()) {
            return List.of();
        }
        try {
            List<RedeployAttempt> attempts = objectMapper.readValue(raw.get(), ATTEMPT_LIST);
            return attempts == null ? List.of() : List.copyOf(attempts);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable redeploy history for {}", targetId, e);
            return List.of();
        }
    }

    public void save(String targetId, List<RedeployAttempt> attempts) {
        try {
            store.set(keyFor(targetId), objectMapper.writeValueAsString(attempts));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize redeploy history for " + targetId, e);
        }
    }

    public void delete(String targetId) {
        store.delete(keyFor(targetId));
    }

    private String keyFor(String targetId) {
        return KEY_PREFIX + targetId;
    }
}
