package com.creditdesk.repository;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed storage for tests and {@code memory} mode. Nothing survives a restart.
 * Two stores sharing one instance behave like two contexts sharing one persisted key.
 */
@Component
@ConditionalOnProperty(prefix = "banque.store", name = "backend", havingValue = "memory")
public class InMemorySnapshotBackend implements SnapshotBackend {

    private final Map<String, String> payloads = new ConcurrentHashMap<>();

    @Override
    public Optional<String> load(String key) {
        return Optional.ofNullable(payloads.get(key));
    }

    @Override
    public void save(String key, String payload) {
        payloads.put(key, payload);
    }

    @Override
    public void delete(String key) {
        payloads.remove(key);
    }
}
