package com.creditdesk.repository;

import java.util.Optional;

/**
 * Durable storage of serialized snapshots, one payload per key.
 *
 * Implementations throw {@link SnapshotPersistenceException} when the medium
 * is unavailable; the store decides what a failure means.
 */
public interface SnapshotBackend {

    Optional<String> load(String key);

    void save(String key, String payload);

    void delete(String key);
}
