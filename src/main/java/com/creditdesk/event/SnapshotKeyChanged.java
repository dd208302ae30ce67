package com.creditdesk.event;

import java.time.Instant;

/**
 * Announcement that the snapshot stored under {@code key} was rewritten.
 *
 * Carries only the key: receivers re-read the full snapshot from their
 * backend, there is no partial update on the wire.
 */
public record SnapshotKeyChanged(
    String key,           // Persisted key, e.g. mimmoza.banque.snapshot.v1
    String originId,      // Store instance that wrote; receivers skip their own writes
    Instant timestamp
) {
    public SnapshotKeyChanged {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Snapshot key cannot be null or empty");
        }
        if (originId == null || originId.isBlank()) {
            throw new IllegalArgumentException("Origin ID cannot be null or empty");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
