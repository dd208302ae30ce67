package com.creditdesk.service.store;

import com.creditdesk.model.Snapshot;

/**
 * Delivered to listeners after every successful write.
 *
 * @param key      persisted key of the snapshot
 * @param snapshot state after the write, a copy listeners must treat as read-only
 * @param remote   true when the write happened in another context and the
 *                 snapshot was re-read from the backend
 */
public record SnapshotChangeEvent(
        String key,
        Snapshot snapshot,
        boolean remote
) {
}
