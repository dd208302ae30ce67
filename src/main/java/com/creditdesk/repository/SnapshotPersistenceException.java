package com.creditdesk.repository;

/**
 * Raised by a {@link SnapshotBackend} when the storage medium rejects a read or a write.
 */
public class SnapshotPersistenceException extends RuntimeException {

    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
