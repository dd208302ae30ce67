package com.creditdesk.service.store;

/**
 * Carries "key changed" announcements between contexts sharing one persisted key
 * (several stores in a JVM, or several instances behind Kafka).
 */
public interface SnapshotChangeRelay {

    /**
     * Tell the other contexts that the snapshot under {@code key} was rewritten.
     * Never throws; delivery failures are logged by the relay.
     */
    void announce(String key, String originId);

    Subscription subscribe(RemoteChangeHandler handler);

    @FunctionalInterface
    interface RemoteChangeHandler {
        void onRemoteChange(String key, String originId);
    }
}
