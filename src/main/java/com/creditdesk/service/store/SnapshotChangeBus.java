package com.creditdesk.service.store;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Typed publish/subscribe channel of one store.
 *
 * A listener is registered at most once: subscribing it again returns the
 * existing subscription. A failing listener is logged and skipped, the
 * others still receive the event.
 */
@Slf4j
public class SnapshotChangeBus {

    private final Map<SnapshotListener, Subscription> listeners = new LinkedHashMap<>();

    public synchronized Subscription subscribe(SnapshotListener listener) {
        Subscription existing = listeners.get(listener);
        if (existing != null) {
            return existing;
        }
        AtomicBoolean disposed = new AtomicBoolean(false);
        Subscription subscription = () -> {
            if (disposed.compareAndSet(false, true)) {
                remove(listener);
            }
        };
        listeners.put(listener, subscription);
        return subscription;
    }

    public void publish(SnapshotChangeEvent event) {
        List<SnapshotListener> targets;
        synchronized (this) {
            targets = new ArrayList<>(listeners.keySet());
        }
        for (SnapshotListener listener : targets) {
            try {
                listener.onSnapshotChanged(event);
                log.debug("Dispatched change of {} to {}", event.key(), listener);
            } catch (RuntimeException e) {
                log.error("Snapshot listener failed for key {}", event.key(), e);
            }
        }
    }

    public synchronized int listenerCount() {
        return listeners.size();
    }

    private synchronized void remove(SnapshotListener listener) {
        listeners.remove(listener);
    }
}
