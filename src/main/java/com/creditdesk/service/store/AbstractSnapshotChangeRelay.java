package com.creditdesk.service.store;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handler bookkeeping shared by relays; subclasses decide how an announcement travels.
 */
@Slf4j
public abstract class AbstractSnapshotChangeRelay implements SnapshotChangeRelay {

    private final List<RemoteChangeHandler> handlers = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(RemoteChangeHandler handler) {
        handlers.add(handler);
        AtomicBoolean disposed = new AtomicBoolean(false);
        return () -> {
            if (disposed.compareAndSet(false, true)) {
                handlers.remove(handler);
            }
        };
    }

    protected void dispatch(String key, String originId) {
        for (RemoteChangeHandler handler : handlers) {
            try {
                handler.onRemoteChange(key, originId);
            } catch (RuntimeException e) {
                log.error("Remote change handler failed for key {} (origin {})", key, originId, e);
            }
        }
    }

    protected int handlerCount() {
        return handlers.size();
    }
}
