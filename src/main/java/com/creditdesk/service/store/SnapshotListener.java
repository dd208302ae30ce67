package com.creditdesk.service.store;

@FunctionalInterface
public interface SnapshotListener {

    void onSnapshotChanged(SnapshotChangeEvent event);
}
