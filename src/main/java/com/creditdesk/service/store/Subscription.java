package com.creditdesk.service.store;

/**
 * Handle returned by a registration. Disposing twice is harmless.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
