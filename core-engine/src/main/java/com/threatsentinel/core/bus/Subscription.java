package com.threatsentinel.core.bus;

/**
 * Handle returned by {@link SecurityEventBus#subscribe}.
 */
@FunctionalInterface
public interface Subscription {

    /**
     * Stop delivery to the listener. Calling it again has no effect.
     */
    void unsubscribe();
}
