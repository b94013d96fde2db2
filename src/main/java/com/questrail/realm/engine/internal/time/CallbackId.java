package com.questrail.realm.engine.internal.time;

/**
 * Opaque handle for a scheduled callback.
 *
 * <p>Handles are unique for the lifetime of a {@link TimedCallbackScheduler}.
 * A recurring series keeps the same handle across all of its firings, so a
 * single {@code cancel} stops the whole series.</p>
 */
public record CallbackId(long value) {

    @Override
    public String toString() {
        return "cb-" + value;
    }
}
