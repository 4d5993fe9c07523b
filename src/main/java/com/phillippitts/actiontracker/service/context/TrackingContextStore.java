package com.phillippitts.actiontracker.service.context;

import com.phillippitts.actiontracker.domain.TrackingContext;

import java.util.Optional;

/**
 * Holds the {@link TrackingContext} of each thread handling a unit of work.
 *
 * <p>One active context per thread. {@link #begin()} replaces a stale context silently and
 * {@link #clear()} never fails, so a host that forgets to begin still gets a well-formed result.
 */
public final class TrackingContextStore {

    private final ThreadLocal<TrackingContext> contexts = new ThreadLocal<>();

    /**
     * Allocates a fresh context for the calling thread.
     *
     * @return true if a previous context was still active and got replaced
     */
    public boolean begin() {
        boolean replaced = contexts.get() != null;
        contexts.set(TrackingContext.empty());
        return replaced;
    }

    public Optional<TrackingContext> current() {
        return Optional.ofNullable(contexts.get());
    }

    public boolean isActive() {
        return contexts.get() != null;
    }

    /**
     * Removes the calling thread's context.
     *
     * @return the removed context, or an empty one if none was active
     */
    public TrackingContext clear() {
        TrackingContext ctx = contexts.get();
        contexts.remove();
        return ctx == null ? TrackingContext.empty() : ctx;
    }
}
