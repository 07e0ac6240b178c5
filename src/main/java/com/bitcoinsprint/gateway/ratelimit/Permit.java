package com.bitcoinsprint.gateway.ratelimit;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One in-flight slot of an identity. Releasing more than once is a no-op, so callers can
 * release from every exit path without tracking which one ran first.
 */
public final class Permit implements AutoCloseable {

    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Permit(Runnable onRelease) {
        this.onRelease = onRelease;
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        release();
    }
}
