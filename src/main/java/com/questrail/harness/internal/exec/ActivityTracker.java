package com.questrail.harness.internal.exec;

import com.questrail.harness.internal.time.MonotonicClock;

import java.util.Objects;

/**
 * ActivityTracker
 * -----------------------------------------------------------------------------
 * Records the last successful interaction with a conductor in monotonic time
 * and forwards each one to an external callback, which callers use to reset
 * their own liveness timers.
 */
public final class ActivityTracker {

    private final MonotonicClock clock;
    private final Runnable onActivity;
    private volatile long lastActivityNanos;

    public ActivityTracker(MonotonicClock clock, Runnable onActivity) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.onActivity = Objects.requireNonNull(onActivity, "onActivity");
    }

    public void recordActivity() {
        lastActivityNanos = clock.nowNanos();
        onActivity.run();
    }

    /**
     * Returns the last recorded activity time, or 0 if none.
     */
    public long lastActivityNanos() {
        return lastActivityNanos;
    }
}
