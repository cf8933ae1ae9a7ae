package com.questrail.harness.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for call deadlines and quiescence windows.
 *
 * <h2>Binding invariant</h2>
 * Soft and hard call deadlines are computed from this clock only. Wall-clock
 * time ({@code Instant.now()}) is permitted for observability events, never
 * for deciding whether a call has expired.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
