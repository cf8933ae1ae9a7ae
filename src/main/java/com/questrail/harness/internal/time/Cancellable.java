package com.questrail.harness.internal.time;

/**
 * Cancellation handle for a scheduled deadline.
 *
 * <p>Every pending call holds two of these (soft and hard deadline). Both are
 * cancelled as soon as the call settles, whichever way it settles.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was previously cancelled.
     */
    boolean cancel();
}
