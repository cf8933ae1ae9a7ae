package com.questrail.harness.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used to timestamp observability events.
 * Must not be used for deadline decisions.
 */
public interface WallClock
{
    Instant now();
}
