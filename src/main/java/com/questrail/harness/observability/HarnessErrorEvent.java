package com.questrail.harness.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * A failure the harness reported and then carried on from.
 *
 * @param conductorName conductor the failure belongs to
 * @param message       what was being done
 * @param cause         the failure itself
 */
public record HarnessErrorEvent(Instant timestamp, String conductorName, String message, Throwable cause) {

    public HarnessErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(conductorName, "conductorName");
        Objects.requireNonNull(message, "message");
    }
}
