package com.questrail.harness.observability;

import java.time.Instant;

/**
 * Control channel lifecycle events, per conductor and channel role.
 */
public sealed interface TransportObservabilityEvent
        permits TransportObservabilityEvent.ChannelUp, TransportObservabilityEvent.ChannelDown
{
    Instant timestamp();

    String conductorName();

    /** {@code "admin"} or {@code "app"}. */
    String role();

    record ChannelUp(Instant timestamp, String conductorName, String role, String endpoint)
            implements TransportObservabilityEvent {}

    record ChannelDown(Instant timestamp, String conductorName, String role, Throwable cause)
            implements TransportObservabilityEvent {}
}
