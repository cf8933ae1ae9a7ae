package com.questrail.harness.observability;

import com.questrail.harness.api.Signal;

import java.time.Instant;

/**
 * A signal arrived on a conductor's application channel.
 */
public record SignalObservabilityEvent(
    Instant timestamp,
    String conductorName,
    Signal signal,
    Routing routing
) {
    public enum Routing {
        /** Consumed by the consistency listener. */
        CONSISTENCY,
        /** Passed to the caller-supplied handler. */
        DISPATCHED,
        /** No handler for this kind; dropped. */
        DROPPED,
        /** The caller-supplied handler threw; the failure was logged. */
        HANDLER_FAILED
    }
}
