package com.questrail.harness.observability;

/**
 * Main interface for receiving harness observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive from channel event loops and scheduler threads;
 * implementations must be thread-safe and must not block.</p>
 */
public interface HarnessObservabilitySink {
    /**
     * Called when a conductor changes lifecycle state.
     */
    void onStateTransition(ConductorStateTransitionEvent event);

    /**
     * Called for call-dispatch events: deadline warnings, timeouts, state
     * dumps, late responses.
     */
    void onCallEvent(CallObservabilityEvent event);

    /**
     * Called when a control channel comes up or goes down.
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called for every signal received, with how it was routed.
     */
    void onSignal(SignalObservabilityEvent event);

    /**
     * Called for failures that are reported but intentionally not propagated.
     */
    void onError(HarnessErrorEvent event);
}
