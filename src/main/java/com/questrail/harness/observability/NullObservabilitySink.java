package com.questrail.harness.observability;

/**
 * No-op implementation of {@link HarnessObservabilitySink}.
 */
public final class NullObservabilitySink implements HarnessObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ConductorStateTransitionEvent event) {}

    @Override
    public void onCallEvent(CallObservabilityEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onSignal(SignalObservabilityEvent event) {}

    @Override
    public void onError(HarnessErrorEvent event) {}
}
