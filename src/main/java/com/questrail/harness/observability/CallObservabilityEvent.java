package com.questrail.harness.observability;

import com.questrail.harness.internal.exec.CallTarget;

import java.time.Instant;

/**
 * Events emitted by the call dispatcher for a single function call.
 */
public sealed interface CallObservabilityEvent
        permits CallObservabilityEvent.SoftDeadlineExceeded,
                CallObservabilityEvent.HardDeadlineExceeded,
                CallObservabilityEvent.StateDumpCaptured,
                CallObservabilityEvent.StateDumpFailed,
                CallObservabilityEvent.LateResponseIgnored
{
    Instant timestamp();

    CallTarget target();

    /** Still waiting; the call continues. */
    record SoftDeadlineExceeded(Instant timestamp, CallTarget target, long elapsedMs)
            implements CallObservabilityEvent {}

    /** The call was abandoned locally. */
    record HardDeadlineExceeded(Instant timestamp, CallTarget target, long elapsedMs)
            implements CallObservabilityEvent {}

    record StateDumpCaptured(Instant timestamp, CallTarget target, String dump)
            implements CallObservabilityEvent {}

    record StateDumpFailed(Instant timestamp, CallTarget target, Throwable cause)
            implements CallObservabilityEvent {}

    /** A response (or error) arrived after the call had already settled. */
    record LateResponseIgnored(Instant timestamp, CallTarget target)
            implements CallObservabilityEvent {}
}
