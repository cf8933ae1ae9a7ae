package com.questrail.harness.conductor;

import com.questrail.harness.api.Signal;
import com.questrail.harness.internal.exec.ActivityTracker;
import com.questrail.harness.internal.time.WallClock;
import com.questrail.harness.observability.HarnessErrorEvent;
import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.SignalObservabilityEvent;
import com.questrail.harness.observability.SignalObservabilityEvent.Routing;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Routes signals arriving on a conductor's application channel.
 *
 * <p>Consistency signals go to the consistency listener. Every other kind
 * goes to the caller-supplied handler when there is one and is dropped
 * otherwise. A failing handler is reported to the sink; it never reaches
 * the channel's event loop.</p>
 */
final class SignalRouter
{
    private final String conductorName;
    private final Consumer<Signal> consistencyListener;
    private final Optional<Consumer<Signal>> handler;
    private final ActivityTracker activity;
    private final HarnessObservabilitySink sink;
    private final WallClock wallClock;

    SignalRouter(String conductorName,
                 Consumer<Signal> consistencyListener,
                 Optional<Consumer<Signal>> handler,
                 ActivityTracker activity,
                 HarnessObservabilitySink sink,
                 WallClock wallClock)
    {
        this.conductorName = Objects.requireNonNull(conductorName, "conductorName");
        this.consistencyListener = Objects.requireNonNull(consistencyListener, "consistencyListener");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.activity = Objects.requireNonNull(activity, "activity");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    void route(Signal signal)
    {
        activity.recordActivity();

        if (signal.isConsistency()) {
            consistencyListener.accept(signal);
            report(signal, Routing.CONSISTENCY);
            return;
        }

        if (handler.isEmpty()) {
            report(signal, Routing.DROPPED);
            return;
        }

        try {
            handler.get().accept(signal);
            report(signal, Routing.DISPATCHED);
        } catch (RuntimeException e) {
            report(signal, Routing.HANDLER_FAILED);
            sink.onError(new HarnessErrorEvent(wallClock.now(), conductorName,
                    "Signal handler failed on '" + signal.kind() + "'", e));
        }
    }

    private void report(Signal signal, Routing routing)
    {
        sink.onSignal(new SignalObservabilityEvent(wallClock.now(), conductorName, signal, routing));
    }
}
