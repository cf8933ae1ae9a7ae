package com.questrail.harness.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of {@link HarnessObservabilitySink} that emits logs via SLF4J.
 */
public final class Slf4jHarnessObservabilitySink implements HarnessObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jHarnessObservabilitySink.class);

    @Override
    public void onStateTransition(ConductorStateTransitionEvent event) {
        log.info("Conductor {}: {} -> {}",
            event.conductorName(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onCallEvent(CallObservabilityEvent event) {
        var target = event.target();
        if (event instanceof CallObservabilityEvent.SoftDeadlineExceeded soft) {
            log.warn("Still waiting on {}/{} for cell {} of conductor {} after {} ms",
                target.zomeName(), target.fnName(), target.cellNick(), target.conductorName(), soft.elapsedMs());
        } else if (event instanceof CallObservabilityEvent.HardDeadlineExceeded hard) {
            log.error("Call {}/{} for cell {} of conductor {} timed out after {} ms",
                target.zomeName(), target.fnName(), target.cellNick(), target.conductorName(), hard.elapsedMs());
        } else if (event instanceof CallObservabilityEvent.StateDumpCaptured dump) {
            log.error("State dump for cell {} of conductor {}:\n{}",
                target.cellNick(), target.conductorName(), dump.dump());
        } else if (event instanceof CallObservabilityEvent.StateDumpFailed failed) {
            log.error("State dump for cell {} of conductor {} failed",
                target.cellNick(), target.conductorName(), failed.cause());
        } else {
            log.debug("Ignoring late response for {}/{} on conductor {}",
                target.zomeName(), target.fnName(), target.conductorName());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event instanceof TransportObservabilityEvent.ChannelUp up) {
            log.debug("Conductor {}: {} channel connected at {}", up.conductorName(), up.role(), up.endpoint());
        } else {
            log.debug("Conductor {}: {} channel closed", event.conductorName(), event.role());
        }
    }

    @Override
    public void onSignal(SignalObservabilityEvent event) {
        log.debug("Conductor {}: signal '{}' {}",
            event.conductorName(), event.signal().kind(), event.routing());
    }

    @Override
    public void onError(HarnessErrorEvent event) {
        log.error("Conductor {}: {}", event.conductorName(), event.message(), event.cause());
    }
}
