package com.questrail.harness.internal.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.error.CallTimeoutException;
import com.questrail.harness.internal.time.Cancellable;
import com.questrail.harness.internal.time.MonotonicClock;
import com.questrail.harness.internal.time.MonotonicScheduler;
import com.questrail.harness.internal.time.WallClock;
import com.questrail.harness.observability.CallObservabilityEvent;
import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.util.Futures;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * CallDispatcher
 * =============================================================================
 * Wraps every application function call with a soft and a hard deadline.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Soft deadline: emits a still-waiting event; the call continues.</li>
 *   <li>Hard deadline: the call is abandoned locally. With state dumps enabled
 *       the target cell's state is requested and logged first; the call then
 *       fails with {@link CallTimeoutException} whether or not the dump
 *       succeeded. A dump not answered within the policy's state dump
 *       timeout counts as failed.</li>
 *   <li>The response and the hard deadline race for one outcome (see
 *       {@link PendingCall#claim()}). A response arriving after the deadline
 *       is reported as ignored and never completes the caller's future.</li>
 *   <li>Both deadlines are cancelled on every terminal outcome.</li>
 * </ul>
 *
 * <p>No retries, and no per-conductor lock: calls to different cells may be
 * in flight at the same time and complete in whatever order the channel
 * delivers their responses.</p>
 */
public final class CallDispatcher {

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final CallTimingPolicy timingPolicy;
    private final HarnessObservabilitySink sink;

    private final Set<PendingCall> pending = ConcurrentHashMap.newKeySet();

    public CallDispatcher(MonotonicClock clock,
                          MonotonicScheduler scheduler,
                          WallClock wallClock,
                          CallTimingPolicy timingPolicy,
                          HarnessObservabilitySink sink)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public CallTimingPolicy timingPolicy() {
        return timingPolicy;
    }

    /**
     * Number of calls that have neither settled nor timed out.
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Issue {@code call} under this dispatcher's deadlines.
     *
     * @param target    what is being called; used for diagnostics only
     * @param call      starts the remote call; invoked exactly once, after the deadlines are armed
     * @param stateDump requests a state dump for a target; used only when dumps are enabled
     * @return the call's outcome
     */
    public CompletableFuture<JsonNode> dispatch(CallTarget target,
                                                Supplier<CompletableFuture<JsonNode>> call,
                                                Function<CallTarget, CompletableFuture<String>> stateDump)
    {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(stateDump, "stateDump");

        PendingCall pendingCall = new PendingCall(target, clock.nowNanos());
        pending.add(pendingCall);

        Cancellable soft = timingPolicy.hasSoftDeadline()
                ? scheduler.scheduleAfter(timingPolicy.softTimeout(), clock, () -> onSoftDeadline(pendingCall))
                : null;
        Cancellable hard = scheduler.scheduleAfter(timingPolicy.hardTimeout(), clock,
                () -> onHardDeadline(pendingCall, stateDump));
        pendingCall.arm(soft, hard);

        CompletableFuture<JsonNode> inFlight;
        try {
            inFlight = Objects.requireNonNull(call.get(), "call returned null");
        } catch (RuntimeException e) {
            inFlight = CompletableFuture.failedFuture(e);
        }

        inFlight.whenComplete((value, error) -> onResponse(pendingCall, value, error));
        return pendingCall.result();
    }

    private void onResponse(PendingCall call, JsonNode value, Throwable error) {
        if (!call.claim()) {
            sink.onCallEvent(new CallObservabilityEvent.LateResponseIgnored(wallClock.now(), call.target()));
            return;
        }
        release(call);

        if (error != null) {
            call.result().completeExceptionally(Futures.unwrap(error));
        } else {
            call.result().complete(value);
        }
    }

    private void onSoftDeadline(PendingCall call) {
        if (!call.isPending()) {
            return;
        }
        sink.onCallEvent(new CallObservabilityEvent.SoftDeadlineExceeded(
                wallClock.now(), call.target(), elapsedMs(call)));
    }

    private void onHardDeadline(PendingCall call, Function<CallTarget, CompletableFuture<String>> stateDump) {
        if (!call.claim()) {
            return;
        }
        release(call);

        long elapsedMs = elapsedMs(call);
        CallTarget target = call.target();
        sink.onCallEvent(new CallObservabilityEvent.HardDeadlineExceeded(wallClock.now(), target, elapsedMs));

        if (!timingPolicy.stateDumpOnTimeout()) {
            call.result().completeExceptionally(timeout(target, elapsedMs, null));
            return;
        }

        CompletableFuture<String> dump;
        try {
            dump = Objects.requireNonNull(stateDump.apply(target), "state dump returned null");
        } catch (RuntimeException e) {
            dump = CompletableFuture.failedFuture(e);
        }

        AtomicBoolean dumpSettled = new AtomicBoolean(false);
        Cancellable dumpDeadline = scheduler.scheduleAfter(timingPolicy.stateDumpTimeout(), clock, () -> {
            if (dumpSettled.compareAndSet(false, true)) {
                sink.onCallEvent(new CallObservabilityEvent.StateDumpFailed(wallClock.now(), target,
                        new TimeoutException("state dump not answered within " + timingPolicy.stateDumpTimeout())));
                call.result().completeExceptionally(timeout(target, elapsedMs, null));
            }
        });

        dump.whenComplete((text, error) -> {
            if (!dumpSettled.compareAndSet(false, true)) {
                return;
            }
            dumpDeadline.cancel();
            if (error != null) {
                sink.onCallEvent(new CallObservabilityEvent.StateDumpFailed(wallClock.now(), target, Futures.unwrap(error)));
                call.result().completeExceptionally(timeout(target, elapsedMs, null));
            } else {
                sink.onCallEvent(new CallObservabilityEvent.StateDumpCaptured(wallClock.now(), target, text));
                call.result().completeExceptionally(timeout(target, elapsedMs, text));
            }
        });
    }

    private void release(PendingCall call) {
        call.disarm();
        pending.remove(call);
    }

    private long elapsedMs(PendingCall call) {
        return TimeUnit.NANOSECONDS.toMillis(clock.nowNanos() - call.startNanos());
    }

    private static CallTimeoutException timeout(CallTarget target, long elapsedMs, String dump) {
        return new CallTimeoutException(
                target.conductorName(), target.cellNick(), target.zomeName(), target.fnName(), elapsedMs, dump);
    }
}
