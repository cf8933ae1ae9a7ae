package com.questrail.harness.orchestrator;

import com.questrail.harness.api.Signal;
import com.questrail.harness.internal.time.MonotonicClock;
import com.questrail.harness.internal.time.MonotonicScheduler;
import com.questrail.harness.scenario.ConsistencyBarrier;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Consistency barrier that completes once no consistency signal has been
 * observed for a quiet period, counted from the later of the last signal and
 * the call to {@link #await()}.
 *
 * <p>Conductors feed it through their consistency listener.</p>
 */
public final class SignalQuiescenceBarrier implements ConsistencyBarrier, Consumer<Signal>
{
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final long quietNanos;

    private volatile long lastSignalNanos;
    private volatile boolean seenSignal;

    public SignalQuiescenceBarrier(MonotonicClock clock, MonotonicScheduler scheduler, Duration quietPeriod)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(quietPeriod, "quietPeriod");
        if (quietPeriod.isNegative() || quietPeriod.isZero()) {
            throw new IllegalArgumentException("quietPeriod must be positive");
        }
        this.quietNanos = quietPeriod.toNanos();
    }

    @Override
    public void accept(Signal signal)
    {
        lastSignalNanos = clock.nowNanos();
        seenSignal = true;
    }

    @Override
    public CompletableFuture<Void> await()
    {
        CompletableFuture<Void> settled = new CompletableFuture<>();
        check(settled, clock.nowNanos());
        return settled;
    }

    private void check(CompletableFuture<Void> settled, long awaitStartNanos)
    {
        long since = seenSignal ? Math.max(lastSignalNanos, awaitStartNanos) : awaitStartNanos;
        long quietUntil = since + quietNanos;
        if (clock.nowNanos() - quietUntil >= 0) {
            settled.complete(null);
            return;
        }
        scheduler.scheduleAtNanos(quietUntil, () -> check(settled, awaitStartNanos));
    }
}
