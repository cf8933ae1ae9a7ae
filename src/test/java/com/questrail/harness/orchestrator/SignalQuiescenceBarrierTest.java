package com.questrail.harness.orchestrator;

import com.questrail.harness.api.Signal;
import com.questrail.harness.time.DeterministicScheduler;
import com.questrail.harness.time.ManualMonotonicClock;
import com.questrail.harness.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * SignalQuiescenceBarrierTest
 * -----------------------------------------------------------------------------
 * The barrier opens once a full quiet period passed without a consistency
 * signal. Driven entirely by the manual clock.
 */
class SignalQuiescenceBarrierTest {

    private static final Signal CONSISTENCY = new Signal(Signal.CONSISTENCY, null, Jsons.object());

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private SignalQuiescenceBarrier barrier;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        barrier = new SignalQuiescenceBarrier(clock, scheduler, Duration.ofMillis(2000));
    }

    @Test
    void opensAfterQuietPeriodWithoutSignals() {
        CompletableFuture<Void> settled = barrier.await();

        scheduler.advanceMillis(1999);
        assertFalse(settled.isDone());

        scheduler.advanceMillis(1);
        assertTrue(settled.isDone());
    }

    @Test
    void signalDuringWaitExtendsIt() {
        CompletableFuture<Void> settled = barrier.await();

        scheduler.advanceMillis(1500);
        barrier.accept(CONSISTENCY);
        scheduler.advanceMillis(500);
        assertFalse(settled.isDone());

        scheduler.advanceMillis(1499);
        assertFalse(settled.isDone());

        scheduler.advanceMillis(1);
        assertTrue(settled.isDone());
    }

    @Test
    void signalsBeforeAwaitDoNotExtendPastAwaitStart() {
        barrier.accept(CONSISTENCY);
        scheduler.advanceMillis(5000);

        CompletableFuture<Void> settled = barrier.await();
        scheduler.advanceMillis(2000);

        assertTrue(settled.isDone());
    }

    @Test
    void concurrentWaitersOpenTogether() {
        CompletableFuture<Void> first = barrier.await();
        scheduler.advanceMillis(1000);
        CompletableFuture<Void> second = barrier.await();

        scheduler.advanceMillis(1000);
        assertTrue(first.isDone());
        assertFalse(second.isDone());

        scheduler.advanceMillis(1000);
        assertTrue(second.isDone());
    }

    @Test
    void rejectsNonPositiveQuietPeriod() {
        assertThrows(IllegalArgumentException.class,
                () -> new SignalQuiescenceBarrier(clock, scheduler, Duration.ZERO));
    }
}
