package com.questrail.harness.internal.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.internal.time.Cancellable;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PendingCall
 * -----------------------------------------------------------------------------
 * One in-flight function call: its target, start tick, deadline handles and
 * the future handed to the caller.
 *
 * <h2>Single outcome</h2>
 * The response path and the hard-deadline path both race for
 * {@link #claim()}. Exactly one wins; the loser must do nothing except report
 * that it lost. Whoever wins calls {@link #disarm()} so no deadline fires
 * after the call settled.
 */
final class PendingCall {

    private final CallTarget target;
    private final long startNanos;
    private final CompletableFuture<JsonNode> result = new CompletableFuture<>();
    private final AtomicBoolean claimed = new AtomicBoolean(false);

    private volatile Cancellable softDeadline;
    private volatile Cancellable hardDeadline;

    PendingCall(CallTarget target, long startNanos) {
        this.target = Objects.requireNonNull(target, "target");
        this.startNanos = startNanos;
    }

    CallTarget target() {
        return target;
    }

    long startNanos() {
        return startNanos;
    }

    CompletableFuture<JsonNode> result() {
        return result;
    }

    void arm(Cancellable softDeadline, Cancellable hardDeadline) {
        this.softDeadline = softDeadline;
        this.hardDeadline = hardDeadline;
    }

    boolean isPending() {
        return !claimed.get();
    }

    /**
     * @return {@code true} for the first caller only
     */
    boolean claim() {
        return claimed.compareAndSet(false, true);
    }

    void disarm() {
        Cancellable soft = softDeadline;
        if (soft != null) {
            soft.cancel();
        }
        Cancellable hard = hardDeadline;
        if (hard != null) {
            hard.cancel();
        }
    }
}
