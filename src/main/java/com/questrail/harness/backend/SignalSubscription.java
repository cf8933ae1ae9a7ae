package com.questrail.harness.backend;

import com.questrail.harness.api.Signal;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Capability token for one signal registration against a tunnel. Acquired on
 * subscribe; releasing it unsubscribes exactly once.
 */
public final class SignalSubscription
{
    private final TunnelRpc rpc;
    private final int port;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private SignalSubscription(TunnelRpc rpc, int port)
    {
        this.rpc = rpc;
        this.port = port;
    }

    public static CompletableFuture<SignalSubscription> acquire(TunnelRpc rpc, int port, Consumer<Signal> handler)
    {
        Objects.requireNonNull(rpc, "rpc");
        Objects.requireNonNull(handler, "handler");
        return rpc.subscribeSignals(port, handler).thenApply(v -> new SignalSubscription(rpc, port));
    }

    public int port()
    {
        return port;
    }

    public boolean isReleased()
    {
        return released.get();
    }

    /**
     * Unsubscribe. Subsequent calls complete immediately.
     */
    public CompletableFuture<Void> release()
    {
        if (!released.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        return rpc.unsubscribeSignals(port);
    }
}
