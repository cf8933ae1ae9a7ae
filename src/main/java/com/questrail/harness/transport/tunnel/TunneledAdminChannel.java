package com.questrail.harness.transport.tunnel;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.backend.TunnelRpc;
import com.questrail.harness.error.HarnessException;
import com.questrail.harness.transport.ControlChannel;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admin {@link ControlChannel} whose requests travel through
 * {@link TunnelRpc#adminCall}. There is no local socket; closing only stops
 * this channel from accepting further requests.
 */
public final class TunneledAdminChannel implements ControlChannel
{
    private final TunnelRpc rpc;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TunneledAdminChannel(TunnelRpc rpc)
    {
        this.rpc = Objects.requireNonNull(rpc, "rpc");
    }

    @Override
    public CompletableFuture<JsonNode> request(String method, JsonNode params)
    {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new HarnessException("Tunneled admin channel is closed"));
        }
        return rpc.adminCall(method, params);
    }

    @Override
    public boolean isOpen()
    {
        return !closed.get();
    }

    @Override
    public CompletableFuture<Void> close()
    {
        closed.set(true);
        return CompletableFuture.completedFuture(null);
    }
}
