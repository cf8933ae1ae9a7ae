package com.questrail.harness.transport.tunnel;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.backend.TunnelRpc;
import com.questrail.harness.error.HarnessException;
import com.questrail.harness.transport.ControlChannel;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Application {@link ControlChannel} bound to one remote app interface port.
 *
 * <p>Created only after {@link TunnelRpc#connectAppPort(int)} succeeded;
 * closing it disconnects that port on the remote side, once.</p>
 */
public final class TunneledAppChannel implements ControlChannel
{
    private final TunnelRpc rpc;
    private final int port;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TunneledAppChannel(TunnelRpc rpc, int port)
    {
        this.rpc = Objects.requireNonNull(rpc, "rpc");
        this.port = port;
    }

    public int port()
    {
        return port;
    }

    @Override
    public CompletableFuture<JsonNode> request(String method, JsonNode params)
    {
        if (closed.get()) {
            return CompletableFuture.failedFuture(
                    new HarnessException("Tunneled app channel on port " + port + " is closed"));
        }
        return rpc.appCall(port, method, params);
    }

    @Override
    public boolean isOpen()
    {
        return !closed.get();
    }

    @Override
    public CompletableFuture<Void> close()
    {
        if (!closed.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        return rpc.disconnectAppPort(port);
    }
}
