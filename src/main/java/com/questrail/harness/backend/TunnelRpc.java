package com.questrail.harness.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.api.Signal;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * TunnelRpc
 * -----------------------------------------------------------------------------
 * Caller-supplied functions through which a tunneled conductor's traffic flows.
 * The remote control server on the other side owns the actual sockets.
 *
 * <p>Admin and application requests carry the same method/params pairs as a
 * direct channel would; error responses complete exceptionally with
 * {@link com.questrail.harness.error.RemoteCallException}.</p>
 */
public interface TunnelRpc
{
    CompletableFuture<JsonNode> adminCall(String method, JsonNode params);

    CompletableFuture<JsonNode> appCall(int port, String method, JsonNode params);

    /**
     * Ask the remote side to open its connection to the application interface
     * bound at {@code port}.
     */
    CompletableFuture<Void> connectAppPort(int port);

    CompletableFuture<Void> disconnectAppPort(int port);

    /**
     * Start delivering signals from the application interface at {@code port}.
     * Use {@link SignalSubscription#acquire} rather than calling this directly.
     */
    CompletableFuture<Void> subscribeSignals(int port, Consumer<Signal> handler);

    CompletableFuture<Void> unsubscribeSignals(int port);

    /**
     * Make a DNA or bundle referenced by path or URL available to the remote
     * conductor.
     *
     * @return a path the remote conductor can read
     */
    CompletableFuture<String> fetchRemoteResource(String ref);
}
