package com.questrail.harness.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens direct control channels to a locally reachable conductor.
 */
@FunctionalInterface
public interface ControlChannelConnector
{
    /**
     * Connect to {@code endpoint} (a {@code ws://host:port} URI).
     *
     * @return a future that completes once the channel can carry requests, or
     *         exceptionally if the connection cannot be established
     */
    CompletableFuture<ControlChannel> connect(URI endpoint, ControlChannelListener listener);
}
