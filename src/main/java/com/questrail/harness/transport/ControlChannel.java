package com.questrail.harness.transport;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * ControlChannel
 * -----------------------------------------------------------------------------
 * Minimal port for one request/response control connection to a conductor
 * (its admin interface or one application interface).
 *
 * <p>Implementations may be backed by a Netty WebSocket, by calls tunneled
 * through a remote control server, or by a test fake. Higher layers
 * ({@link AdminClient}, {@link AppClient}) give the raw requests their types.</p>
 *
 * <p>Responses are correlated by the implementation; callers may have any
 * number of requests in flight and must not assume they complete in
 * submission order.</p>
 */
public interface ControlChannel
{
    /**
     * Send a request and complete with the response body.
     *
     * <p>An error response completes the future exceptionally with a
     * {@link com.questrail.harness.error.RemoteCallException}. A channel that
     * closes while the request is outstanding completes it exceptionally too.</p>
     *
     * @param method request discriminator (e.g. {@code install_app})
     * @param params request body; may be an empty object
     */
    CompletableFuture<JsonNode> request(String method, JsonNode params);

    /**
     * Whether the channel can still carry requests.
     */
    boolean isOpen();

    /**
     * Close the channel and release its resources. Idempotent: closing an
     * already closed channel completes immediately and does nothing.
     */
    CompletableFuture<Void> close();
}
