package com.questrail.harness.transport.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.harness.api.Signal;
import com.questrail.harness.backend.TunnelRpc;
import com.questrail.harness.internal.time.Cancellable;
import com.questrail.harness.internal.time.MonotonicClock;
import com.questrail.harness.internal.time.MonotonicScheduler;
import com.questrail.harness.transport.WireEnvelope;
import com.questrail.harness.util.Futures;
import com.questrail.harness.util.Jsons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * SessionTunnelRpc
 * =============================================================================
 * {@link TunnelRpc} over a {@link RemoteControlSession}: the remote control
 * server forwards admin and app requests to the conductor it runs.
 *
 * <h2>Signals</h2>
 * After {@code subscribe_app_signals}, the signals buffered by the server for
 * a port are fetched with {@code poll_app_signals} every poll interval until
 * the subscription is released. A failed poll is logged and polling
 * continues.
 */
public final class SessionTunnelRpc implements TunnelRpc
{
    private static final Logger log = LoggerFactory.getLogger(SessionTunnelRpc.class);

    private final RemoteControlSession session;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Duration pollInterval;

    private final Map<Integer, Poller> pollers = new ConcurrentHashMap<>();

    public SessionTunnelRpc(RemoteControlSession session,
                            MonotonicClock clock,
                            MonotonicScheduler scheduler,
                            Duration pollInterval)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    @Override
    public CompletableFuture<JsonNode> adminCall(String method, JsonNode params)
    {
        ObjectNode request = Jsons.object();
        request.set("message", WireEnvelope.requestBody(method, params));
        return session.call("admin_interface_call", request)
                .thenApply(body -> WireEnvelope.unwrap(method, body));
    }

    @Override
    public CompletableFuture<JsonNode> appCall(int port, String method, JsonNode params)
    {
        ObjectNode request = portParams(port);
        request.set("message", WireEnvelope.requestBody(method, params));
        return session.call("app_interface_call", request)
                .thenApply(body -> WireEnvelope.unwrap(method, body));
    }

    @Override
    public CompletableFuture<Void> connectAppPort(int port)
    {
        return session.call("connect_app_interface", portParams(port)).thenApply(ignored -> null);
    }

    @Override
    public CompletableFuture<Void> disconnectAppPort(int port)
    {
        return session.call("disconnect_app_interface", portParams(port)).thenApply(ignored -> null);
    }

    @Override
    public CompletableFuture<Void> subscribeSignals(int port, Consumer<Signal> handler)
    {
        Objects.requireNonNull(handler, "handler");
        return session.call("subscribe_app_signals", portParams(port)).thenAccept(ignored -> {
            Poller poller = new Poller(port, handler);
            Poller previous = pollers.put(port, poller);
            if (previous != null) {
                previous.stop();
            }
            poller.schedule();
        });
    }

    @Override
    public CompletableFuture<Void> unsubscribeSignals(int port)
    {
        Poller poller = pollers.remove(port);
        if (poller != null) {
            poller.stop();
        }
        return session.call("unsubscribe_app_signals", portParams(port)).thenApply(ignored -> null);
    }

    @Override
    public CompletableFuture<String> fetchRemoteResource(String ref)
    {
        ObjectNode params = Jsons.object();
        params.put("url", Objects.requireNonNull(ref, "ref"));
        return session.call("download_dna", params).thenApply(result -> {
            JsonNode path = result.isTextual() ? result : result.path("path");
            if (!path.isTextual()) {
                throw new IllegalStateException("download_dna returned no path for " + ref + ": " + result);
            }
            return path.asText();
        });
    }

    int activePollers()
    {
        return pollers.size();
    }

    private static ObjectNode portParams(int port)
    {
        ObjectNode params = Jsons.object();
        params.put("port", port);
        return params;
    }

    private final class Poller
    {
        private final int port;
        private final Consumer<Signal> handler;
        private volatile boolean stopped;
        private volatile Cancellable next;

        Poller(int port, Consumer<Signal> handler)
        {
            this.port = port;
            this.handler = handler;
        }

        void schedule()
        {
            if (!stopped) {
                next = scheduler.scheduleAfter(pollInterval, clock, this::poll);
            }
        }

        void stop()
        {
            stopped = true;
            Cancellable pending = next;
            if (pending != null) {
                pending.cancel();
            }
        }

        private void poll()
        {
            if (stopped) {
                return;
            }
            session.call("poll_app_signals", portParams(port)).whenComplete((batch, error) -> {
                try {
                    if (error != null) {
                        log.warn("Polling signals on port {} via {} failed", port, session.endpoint(), Futures.unwrap(error));
                    } else {
                        deliver(batch);
                    }
                } finally {
                    schedule();
                }
            });
        }

        private void deliver(JsonNode batch)
        {
            for (JsonNode message : batch) {
                if (stopped) {
                    return;
                }
                try {
                    handler.accept(WireEnvelope.parseSignal(message));
                } catch (RuntimeException e) {
                    log.warn("Skipping signal on port {} via {}: {}", port, session.endpoint(), message, e);
                }
            }
        }
    }
}
