package com.questrail.harness.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.api.Signal;
import com.questrail.harness.error.RemoteCallException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory {@link ControlChannel} that answers requests from a handler table.
 *
 * <p>Requests for a method without a handler fail with
 * {@link RemoteCallException}. Every request is recorded, as is every call to
 * {@link #close()} (including repeated ones).</p>
 */
public final class FakeControlChannel implements ControlChannel {

    public record Request(String method, JsonNode params) {
    }

    private final Map<String, Function<JsonNode, CompletableFuture<JsonNode>>> handlers = new ConcurrentHashMap<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCalls = new AtomicInteger();
    private volatile ControlChannelListener listener = ControlChannelListener.NONE;
    private volatile boolean open = true;
    private volatile RuntimeException closeFailure;

    public FakeControlChannel on(String method, Function<JsonNode, CompletableFuture<JsonNode>> handler) {
        handlers.put(method, handler);
        return this;
    }

    public FakeControlChannel respond(String method, JsonNode result) {
        return on(method, params -> CompletableFuture.completedFuture(result));
    }

    public FakeControlChannel fail(String method, String message) {
        return on(method, params -> CompletableFuture.failedFuture(new RemoteCallException(method, message, null)));
    }

    public void attach(ControlChannelListener listener) {
        this.listener = listener;
    }

    public void failCloseWith(RuntimeException failure) {
        this.closeFailure = failure;
    }

    /**
     * Deliver a push message as if it arrived on the wire.
     */
    public void pushSignal(Signal signal) {
        listener.onSignal(signal);
    }

    @Override
    public CompletableFuture<JsonNode> request(String method, JsonNode params) {
        requests.add(new Request(method, params));
        if (!open) {
            return CompletableFuture.failedFuture(new IllegalStateException("channel closed"));
        }
        Function<JsonNode, CompletableFuture<JsonNode>> handler = handlers.get(method);
        if (handler == null) {
            return CompletableFuture.failedFuture(new RemoteCallException(method, "no handler", null));
        }
        return handler.apply(params);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public CompletableFuture<Void> close() {
        closeCalls.incrementAndGet();
        if (!open) {
            return CompletableFuture.completedFuture(null);
        }
        open = false;
        listener.onClosed(null);
        RuntimeException failure = closeFailure;
        return failure == null ? CompletableFuture.completedFuture(null) : CompletableFuture.failedFuture(failure);
    }

    public List<Request> requests() {
        return List.copyOf(requests);
    }

    public List<Request> requests(String method) {
        return requests.stream().filter(r -> r.method().equals(method)).collect(Collectors.toList());
    }

    public int closeCalls() {
        return closeCalls.get();
    }
}
