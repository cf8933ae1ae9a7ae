package com.questrail.harness.transport.ws.netty;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.error.HarnessException;
import com.questrail.harness.transport.ControlChannel;
import com.questrail.harness.transport.ControlChannelListener;
import com.questrail.harness.transport.WireEnvelope;
import com.questrail.harness.util.Jsons;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyWebSocketControlChannel
 * =============================================================================
 * Netty-backed implementation of the {@link ControlChannel} port over one
 * WebSocket connection.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It frames requests
 * with {@link WireEnvelope}, correlates responses by id and forwards signals to
 * its listener. It does not interpret admin or application semantics and
 * does not apply timeouts; the call dispatcher does that.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound frames are decoded to
 * Jackson trees before they reach the listener.
 *
 * <h2>Lifecycle</h2>
 * Instances are created by {@link NettyWebSocketConnector} once the WebSocket
 * handshake has completed. {@link #close()} sends a close frame, closes the
 * socket and shuts down the event loop group owned by this channel.
 */
final class NettyWebSocketControlChannel implements ControlChannel
{
    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketControlChannel.class);

    private final URI endpoint;
    private final EventLoopGroup group;
    private final ControlChannelListener listener;

    private final AtomicLong nextId = new AtomicLong();
    private final Map<String, Outstanding> outstanding = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    private volatile Channel channel;

    private record Outstanding(String method, CompletableFuture<JsonNode> result) {}

    NettyWebSocketControlChannel(URI endpoint, EventLoopGroup group, ControlChannelListener listener)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.group = Objects.requireNonNull(group, "group");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    void attach(Channel channel)
    {
        this.channel = channel;
        channel.closeFuture().addListener(f -> onInactive(null));
    }

    @Override
    public CompletableFuture<JsonNode> request(String method, JsonNode params)
    {
        Objects.requireNonNull(method, "method");

        Channel ch = channel;
        if (ch == null || closed.get() || !ch.isActive()) {
            return CompletableFuture.failedFuture(
                    new HarnessException("Control channel to " + endpoint + " is closed"));
        }

        String id = Long.toString(nextId.incrementAndGet());
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        outstanding.put(id, new Outstanding(method, result));

        String text = Jsons.toJson(WireEnvelope.request(id, method, params));
        ch.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                Outstanding o = outstanding.remove(id);
                if (o != null) {
                    o.result().completeExceptionally(new HarnessException(
                            "Failed to send " + method + " to " + endpoint, future.cause()));
                }
            }
        });
        return result;
    }

    @Override
    public boolean isOpen()
    {
        Channel ch = channel;
        return !closed.get() && ch != null && ch.isActive();
    }

    @Override
    public CompletableFuture<Void> close()
    {
        if (!closed.compareAndSet(false, true)) {
            return closeFuture;
        }

        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame())
                    .addListener((ChannelFutureListener) f -> f.channel().close());
            ch.closeFuture().addListener(f -> shutdown());
        } else {
            shutdown();
        }
        return closeFuture;
    }

    private void shutdown()
    {
        failOutstanding(new HarnessException("Control channel to " + endpoint + " closed"));
        group.shutdownGracefully().addListener(f -> closeFuture.complete(null));
    }

    private void onInactive(Throwable cause)
    {
        failOutstanding(new HarnessException("Control channel to " + endpoint + " went down", cause));
        boolean firstClose = closed.compareAndSet(false, true);
        listener.onClosed(cause);
        if (firstClose) {
            shutdown();
        }
    }

    private void failOutstanding(Throwable cause)
    {
        List<Outstanding> pending = new ArrayList<>(outstanding.values());
        outstanding.clear();
        for (Outstanding o : pending) {
            o.result().completeExceptionally(cause);
        }
    }

    private void onMessage(String text)
    {
        JsonNode message;
        try {
            message = Jsons.parse(text);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping malformed message from {}: {}", endpoint, e.getMessage());
            return;
        }

        WireEnvelope.Inbound inbound;
        try {
            inbound = WireEnvelope.classify(message);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping unreadable message from {}: {}", endpoint, e.getMessage());
            return;
        }
        if (inbound instanceof WireEnvelope.Response response) {
            Outstanding o = outstanding.remove(response.id());
            if (o == null) {
                log.warn("Received response for unknown request id {} from {}; dropping", response.id(), endpoint);
                return;
            }
            try {
                o.result().complete(WireEnvelope.unwrap(o.method(), response.data()));
            } catch (RuntimeException e) {
                o.result().completeExceptionally(e);
            }
        } else if (inbound instanceof WireEnvelope.SignalMessage signal) {
            try {
                listener.onSignal(signal.signal());
            } catch (RuntimeException e) {
                log.warn("Signal listener of {} failed on '{}'", endpoint, signal.signal().kind(), e);
            }
        } else if (inbound instanceof WireEnvelope.Unexpected unexpected) {
            log.warn("Dropping message from {}: {}", endpoint, unexpected.reason());
        }
    }

    /**
     * FrameHandler
     * -------------------------------------------------------------------------
     * Receives WebSocket data frames after the handshake and forwards their
     * text to the channel. Control frames are handled by
     * {@link WebSocketClientProtocolHandler}.
     */
    final class FrameHandler extends SimpleChannelInboundHandler<WebSocketFrame>
    {
        private final CompletableFuture<ControlChannel> handshake;

        FrameHandler(CompletableFuture<ControlChannel> handshake)
        {
            this.handshake = handshake;
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                attach(ctx.channel());
                handshake.complete(NettyWebSocketControlChannel.this);
            } else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                handshake.completeExceptionally(
                        new HarnessException("WebSocket handshake with " + endpoint + " timed out"));
                ctx.close();
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
        {
            if (frame instanceof TextWebSocketFrame text) {
                onMessage(text.text());
            } else if (frame instanceof BinaryWebSocketFrame binary) {
                ByteBuf content = binary.content();
                onMessage(content.toString(StandardCharsets.UTF_8));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            if (!handshake.isDone()) {
                handshake.completeExceptionally(
                        new HarnessException("Connection to " + endpoint + " closed during handshake"));
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (!handshake.isDone()) {
                handshake.completeExceptionally(cause);
            } else {
                log.warn("Control channel to {} failed", endpoint, cause);
            }
            ctx.close();
        }
    }
}
