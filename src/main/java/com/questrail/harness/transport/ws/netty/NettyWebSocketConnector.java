package com.questrail.harness.transport.ws.netty;

import com.questrail.harness.transport.ControlChannel;
import com.questrail.harness.transport.ControlChannelConnector;
import com.questrail.harness.transport.ControlChannelListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Netty-backed {@link ControlChannelConnector} for {@code ws://} endpoints.
 *
 * <p>Every connection gets a dedicated single-threaded {@link NioEventLoopGroup}
 * so that closing one conductor's channel never affects another's. The group
 * is shut down when the channel closes or when the connection attempt fails.</p>
 */
public final class NettyWebSocketConnector implements ControlChannelConnector
{
    private static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;

    private final Duration connectTimeout;

    public NettyWebSocketConnector()
    {
        this(Duration.ofSeconds(10));
    }

    public NettyWebSocketConnector(Duration connectTimeout)
    {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public CompletableFuture<ControlChannel> connect(URI endpoint, ControlChannelListener listener)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(listener, "listener");

        if (!"ws".equalsIgnoreCase(endpoint.getScheme())) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Only ws:// endpoints are supported: " + endpoint));
        }

        EventLoopGroup group = new NioEventLoopGroup(1);
        NettyWebSocketControlChannel controlChannel = new NettyWebSocketControlChannel(endpoint, group, listener);
        CompletableFuture<ControlChannel> handshake = new CompletableFuture<>();

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                endpoint, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), MAX_FRAME_BYTES);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(8192));
                        p.addLast(new WebSocketClientProtocolHandler(handshaker, true, connectTimeout.toMillis()));
                        p.addLast(controlChannel.new FrameHandler(handshake));
                    }
                });

        int port = endpoint.getPort() == -1 ? 80 : endpoint.getPort();
        ChannelFuture f = bootstrap.connect(endpoint.getHost(), port);
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                handshake.completeExceptionally(future.cause());
            }
        });

        // A failed attempt never reaches attach(); release the group here.
        handshake.whenComplete((channel, error) -> {
            if (error != null) {
                group.shutdownGracefully();
            }
        });
        return handshake;
    }
}
