package com.questrail.harness.transport.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.harness.api.Signal;
import com.questrail.harness.error.HarnessException;
import com.questrail.harness.transport.ControlChannel;
import com.questrail.harness.transport.ControlChannelConnector;
import com.questrail.harness.transport.ControlChannelListener;
import com.questrail.harness.util.Jsons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * RemoteControlSession
 * =============================================================================
 * One control connection to a remote control server, shared by every player
 * placed on that host.
 *
 * <p>Players are addressed by id: {@link #player} uploads a conductor config,
 * {@link #spawn} starts the conductor, {@link #kill} stops it. Conductor
 * traffic for tunneled conductors also flows through this session (see
 * {@link SessionTunnelRpc}).</p>
 */
public final class RemoteControlSession
{
    private static final Logger log = LoggerFactory.getLogger(RemoteControlSession.class);

    private final URI endpoint;
    private final ControlChannel channel;

    RemoteControlSession(URI endpoint, ControlChannel channel)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public static CompletableFuture<RemoteControlSession> connect(URI endpoint, ControlChannelConnector connector)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(connector, "connector");

        ControlChannelListener listener = new ControlChannelListener() {
            @Override
            public void onSignal(Signal signal)
            {
                log.debug("Ignoring pushed signal '{}' on control session {}", signal.kind(), endpoint);
            }

            @Override
            public void onClosed(Throwable cause)
            {
                if (cause != null) {
                    log.warn("Control session {} closed", endpoint, cause);
                } else {
                    log.info("Control session {} closed", endpoint);
                }
            }
        };
        return connector.connect(endpoint, listener).thenApply(channel -> {
            log.info("Control session {} open", endpoint);
            return new RemoteControlSession(endpoint, channel);
        });
    }

    public URI endpoint()
    {
        return endpoint;
    }

    public boolean isOpen()
    {
        return channel.isOpen();
    }

    /**
     * Raw session request.
     */
    public CompletableFuture<JsonNode> call(String method, JsonNode params)
    {
        return channel.request(method, params);
    }

    public CompletableFuture<SessionPlacement> placement()
    {
        return channel.request("get_args", Jsons.object()).thenApply(args -> {
            JsonNode admin = args.get("admin_port");
            if (admin == null || !admin.canConvertToInt()) {
                throw new HarnessException("Control server " + endpoint + " returned no admin port: " + args);
            }
            return new SessionPlacement(admin.asInt(), args.path("app_port").asInt(0),
                    args.path("config_dir").asText("."));
        });
    }

    /**
     * Upload the conductor config for player {@code id}; sent base64 encoded.
     */
    public CompletableFuture<Void> player(String id, String config)
    {
        ObjectNode params = idParams(id);
        params.put("config", Base64.getEncoder().encodeToString(config.getBytes(StandardCharsets.UTF_8)));
        return channel.request("player", params).thenApply(ignored -> null);
    }

    public CompletableFuture<Void> spawn(String id)
    {
        return channel.request("spawn", idParams(id)).thenApply(ignored -> null);
    }

    public CompletableFuture<Void> kill(String id, Optional<String> signal)
    {
        ObjectNode params = idParams(id);
        signal.ifPresent(s -> params.put("signal", s));
        return channel.request("kill", params).thenApply(ignored -> null);
    }

    public CompletableFuture<String> ping(String id)
    {
        return channel.request("ping", idParams(id)).thenApply(JsonNode::asText);
    }

    public CompletableFuture<Void> close()
    {
        return channel.close();
    }

    private static ObjectNode idParams(String id)
    {
        ObjectNode params = Jsons.object();
        params.put("id", Objects.requireNonNull(id, "id"));
        return params;
    }
}
