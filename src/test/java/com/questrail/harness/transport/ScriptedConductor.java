package com.questrail.harness.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.harness.util.Jsons;

import java.net.ConnectException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A well-behaved conductor simulated in memory, reachable through
 * {@link #connector()}.
 *
 * <p>The admin channel answers the install sequence: agent keys are
 * {@code agent-N}, a DNA registered from {@code path} gets hash
 * {@code hash-of-path}, {@code install_app} reports one cell per requested
 * DNA, and enable succeeds. The app channel echoes zome calls. Tests
 * override individual methods through {@link #admin()} and {@link #app()}
 * before initializing the conductor.</p>
 */
public final class ScriptedConductor {

    public static final int ADMIN_PORT = 4444;
    public static final int APP_PORT = 5555;

    private final FakeControlChannel admin = new FakeControlChannel();
    private final FakeControlChannel app = new FakeControlChannel();
    private final List<URI> connections = new CopyOnWriteArrayList<>();
    private final AtomicInteger agentCounter = new AtomicInteger();
    private final List<String> installedApps = new CopyOnWriteArrayList<>();
    private volatile boolean refuseAdmin;
    private volatile boolean refuseApp;

    public ScriptedConductor() {
        admin.on("generate_agent_pub_key", p -> done(TextNode.valueOf("agent-" + agentCounter.incrementAndGet())));
        admin.on("register_dna", p -> done(TextNode.valueOf("hash-of-" + sourceOf(p))));
        admin.on("install_app", p -> {
            installedApps.add(p.path("installed_app_id").asText());
            ArrayNode cells = Jsons.mapper().createArrayNode();
            for (JsonNode dna : p.path("dnas")) {
                cells.add(cell(dna.path("hash").asText(), p.path("agent_key").asText(), dna.path("nick").asText()));
            }
            return done(cellData(cells));
        });
        admin.on("install_app_bundle", p -> {
            installedApps.add(p.path("installed_app_id").asText());
            ArrayNode cells = Jsons.mapper().createArrayNode();
            String agent = p.path("agent_key").asText();
            cells.add(cell("bundle-x", agent, "x"));
            cells.add(cell("bundle-y", agent, "y"));
            return done(cellData(cells));
        });
        admin.on("enable_app", p -> {
            ObjectNode result = Jsons.object();
            result.putArray("errors");
            return done(result);
        });
        admin.on("attach_app_interface", p -> {
            int requested = p.path("port").asInt();
            ObjectNode result = Jsons.object();
            result.put("port", requested == 0 ? APP_PORT : requested);
            return done(result);
        });
        admin.on("list_apps", p -> {
            ArrayNode apps = Jsons.mapper().createArrayNode();
            installedApps.forEach(apps::add);
            return done(apps);
        });
        admin.on("dump_state", p -> done(TextNode.valueOf("state of " + p.path("cell_id"))));

        app.on("zome_call", p -> {
            ObjectNode result = Jsons.object();
            result.put("fn", p.path("fn_name").asText());
            result.set("cell_id", p.path("cell_id"));
            result.set("payload", p.path("payload"));
            return done(result);
        });
    }

    public FakeControlChannel admin() {
        return admin;
    }

    public FakeControlChannel app() {
        return app;
    }

    public void refuseAdminConnections() {
        refuseAdmin = true;
    }

    public void refuseAppConnections() {
        refuseApp = true;
    }

    public List<URI> connections() {
        return List.copyOf(connections);
    }

    /**
     * Connector that hands out the admin channel for {@link #ADMIN_PORT} and
     * the app channel for any other port.
     */
    public ControlChannelConnector connector() {
        return (endpoint, listener) -> {
            connections.add(endpoint);
            boolean isAdmin = endpoint.getPort() == ADMIN_PORT;
            if (isAdmin ? refuseAdmin : refuseApp) {
                return CompletableFuture.failedFuture(new ConnectException("Connection refused: " + endpoint));
            }
            FakeControlChannel channel = isAdmin ? admin : app;
            channel.attach(listener);
            return CompletableFuture.completedFuture(channel);
        };
    }

    public static ObjectNode cell(String hash, String agent, String nick) {
        ObjectNode cell = Jsons.object();
        cell.putArray("cell_id").add(hash).add(agent);
        cell.put("cell_nick", nick);
        return cell;
    }

    private static ObjectNode cellData(ArrayNode cells) {
        ObjectNode result = Jsons.object();
        result.set("cell_data", cells);
        return result;
    }

    private static String sourceOf(JsonNode params) {
        if (params.has("path")) {
            return params.get("path").asText();
        }
        if (params.has("url")) {
            return params.get("url").asText();
        }
        return params.path("hash").asText();
    }

    private static CompletableFuture<JsonNode> done(JsonNode value) {
        return CompletableFuture.completedFuture(value);
    }
}
