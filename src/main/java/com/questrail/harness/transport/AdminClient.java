package com.questrail.harness.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.harness.api.CellId;
import com.questrail.harness.api.DnaSource;
import com.questrail.harness.api.InstalledCell;
import com.questrail.harness.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * AdminClient
 * -----------------------------------------------------------------------------
 * Typed façade over a conductor's admin {@link ControlChannel}.
 *
 * <p>Every method is a single request. Nothing is retried and nothing is
 * timed out here.</p>
 */
public final class AdminClient
{
    private final ControlChannel channel;

    public AdminClient(ControlChannel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public ControlChannel channel()
    {
        return channel;
    }

    public CompletableFuture<JsonNode> call(String method, JsonNode params)
    {
        return channel.request(method, params);
    }

    public CompletableFuture<String> generateAgentPubKey()
    {
        return channel.request("generate_agent_pub_key", Jsons.object()).thenApply(JsonNode::asText);
    }

    /**
     * Register a DNA whose source has already been resolved for this conductor.
     *
     * @return the registered DNA hash
     */
    public CompletableFuture<String> registerDna(DnaSource source, Optional<String> uid, Map<String, Object> properties)
    {
        ObjectNode params = Jsons.object();
        putSource(params, source);
        uid.ifPresent(u -> params.put("uid", u));
        if (!properties.isEmpty()) {
            params.set("properties", Jsons.toTree(properties));
        }
        return channel.request("register_dna", params).thenApply(JsonNode::asText);
    }

    /**
     * One already registered DNA to install under {@code nick}.
     */
    public record InstallDna(String hash, String nick, Optional<String> membraneProof) {}

    public CompletableFuture<List<InstalledCell>> installApp(String appId, String agentKey, List<InstallDna> dnas)
    {
        ObjectNode params = Jsons.object();
        params.put("installed_app_id", appId);
        params.put("agent_key", agentKey);
        ArrayNode list = params.putArray("dnas");
        for (InstallDna dna : dnas) {
            ObjectNode entry = list.addObject();
            entry.put("hash", dna.hash());
            entry.put("nick", dna.nick());
            dna.membraneProof().ifPresent(p -> entry.put("membrane_proof", p));
        }
        return channel.request("install_app", params).thenApply(AdminClient::parseInstalledCells);
    }

    public CompletableFuture<List<InstalledCell>> installAppBundle(DnaSource source,
                                                                  String appId,
                                                                  String agentKey,
                                                                  Map<String, String> membraneProofs,
                                                                  Optional<String> uid)
    {
        ObjectNode params = Jsons.object();
        putSource(params, source);
        params.put("installed_app_id", appId);
        params.put("agent_key", agentKey);
        params.set("membrane_proofs", Jsons.toTree(membraneProofs));
        uid.ifPresent(u -> params.put("uid", u));
        return channel.request("install_app_bundle", params).thenApply(AdminClient::parseInstalledCells);
    }

    /**
     * @return the error entries reported by the conductor; empty on success
     */
    public CompletableFuture<List<String>> enableApp(String appId)
    {
        ObjectNode params = Jsons.object();
        params.put("installed_app_id", appId);
        return channel.request("enable_app", params).thenApply(result -> {
            List<String> errors = new ArrayList<>();
            for (JsonNode error : result.path("errors")) {
                errors.add(error.isTextual() ? error.asText() : error.toString());
            }
            return errors;
        });
    }

    /**
     * @param port requested port; 0 lets the conductor choose any free port
     * @return the port actually bound
     */
    public CompletableFuture<Integer> attachAppInterface(int port)
    {
        ObjectNode params = Jsons.object();
        params.put("port", port);
        return channel.request("attach_app_interface", params).thenApply(result -> {
            JsonNode bound = result.get("port");
            if (bound == null || !bound.canConvertToInt()) {
                throw new IllegalStateException("attach_app_interface returned no port: " + result);
            }
            return bound.asInt();
        });
    }

    public CompletableFuture<List<String>> listApps(Optional<String> statusFilter)
    {
        ObjectNode params = Jsons.object();
        statusFilter.ifPresent(s -> params.put("status_filter", s));
        return channel.request("list_apps", params).thenApply(result -> {
            List<String> apps = new ArrayList<>();
            for (JsonNode app : result) {
                apps.add(app.isTextual() ? app.asText() : app.path("installed_app_id").asText());
            }
            return apps;
        });
    }

    public CompletableFuture<String> dumpState(CellId cellId)
    {
        ObjectNode params = Jsons.object();
        params.set("cell_id", WireEnvelope.cellIdToJson(cellId));
        return channel.request("dump_state", params)
                .thenApply(result -> result.isTextual() ? result.asText() : result.toPrettyString());
    }

    private static void putSource(ObjectNode params, DnaSource source)
    {
        if (source instanceof DnaSource.Path path) {
            params.put("path", path.path());
        } else if (source instanceof DnaSource.Hash hash) {
            params.put("hash", hash.hash());
        } else if (source instanceof DnaSource.Url url) {
            params.put("url", url.url());
        } else {
            throw new AssertionError("Unhandled DNA source " + source);
        }
    }

    static List<InstalledCell> parseInstalledCells(JsonNode result)
    {
        List<InstalledCell> cells = new ArrayList<>();
        for (JsonNode cell : result.path("cell_data")) {
            CellId cellId = WireEnvelope.cellIdFromJson(cell.path("cell_id"));
            cells.add(new InstalledCell(cell.path("cell_nick").asText(), cellId));
        }
        return cells;
    }
}
