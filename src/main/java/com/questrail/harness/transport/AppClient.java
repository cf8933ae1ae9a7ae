package com.questrail.harness.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.harness.api.CellId;
import com.questrail.harness.util.Jsons;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Typed façade over a conductor's application {@link ControlChannel}.
 */
public final class AppClient
{
    private final ControlChannel channel;

    public AppClient(ControlChannel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public ControlChannel channel()
    {
        return channel;
    }

    public CompletableFuture<JsonNode> callZome(CellId cellId,
                                                String zomeName,
                                                String fnName,
                                                String capSecret,
                                                JsonNode payload,
                                                String provenance)
    {
        ObjectNode params = Jsons.object();
        params.set("cell_id", WireEnvelope.cellIdToJson(cellId));
        params.put("zome_name", zomeName);
        params.put("fn_name", fnName);
        params.put("cap", capSecret);
        params.set("payload", payload);
        params.put("provenance", provenance);
        return channel.request("zome_call", params);
    }
}
