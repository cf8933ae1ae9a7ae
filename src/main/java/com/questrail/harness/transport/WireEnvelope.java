package com.questrail.harness.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.harness.api.CellId;
import com.questrail.harness.api.Signal;
import com.questrail.harness.error.RemoteCallException;
import com.questrail.harness.util.Jsons;

import java.util.Objects;

/**
 * WireEnvelope
 * =============================================================================
 * JSON framing shared by every control channel.
 *
 * <pre>
 *   request:  {"type":"request",  "id":"7", "data":{"type":"install_app", "data":{...}}}
 *   response: {"type":"response", "id":"7", "data":{"type":"app_installed", "data":{...}}}
 *   error:    {"type":"response", "id":"7", "data":{"type":"error", "data":{"message":"..."}}}
 *   signal:   {"type":"signal", "data":{"kind":"consistency", "cell_id":[hash, key], "payload":{...}}}
 * </pre>
 *
 * <p>This class knows nothing about sockets. It turns requests into trees and
 * classifies inbound trees.</p>
 */
public final class WireEnvelope {

    private WireEnvelope() {
    }

    /**
     * Classification of one inbound message.
     */
    public sealed interface Inbound permits Response, SignalMessage, Unexpected {
    }

    public record Response(String id, JsonNode data) implements Inbound {
    }

    public record SignalMessage(Signal signal) implements Inbound {
    }

    public record Unexpected(String reason) implements Inbound {
    }

    public static ObjectNode request(String id, String method, JsonNode params) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");

        ObjectNode body = Jsons.object();
        body.put("type", method);
        body.set("data", params == null ? Jsons.object() : params);

        ObjectNode envelope = Jsons.object();
        envelope.put("type", "request");
        envelope.put("id", id);
        envelope.set("data", body);
        return envelope;
    }

    /**
     * Inner request body ({@code {"type": method, "data": params}}) without
     * the outer envelope; tunneled calls carry only this part.
     */
    public static ObjectNode requestBody(String method, JsonNode params) {
        ObjectNode body = Jsons.object();
        body.put("type", method);
        body.set("data", params == null ? Jsons.object() : params);
        return body;
    }

    public static ObjectNode response(String id, String responseType, JsonNode result) {
        ObjectNode body = Jsons.object();
        body.put("type", responseType);
        body.set("data", result == null ? NullNode.getInstance() : result);

        ObjectNode envelope = Jsons.object();
        envelope.put("type", "response");
        envelope.put("id", id);
        envelope.set("data", body);
        return envelope;
    }

    public static ObjectNode errorResponse(String id, String message) {
        ObjectNode error = Jsons.object();
        error.put("message", message);
        return response(id, "error", error);
    }

    public static ObjectNode signal(Signal signal) {
        ObjectNode data = Jsons.object();
        data.put("kind", signal.kind());
        if (signal.cellId() != null) {
            data.set("cell_id", cellIdToJson(signal.cellId()));
        }
        data.set("payload", signal.payload());

        ObjectNode envelope = Jsons.object();
        envelope.put("type", "signal");
        envelope.set("data", data);
        return envelope;
    }

    public static Inbound classify(JsonNode message) {
        if (message == null || !message.isObject()) {
            return new Unexpected("not a JSON object");
        }
        String type = message.path("type").asText("");
        switch (type) {
            case "response": {
                JsonNode id = message.get("id");
                if (id == null || id.isNull()) {
                    return new Unexpected("response without id");
                }
                return new Response(id.asText(), message.path("data"));
            }
            case "signal":
                return new SignalMessage(parseSignal(message.path("data")));
            case "request":
                return new Unexpected("unexpected request from conductor");
            default:
                return new Unexpected("unknown message type '" + type + "'");
        }
    }

    /**
     * Unwrap a response body, turning an error body into an exception.
     *
     * @throws RemoteCallException if the body is an error
     */
    public static JsonNode unwrap(String method, JsonNode body) {
        if (body == null || body.isMissingNode() || body.isNull()) {
            return NullNode.getInstance();
        }
        if ("error".equals(body.path("type").asText())) {
            JsonNode details = body.path("data");
            String message = details.isTextual() ? details.asText() : details.path("message").asText("unknown error");
            throw new RemoteCallException(method, message, details);
        }
        JsonNode data = body.get("data");
        return data == null ? NullNode.getInstance() : data;
    }

    public static Signal parseSignal(JsonNode data) {
        String kind = data.path("kind").asText("unknown");
        JsonNode cellNode = data.get("cell_id");
        CellId cellId = cellNode == null || cellNode.isNull() ? null : cellIdFromJson(cellNode);
        JsonNode payload = data.has("payload") ? data.get("payload") : NullNode.getInstance();
        return new Signal(kind, cellId, payload);
    }

    public static JsonNode cellIdToJson(CellId cellId) {
        return Jsons.mapper().createArrayNode().add(cellId.dnaHash()).add(cellId.agentKey());
    }

    public static CellId cellIdFromJson(JsonNode node) {
        if (!node.isArray() || node.size() != 2) {
            throw new IllegalArgumentException("A cell id is a [dna_hash, agent_key] pair: " + node);
        }
        return new CellId(node.get(0).asText(), node.get(1).asText());
    }
}
