package com.questrail.harness.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.harness.api.CellId;
import com.questrail.harness.api.Signal;
import com.questrail.harness.error.RemoteCallException;
import com.questrail.harness.util.Jsons;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WireEnvelopeTest {

    @Test
    void requestNestsTheMethodUnderTheEnvelope() {
        JsonNode request = WireEnvelope.request("7", "install_app", Jsons.object().put("installed_app_id", "a"));

        assertEquals("request", request.path("type").asText());
        assertEquals("7", request.path("id").asText());
        assertEquals("install_app", request.path("data").path("type").asText());
        assertEquals("a", request.path("data").path("data").path("installed_app_id").asText());
        assertTrue(WireEnvelope.request("8", "list_apps", null).path("data").path("data").isObject());
    }

    @Test
    void responsesAreClassifiedById() {
        JsonNode response = WireEnvelope.response("7", "app_installed", TextNode.valueOf("ok"));

        WireEnvelope.Response classified =
                assertInstanceOf(WireEnvelope.Response.class, WireEnvelope.classify(response));

        assertEquals("7", classified.id());
        assertEquals("ok", WireEnvelope.unwrap("install_app", classified.data()).asText());
    }

    @Test
    void errorBodyUnwrapsToRemoteCallException() {
        JsonNode body = WireEnvelope.errorResponse("7", "no such app").path("data");

        RemoteCallException error = assertThrows(RemoteCallException.class,
                () -> WireEnvelope.unwrap("enable_app", body));

        assertEquals("enable_app", error.method());
        assertEquals("no such app", error.details().path("message").asText());
    }

    @Test
    void signalsKeepKindCellAndPayload() {
        Signal sent = new Signal(Signal.CONSISTENCY, new CellId("uhC0k", "uhCAk"), Jsons.object().put("n", 3));

        WireEnvelope.SignalMessage received = assertInstanceOf(WireEnvelope.SignalMessage.class,
                WireEnvelope.classify(WireEnvelope.signal(sent)));

        assertEquals(sent, received.signal());
    }

    @Test
    void signalWithoutCellHasNullCell() {
        Signal parsed = WireEnvelope.parseSignal(Jsons.object().put("kind", "user"));

        assertNull(parsed.cellId());
        assertTrue(parsed.payload().isNull());
    }

    @Test
    void unexpectedMessagesAreReportedNotThrown() {
        assertInstanceOf(WireEnvelope.Unexpected.class, WireEnvelope.classify(TextNode.valueOf("hi")));
        assertInstanceOf(WireEnvelope.Unexpected.class,
                WireEnvelope.classify(Jsons.object().put("type", "response")));
        assertInstanceOf(WireEnvelope.Unexpected.class,
                WireEnvelope.classify(WireEnvelope.request("1", "x", null)));
        assertInstanceOf(WireEnvelope.Unexpected.class,
                WireEnvelope.classify(Jsons.object().put("type", "gossip")));
    }

    @Test
    void malformedCellIdIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> WireEnvelope.cellIdFromJson(Jsons.mapper().createArrayNode().add("only-hash")));
    }
}
