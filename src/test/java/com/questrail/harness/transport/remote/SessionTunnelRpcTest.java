package com.questrail.harness.transport.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.harness.api.CellId;
import com.questrail.harness.api.Signal;
import com.questrail.harness.error.RemoteCallException;
import com.questrail.harness.time.DeterministicScheduler;
import com.questrail.harness.time.ManualMonotonicClock;
import com.questrail.harness.transport.FakeControlChannel;
import com.questrail.harness.transport.ScriptedConductor;
import com.questrail.harness.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * SessionTunnelRpcTest
 * -----------------------------------------------------------------------------
 * Conductor traffic carried by a remote control session:
 *
 *   admin / app requests  → wrapped in *_interface_call, answer unwrapped
 *   signal subscription   → poll_app_signals every poll interval
 */
class SessionTunnelRpcTest {

    private static final int PORT = ScriptedConductor.APP_PORT;

    private FakeControlServer server;
    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private SessionTunnelRpc rpc;
    private List<Signal> received;

    @BeforeEach
    void setUp() {
        server = new FakeControlServer();
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        RemoteControlSession session = new RemoteControlSession(URI.create("ws://remote:9000"), server.session());
        rpc = new SessionTunnelRpc(session, clock, scheduler, Duration.ofMillis(100));
        received = new CopyOnWriteArrayList<>();
    }

    @Test
    void adminCallIsWrappedAndItsResultUnwrapped() {
        JsonNode key = rpc.adminCall("generate_agent_pub_key", Jsons.object()).join();

        assertEquals("agent-1", key.asText());
        JsonNode message = server.session().requests("admin_interface_call").get(0).params().path("message");
        assertEquals("generate_agent_pub_key", message.path("type").asText());
        assertTrue(message.path("data").isObject());
    }

    @Test
    void errorBodyFailsTheCallWithTheRemoteMessage() {
        server.conductor().admin().fail("enable_app", "app is broken");

        CompletionException thrown = assertThrows(CompletionException.class,
                () -> rpc.adminCall("enable_app", Jsons.object()).join());

        RemoteCallException error = assertInstanceOf(RemoteCallException.class, thrown.getCause());
        assertEquals("enable_app", error.method());
        assertTrue(error.getMessage().contains("app is broken"));
    }

    @Test
    void appCallNamesThePort() {
        JsonNode params = Jsons.object().put("fn_name", "get");

        JsonNode result = rpc.appCall(PORT, "zome_call", params).join();

        assertEquals("get", result.path("fn").asText());
        FakeControlChannel.Request request = server.session().requests("app_interface_call").get(0);
        assertEquals(PORT, request.params().path("port").asInt());
        assertEquals("zome_call", request.params().path("message").path("type").asText());
    }

    @Test
    void subscribedSignalsArriveOnEachPoll() {
        rpc.subscribeSignals(PORT, received::add).join();
        server.queueSignal(PORT, new Signal(Signal.CONSISTENCY, new CellId("h", "a"), Jsons.object()));
        server.queueSignal(PORT, new Signal("user", null, TextNode.valueOf("hi")));

        scheduler.advanceMillis(99);
        assertEquals(0, received.size());

        scheduler.advanceMillis(1);
        assertEquals(2, received.size());
        assertTrue(received.get(0).isConsistency());
        assertEquals(new CellId("h", "a"), received.get(0).cellId());
        assertEquals("hi", received.get(1).payload().asText());

        server.queueSignal(PORT, new Signal("user", null, TextNode.valueOf("again")));
        scheduler.advanceMillis(100);
        assertEquals(3, received.size());
        assertEquals(1, rpc.activePollers());
    }

    @Test
    void failedPollIsSkippedAndPollingContinues() {
        server.session().fail("poll_app_signals", "server busy");
        rpc.subscribeSignals(PORT, received::add).join();

        scheduler.advanceMillis(100);
        scheduler.advanceMillis(100);
        assertEquals(2, server.session().requests("poll_app_signals").size());

        server.session().on("poll_app_signals", p -> CompletableFuture.completedFuture(
                Jsons.mapper().createArrayNode().add(Jsons.object().put("kind", "user").put("payload", 1))));
        scheduler.advanceMillis(100);

        assertEquals(1, received.size());
        assertEquals("user", received.get(0).kind());
    }

    @Test
    void failingSignalIsSkippedAndPollingContinues() {
        rpc.subscribeSignals(PORT, signal -> {
            if (signal.kind().equals("explode")) {
                throw new IllegalStateException("handler broke");
            }
            received.add(signal);
        }).join();
        server.queueSignal(PORT, new Signal("explode", null, Jsons.object()));
        server.queueSignal(PORT, new Signal("user", null, TextNode.valueOf("same batch")));
        scheduler.advanceMillis(100);

        server.session().on("poll_app_signals", p -> CompletableFuture.completedFuture(Jsons.mapper().createArrayNode()
                .add(Jsons.object().put("kind", "user").put("cell_id", "not-a-pair"))
                .add(Jsons.object().put("kind", Signal.CONSISTENCY))));
        scheduler.advanceMillis(100);

        assertEquals(2, received.size());
        assertEquals("same batch", received.get(0).payload().asText());
        assertTrue(received.get(1).isConsistency());
        assertEquals(1, scheduler.pendingTasks());
        assertEquals(1, rpc.activePollers());
    }

    @Test
    void unsubscribeStopsPolling() {
        rpc.subscribeSignals(PORT, received::add).join();
        scheduler.advanceMillis(100);

        rpc.unsubscribeSignals(PORT).join();
        server.queueSignal(PORT, new Signal("user", null, Jsons.object()));
        scheduler.advanceMillis(1000);

        assertEquals(0, received.size());
        assertEquals(0, rpc.activePollers());
        assertEquals(0, scheduler.pendingTasks());
        assertEquals(1, server.session().requests("poll_app_signals").size());
        assertEquals(1, server.session().requests("unsubscribe_app_signals").size());
    }

    @Test
    void resubscribingReplacesThePoller() {
        List<Signal> first = new CopyOnWriteArrayList<>();
        rpc.subscribeSignals(PORT, first::add).join();
        rpc.subscribeSignals(PORT, received::add).join();
        server.queueSignal(PORT, new Signal("user", null, Jsons.object()));

        scheduler.advanceMillis(100);

        assertEquals(0, first.size());
        assertEquals(1, received.size());
        assertEquals(1, scheduler.pendingTasks());
    }

    @Test
    void downloadReturnsTheRemotePath() {
        assertEquals("/srv/dnas/x.dna", rpc.fetchRemoteResource("https://dnas.example/x.dna").join());

        server.session().respond("download_dna", TextNode.valueOf("/tmp/y.dna"));
        assertEquals("/tmp/y.dna", rpc.fetchRemoteResource("y.dna").join());
    }

    @Test
    void downloadWithoutAPathFails() {
        server.session().respond("download_dna", Jsons.object().put("status", "ok"));

        CompletionException thrown = assertThrows(CompletionException.class,
                () -> rpc.fetchRemoteResource("z.dna").join());

        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }

    @Test
    void connectAndDisconnectNameThePort() {
        rpc.connectAppPort(PORT).join();
        rpc.disconnectAppPort(PORT).join();

        assertEquals(PORT, server.session().requests("connect_app_interface").get(0).params().path("port").asInt());
        assertEquals(PORT, server.session().requests("disconnect_app_interface").get(0).params().path("port").asInt());
    }

    @Test
    void rejectsANonPositivePollInterval() {
        RemoteControlSession session = new RemoteControlSession(URI.create("ws://remote:9000"), server.session());

        assertThrows(IllegalArgumentException.class,
                () -> new SessionTunnelRpc(session, clock, scheduler, Duration.ZERO));
    }
}
