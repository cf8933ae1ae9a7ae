package com.questrail.harness.conductor;

import com.questrail.harness.api.AppSource;
import com.questrail.harness.api.ConductorState;
import com.questrail.harness.api.DnaDeclaration;
import com.questrail.harness.api.DnaSource;
import com.questrail.harness.api.Signal;
import com.questrail.harness.backend.BackendStrategy;
import com.questrail.harness.backend.FakeTunnelRpc;
import com.questrail.harness.error.ConductorConnectionException;
import com.questrail.harness.time.DeterministicScheduler;
import com.questrail.harness.time.ManualMonotonicClock;
import com.questrail.harness.transport.ScriptedConductor;
import com.questrail.harness.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * ConductorTunneledTest
 * -----------------------------------------------------------------------------
 * A conductor whose traffic is carried by a remote control server.
 */
class ConductorTunneledTest {

    private ScriptedConductor remote;
    private FakeTunnelRpc rpc;
    private List<Signal> consistency;

    @BeforeEach
    void setUp() {
        remote = new ScriptedConductor();
        rpc = new FakeTunnelRpc(remote);
        consistency = new CopyOnWriteArrayList<>();
    }

    private Conductor conductor() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        return Conductor.builder("carol", new BackendStrategy.Tunneled(rpc))
                .withClock(clock)
                .withScheduler(new DeterministicScheduler(clock))
                .withConsistencyListener(consistency::add)
                .build();
    }

    @Test
    void initializeAttachesAnyPortThenConnectsAndSubscribes() {
        Conductor conductor = conductor();

        conductor.initialize().join();

        assertEquals(ConductorState.CONNECTED, conductor.state());
        assertEquals(0, remote.admin().requests("attach_app_interface").get(0).params().path("port").asInt());
        assertEquals(List.of("connect:5555", "subscribe:5555"), rpc.operations());
    }

    @Test
    void refusedAppPortFailsInitialize() {
        rpc.refuseAppPort();
        Conductor conductor = conductor();

        CompletionException thrown = assertThrows(CompletionException.class, () -> conductor.initialize().join());

        assertInstanceOf(ConductorConnectionException.class, thrown.getCause());
        assertEquals(ConductorState.KILLED, conductor.state());
    }

    @Test
    void dnaPathsAreFetchedByTheRemoteSide() {
        Conductor conductor = conductor();
        conductor.initialize().join();

        conductor.installApplication(Optional.empty(),
                AppSource.dnas(DnaDeclaration.of("x", DnaSource.url("https://example.org/dnas/x.dna"))),
                Optional.of("app1")).join();

        assertEquals("fetch:https://example.org/dnas/x.dna", rpc.operations().get(2));
        assertEquals("/remote/x.dna", remote.admin().requests("register_dna").get(0).params().path("path").asText());
        assertEquals("hash-of-/remote/x.dna", conductor.cellId("app1", "x").dnaHash());
    }

    @Test
    void callsTravelThroughTheTunnel() {
        Conductor conductor = conductor();
        conductor.initialize().join();
        conductor.installApplication(Optional.empty(),
                AppSource.dnas(DnaDeclaration.of("x", DnaSource.hash("uhC0k"))), Optional.of("app1")).join();

        String fn = conductor.callFunction("app1", "x", "main", "ping", Map.of()).join().path("fn").asText();

        assertEquals("ping", fn);
        assertEquals(1, remote.app().requests("zome_call").size());
    }

    @Test
    void tunneledSignalsAreRouted() {
        Conductor conductor = conductor();
        conductor.initialize().join();

        rpc.push(ScriptedConductor.APP_PORT, new Signal(Signal.CONSISTENCY, null, Jsons.object()));

        assertEquals(1, consistency.size());
    }

    @Test
    void killUnsubscribesThenDisconnects() {
        Conductor conductor = conductor();
        conductor.initialize().join();

        conductor.kill().join();
        conductor.kill().join();

        assertEquals(List.of("connect:5555", "subscribe:5555", "unsubscribe:5555", "disconnect:5555"),
                rpc.operations());
    }
}
