package com.questrail.harness.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.api.AppSource;
import com.questrail.harness.api.ConductorState;
import com.questrail.harness.api.DnaDeclaration;
import com.questrail.harness.api.DnaSource;
import com.questrail.harness.api.Signal;
import com.questrail.harness.conductor.Conductor;
import com.questrail.harness.config.DefaultConductorConfigGenerator;
import com.questrail.harness.config.GlobalConfig;
import com.questrail.harness.time.DeterministicScheduler;
import com.questrail.harness.time.ManualMonotonicClock;
import com.questrail.harness.transport.FakeControlChannel;
import com.questrail.harness.transport.ScriptedConductor;
import com.questrail.harness.transport.remote.FakeControlServer;
import com.questrail.harness.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * TunneledConductorSpawnerTest
 * -----------------------------------------------------------------------------
 * Spawning through a remote control server:
 *
 *   get_args → player (config upload) → spawn → tunneled conductor
 *
 * The conductor's traffic and signals go through the same control session.
 */
class TunneledConductorSpawnerTest {

    private FakeControlServer server;
    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private List<Signal> consistency;
    private TunneledConductorSpawner spawner;
    private ConductorFactory factory;

    @BeforeEach
    void setUp() {
        server = new FakeControlServer();
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        consistency = new CopyOnWriteArrayList<>();
        spawner = new TunneledConductorSpawner(URI.create("ws://remote:9000"), server.connector(),
                DefaultConductorConfigGenerator.INSTANCE, clock, scheduler, Duration.ofMillis(250), "run-7");
        factory = (name, backend, terminator) -> Conductor.builder(name, backend)
                .withTerminator(terminator)
                .withClock(clock)
                .withScheduler(scheduler)
                .withConsistencyListener(consistency::add)
                .build();
    }

    @Test
    void spawnUploadsAGeneratedConfigBeforeStarting() {
        spawner.spawn("alice", GlobalConfig.defaults().withLogLevel("debug"), factory).join();

        JsonNode config = Jsons.parse(server.configs().get("alice"));
        assertEquals(4444, config.path("admin_interfaces").get(0).path("driver").path("port").asInt());
        assertEquals("alice", config.path("conductor_name").asText());
        assertEquals("run-7", config.path("network").path("network_id").asText());
        assertEquals("debug", config.path("log_level").asText());
        assertTrue(config.path("environment_path").asText().startsWith(FakeControlServer.CONFIG_DIR));
        assertEquals(List.of("alice"), server.spawned());

        List<String> methods = server.session().requests().stream().map(FakeControlChannel.Request::method)
                .collect(Collectors.toList());
        assertEquals(List.of("get_args", "player", "spawn"), methods);
    }

    @Test
    void spawnedConductorWorksThroughTheSession() {
        Conductor alice = spawner.spawn("alice", GlobalConfig.defaults(), factory).join();

        alice.initialize().join();
        alice.installApplication(Optional.empty(),
                AppSource.dnas(DnaDeclaration.of("x", DnaSource.url("https://dnas.example/x.dna"))),
                Optional.of("app-alice")).join();
        JsonNode result = alice.callFunction("app-alice", "x", "main", "get", Map.of("n", 1)).join();

        assertEquals(ConductorState.CONNECTED, alice.state());
        assertEquals("hash-of-/srv/dnas/x.dna", alice.cellId("app-alice", "x").dnaHash());
        assertEquals("get", result.path("fn").asText());
        assertEquals(1, result.path("payload").path("n").asInt());
        assertEquals(1, server.conductor().app().requests("zome_call").size());
    }

    @Test
    void polledSignalsReachTheConductor() {
        Conductor alice = spawner.spawn("alice", GlobalConfig.defaults(), factory).join();
        alice.initialize().join();

        server.queueSignal(ScriptedConductor.APP_PORT, new Signal(Signal.CONSISTENCY, null, Jsons.object()));
        scheduler.advanceMillis(250);

        assertEquals(1, consistency.size());
    }

    @Test
    void killingTheConductorKillsTheRemoteProcess() {
        Conductor alice = spawner.spawn("alice", GlobalConfig.defaults(), factory).join();
        alice.initialize().join();

        alice.kill().join();

        assertEquals(ConductorState.KILLED, alice.state());
        assertEquals(List.of("alice"), server.killed());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void playersOnOneHostShareTheSession() {
        spawner.spawn("alice", GlobalConfig.defaults(), factory).join();
        spawner.spawn("bob", GlobalConfig.defaults(), factory).join();

        assertEquals(List.of("alice", "bob"), server.spawned());
        assertEquals(2, server.session().requests("get_args").size());

        spawner.close().join();
        spawner.close().join();
        assertEquals(1, server.session().closeCalls());
    }
}
