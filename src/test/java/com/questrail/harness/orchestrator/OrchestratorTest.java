package com.questrail.harness.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.api.DnaDeclaration;
import com.questrail.harness.api.DnaSource;
import com.questrail.harness.config.MachineConfigs;
import com.questrail.harness.config.PlayerConfig;
import com.questrail.harness.config.PlayerConfigs;
import com.questrail.harness.middleware.Middleware;
import com.questrail.harness.middleware.Middlewares;
import com.questrail.harness.middleware.SerialExecutor;
import com.questrail.harness.middleware.SingleConductor;
import com.questrail.harness.middleware.TestFrameworkRegistrar;
import com.questrail.harness.scenario.CollectingTestHarness;
import com.questrail.harness.scenario.Player;
import com.questrail.harness.scenario.Scenario;
import com.questrail.harness.scenario.Scenario2;
import com.questrail.harness.scenario.ScenarioApi;
import com.questrail.harness.scenario.TestCase;
import com.questrail.harness.time.DeterministicScheduler;
import com.questrail.harness.time.ManualMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * OrchestratorTest
 * -----------------------------------------------------------------------------
 * End-to-end runs against scripted conductors:
 *
 *   register → middleware chain → spawn players → scenario → kill players → stats
 *
 * Scenario code runs on a single-thread executor; everything it talks to
 * answers synchronously.
 */
class OrchestratorTest {

    private static final PlayerConfig CONFIG = PlayerConfig.of(DnaDeclaration.of("x", DnaSource.path("x.dna")));

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private ExecutorService executor;
    private ScriptedSpawner spawner;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        executor = Executors.newSingleThreadExecutor();
        spawner = new ScriptedSpawner();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private <A> Orchestrator<A> orchestrator(Middleware<A, Scenario<ScenarioApi<MachineConfigs, Player>>> middleware) {
        return Orchestrator.builder(middleware)
                .withClock(clock)
                .withScheduler(scheduler)
                .withScenarioExecutor(executor)
                .withSpawnerResolver(machine -> spawner)
                .build();
    }

    private static <T> T await(CompletableFuture<T> future)
            throws InterruptedException, ExecutionException, TimeoutException {
        return future.get(10, TimeUnit.SECONDS);
    }

    private static CompletableFuture<Void> callAliceX(ScenarioApi<MachineConfigs, Player> s) {
        return s.players(MachineConfigs.local(PlayerConfigs.of("alice", CONFIG)), true)
                .thenCompose(players -> players.get("alice").call("x", "main", "get", Map.of()))
                .thenAccept(result -> {
                    if (!"get".equals(result.path("fn").asText())) {
                        throw new AssertionError("unexpected result " + result);
                    }
                });
    }

    @Test
    void runsEveryScenarioAndCollectsOutcomes() throws Exception {
        Orchestrator<Scenario<ScenarioApi<MachineConfigs, Player>>> orchestrator = orchestrator(Middlewares.unit());
        orchestrator.registerScenario("calls a zome", OrchestratorTest::callAliceX);
        orchestrator.registerScenario("fails", s -> CompletableFuture.failedFuture(new AssertionError("boom")));
        orchestrator.registerScenario("throws", s -> {
            throw new IllegalStateException("thrown");
        });

        OrchestratorStats stats = await(orchestrator.run());

        assertEquals(3, stats.total());
        assertEquals(1, stats.successes());
        assertEquals(List.of("fails", "throws"), List.copyOf(stats.errors().keySet()));
        assertInstanceOf(AssertionError.class, stats.errors().get("fails"));
        assertInstanceOf(IllegalStateException.class, stats.errors().get("throws"));
        assertFalse(stats.allPassed());
    }

    @Test
    void playersAreKilledAfterEachScenarioAndSpawnersClosedOnce() throws Exception {
        Orchestrator<Scenario<ScenarioApi<MachineConfigs, Player>>> orchestrator = orchestrator(Middlewares.unit());
        orchestrator.registerScenario("first", OrchestratorTest::callAliceX);
        orchestrator.registerScenario("second", OrchestratorTest::callAliceX);

        OrchestratorStats stats = await(orchestrator.run());

        assertTrue(stats.allPassed());
        assertEquals(List.of("alice", "alice"), spawner.spawnedPlayers());
        assertEquals(List.of("alice", "alice"), spawner.terminated());
        assertEquals(1, spawner.closes());
    }

    @Test
    void killFailureFailsAnOtherwisePassingScenario() throws Exception {
        spawner.failTerminationWith(new IllegalStateException("process would not die"));
        Orchestrator<Scenario<ScenarioApi<MachineConfigs, Player>>> orchestrator = orchestrator(Middlewares.unit());
        orchestrator.registerScenario("leaky", OrchestratorTest::callAliceX);

        OrchestratorStats stats = await(orchestrator.run());

        assertEquals("process would not die", stats.errors().get("leaky").getMessage());
    }

    @Test
    void runsOnlyOnce() throws Exception {
        Orchestrator<Scenario<ScenarioApi<MachineConfigs, Player>>> orchestrator = orchestrator(Middlewares.unit());
        orchestrator.registerScenario("only", s -> CompletableFuture.completedFuture(null));

        await(orchestrator.run());

        assertTrue(orchestrator.run().isCompletedExceptionally());
        assertThrows(IllegalStateException.class,
                () -> orchestrator.registerScenario("late", s -> CompletableFuture.completedFuture(null)));
        assertEquals(1, orchestrator.scenarioCount());
    }

    @Test
    void registrarRecordsEachScenarioAsATestCase() throws Exception {
        CollectingTestHarness harness = new CollectingTestHarness();
        Middleware<Object, Scenario<ScenarioApi<MachineConfigs, Player>>> chain = Middlewares.compose(
                new TestFrameworkRegistrar<ScenarioApi<MachineConfigs, Player>>(harness),
                new SerialExecutor<Scenario<ScenarioApi<MachineConfigs, Player>>>());
        Orchestrator<Object> orchestrator = orchestrator(chain);

        Scenario2<ScenarioApi<MachineConfigs, Player>, TestCase> passing = (s, t) -> callAliceX(s);
        Scenario2<ScenarioApi<MachineConfigs, Player>, TestCase> failing = (s, t) -> {
            t.equal(1, 2, "counts");
            return CompletableFuture.failedFuture(new AssertionError("counts differ"));
        };
        orchestrator.registerScenario("passing", passing);
        orchestrator.registerScenario("failing", failing);

        OrchestratorStats stats = await(orchestrator.run());

        assertEquals(1, stats.successes());
        assertTrue(harness.find("passing").orElseThrow().passed());
        CollectingTestHarness.Case failed = harness.find("failing").orElseThrow();
        assertTrue(failed.ended());
        assertEquals(2, failed.failures().size());
    }

    @Test
    void singleConductorRunsEveryPlayerOnOneConductor() throws Exception {
        Orchestrator<Scenario<ScenarioApi<MachineConfigs, Player>>> orchestrator = orchestrator(new SingleConductor());
        MachineConfigs machines = new MachineConfigs(Map.of(
                "ws://m1:9000", PlayerConfigs.of("alice", CONFIG),
                "ws://m2:9000", PlayerConfigs.of("bob", CONFIG)));
        orchestrator.registerScenario("shared", s -> s.players(machines, true).thenCompose(players ->
                players.get("bob").call("x", "main", "get", Map.of())).thenAccept(result -> { }));

        OrchestratorStats stats = await(orchestrator.run());

        assertTrue(stats.allPassed());
        assertEquals(List.of("combined"), spawner.spawnedPlayers());
        JsonNode call = spawner.remotes().get(0).app().requests("zome_call").get(0).params();
        assertEquals("hash-of-/remote/x.dna", call.path("cell_id").get(0).asText());
        assertEquals(List.of("alice::x", "bob::x"), spawner.remotes().get(0).admin().requests("install_app")
                .get(0).params().findValuesAsText("nick"));
    }
}
