package com.questrail.harness.orchestrator;

import com.questrail.harness.api.Signal;
import com.questrail.harness.conductor.Conductor;
import com.questrail.harness.config.ConductorConfigGenerator;
import com.questrail.harness.config.ConductorEnvironment;
import com.questrail.harness.config.DefaultConductorConfigGenerator;
import com.questrail.harness.config.GlobalConfig;
import com.questrail.harness.config.MachineConfigs;
import com.questrail.harness.internal.time.MonotonicClock;
import com.questrail.harness.internal.time.MonotonicScheduler;
import com.questrail.harness.internal.time.ScheduledExecutorScheduler;
import com.questrail.harness.internal.time.SystemMonotonicClock;
import com.questrail.harness.internal.time.SystemWallClock;
import com.questrail.harness.internal.time.WallClock;
import com.questrail.harness.middleware.Middleware;
import com.questrail.harness.middleware.Runner;
import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.scenario.Player;
import com.questrail.harness.scenario.Scenario;
import com.questrail.harness.scenario.ScenarioApi;
import com.questrail.harness.transport.ControlChannelConnector;
import com.questrail.harness.transport.ws.netty.NettyWebSocketConnector;
import com.questrail.harness.util.Futures;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Orchestrator
 * =============================================================================
 * Registers scenarios, runs each through the middleware chain and collects
 * the outcomes.
 *
 * <h2>Execution</h2>
 * Every registered scenario is handed to the middleware chain together with a
 * runner. The runner builds a fresh {@link ScenarioApi} for the scenario, runs
 * the scenario on the scenario executor (never on a channel event loop), and
 * afterwards kills every player the scenario created, whether it succeeded or
 * not. Scenarios run concurrently unless a middleware orders them.
 *
 * <h2>Failures</h2>
 * A failing scenario is recorded under its description in
 * {@link OrchestratorStats#errors()} and does not affect the others. A kill
 * failure after an otherwise successful scenario counts as that scenario's
 * failure.
 *
 * <h2>Lifecycle</h2>
 * An orchestrator runs once. Executors it created itself and the spawners'
 * machine sessions are released when the run completes.
 *
 * @param <A> scenario shape authors register, as accepted by the middleware chain
 */
public final class Orchestrator<A>
{
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private record Registered<A>(String description, A scenario) {}

    private final Middleware<A, Scenario<ScenarioApi<MachineConfigs, Player>>> middleware;
    private final GlobalConfig globalConfig;
    private final ConductorEnvironment environment;
    private final HarnessObservabilitySink sink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final ScheduledExecutorService ownedSchedulerExecutor;
    private final ExecutorService scenarioExecutor;
    private final boolean ownsScenarioExecutor;
    private final Function<String, ConductorSpawner> spawnerResolver;
    private final Consumer<Signal> signalHandler;
    private final Duration quietPeriod;

    private final List<Registered<A>> scenarios = new CopyOnWriteArrayList<>();
    private final Map<String, ConductorSpawner> spawners = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private Orchestrator(Builder<A> b)
    {
        this.middleware = b.middleware;
        this.globalConfig = b.globalConfig;
        this.environment = b.environment;
        this.sink = b.sink;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.signalHandler = b.signalHandler;
        this.quietPeriod = b.quietPeriod;

        if (b.scheduler != null) {
            this.scheduler = b.scheduler;
            this.ownedSchedulerExecutor = null;
        } else {
            this.ownedSchedulerExecutor = Executors.newSingleThreadScheduledExecutor(daemon("harness-scheduler"));
            this.scheduler = new ScheduledExecutorScheduler(ownedSchedulerExecutor, clock);
        }

        if (b.scenarioExecutor != null) {
            this.scenarioExecutor = b.scenarioExecutor;
            this.ownsScenarioExecutor = false;
        } else {
            this.scenarioExecutor = Executors.newCachedThreadPool(daemon("harness-scenario"));
            this.ownsScenarioExecutor = true;
        }

        this.spawnerResolver = b.spawnerResolver != null ? b.spawnerResolver : this::defaultSpawner;
    }

    /**
     * @throws IllegalStateException if the run has already started
     */
    public void registerScenario(String description, A scenario)
    {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(scenario, "scenario");
        if (started.get()) {
            throw new IllegalStateException("Scenarios must be registered before run()");
        }
        scenarios.add(new Registered<>(description, scenario));
    }

    public int scenarioCount()
    {
        return scenarios.size();
    }

    /**
     * Run every registered scenario.
     *
     * @return completes once every scenario has settled and its players were killed
     */
    public CompletableFuture<OrchestratorStats> run()
    {
        if (!started.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(new IllegalStateException("Orchestrator has already run"));
        }
        log.info("Running {} scenario(s)", scenarios.size());

        Map<String, Throwable> errors = new ConcurrentHashMap<>();
        List<CompletableFuture<Void>> outcomes = new ArrayList<>();
        for (Registered<A> registered : scenarios) {
            String description = registered.description();
            outcomes.add(Futures.invoke(() -> middleware.apply(runner(description), registered.scenario()))
                    .<Void>handle((ignored, error) -> {
                        if (error != null) {
                            Throwable cause = Futures.unwrap(error);
                            log.warn("Scenario '{}' failed", description, cause);
                            errors.put(description, cause);
                        } else {
                            log.info("Scenario '{}' passed", description);
                        }
                        return null;
                    }));
        }

        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture<?>[0]))
                .thenCompose(ignored -> closeSpawners())
                .handle((ignored, closeError) -> {
                    if (closeError != null) {
                        log.warn("Releasing machine sessions failed", Futures.unwrap(closeError));
                    }
                    shutdownOwnedExecutors();

                    Map<String, Throwable> ordered = new LinkedHashMap<>();
                    for (Registered<A> registered : scenarios) {
                        Throwable error = errors.get(registered.description());
                        if (error != null) {
                            ordered.put(registered.description(), error);
                        }
                    }
                    OrchestratorStats stats = new OrchestratorStats(scenarios.size() - ordered.size(), ordered);
                    log.info("Run finished: {} passed, {} failed", stats.successes(), stats.errors().size());
                    return stats;
                });
    }

    private Runner<Scenario<ScenarioApi<MachineConfigs, Player>>> runner(String description)
    {
        return scenario -> {
            SignalQuiescenceBarrier barrier = new SignalQuiescenceBarrier(clock, scheduler, quietPeriod);
            OrchestratorScenarioApi api = new OrchestratorScenarioApi(
                    description, globalConfig, barrier, conductorFactory(barrier), this::spawnerFor);

            CompletableFuture<Void> outcome = CompletableFuture
                    .supplyAsync(() -> Futures.invoke(() -> scenario.run(api)), scenarioExecutor)
                    .thenCompose(Function.identity());

            return outcome
                    .handle((ignored, error) -> api.killAll().<Void>handle((v, killError) -> {
                        if (error != null) {
                            Throwable cause = Futures.unwrap(error);
                            if (killError != null) {
                                cause.addSuppressed(Futures.unwrap(killError));
                            }
                            throw new CompletionException(cause);
                        }
                        if (killError != null) {
                            throw new CompletionException(Futures.unwrap(killError));
                        }
                        return null;
                    }))
                    .thenCompose(Function.identity());
        };
    }

    private ConductorFactory conductorFactory(SignalQuiescenceBarrier barrier)
    {
        return (name, backend, terminator) -> {
            Conductor.Builder builder = Conductor.builder(name, backend)
                    .withTerminator(terminator)
                    .withEnvironment(environment)
                    .withClock(clock)
                    .withWallClock(wallClock)
                    .withScheduler(scheduler)
                    .withObservabilitySink(sink)
                    .withConsistencyListener(barrier);
            if (signalHandler != null) {
                builder.withSignalHandler(signalHandler);
            }
            return builder.build();
        };
    }

    private ConductorSpawner spawnerFor(String machine)
    {
        return spawners.computeIfAbsent(machine, spawnerResolver);
    }

    private ConductorSpawner defaultSpawner(String machine)
    {
        String runId = UUID.randomUUID().toString();
        if (MachineConfigs.LOCAL.equals(machine)) {
            return ProcessConductorSpawner.builder().withRunId(runId).build();
        }
        ControlChannelConnector connector = new NettyWebSocketConnector();
        ConductorConfigGenerator generator = DefaultConductorConfigGenerator.INSTANCE;
        return new TunneledConductorSpawner(
                URI.create(machine), connector, generator, clock, scheduler, Duration.ofMillis(100), runId);
    }

    private CompletableFuture<Void> closeSpawners()
    {
        List<CompletableFuture<Void>> closes = new ArrayList<>();
        for (ConductorSpawner spawner : spawners.values()) {
            closes.add(Futures.invoke(spawner::close));
        }
        return CompletableFuture.allOf(closes.toArray(new CompletableFuture<?>[0]));
    }

    private void shutdownOwnedExecutors()
    {
        if (ownedSchedulerExecutor != null) {
            ownedSchedulerExecutor.shutdownNow();
        }
        if (ownsScenarioExecutor) {
            scenarioExecutor.shutdown();
        }
    }

    private static ThreadFactory daemon(String prefix)
    {
        AtomicInteger count = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static <A> Builder<A> builder(Middleware<A, Scenario<ScenarioApi<MachineConfigs, Player>>> middleware)
    {
        return new Builder<>(middleware);
    }

    public static final class Builder<A>
    {
        private final Middleware<A, Scenario<ScenarioApi<MachineConfigs, Player>>> middleware;
        private GlobalConfig globalConfig = GlobalConfig.defaults();
        private ConductorEnvironment environment = ConductorEnvironment.defaults();
        private HarnessObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private ExecutorService scenarioExecutor;
        private Function<String, ConductorSpawner> spawnerResolver;
        private Consumer<Signal> signalHandler;
        private Duration quietPeriod = Duration.ofSeconds(2);

        private Builder(Middleware<A, Scenario<ScenarioApi<MachineConfigs, Player>>> middleware)
        {
            this.middleware = Objects.requireNonNull(middleware, "middleware");
        }

        public Builder<A> withGlobalConfig(GlobalConfig globalConfig)
        {
            this.globalConfig = globalConfig;
            return this;
        }

        public Builder<A> withEnvironment(ConductorEnvironment environment)
        {
            this.environment = environment;
            return this;
        }

        public Builder<A> withObservabilitySink(HarnessObservabilitySink sink)
        {
            this.sink = sink;
            return this;
        }

        public Builder<A> withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder<A> withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Scheduler for call deadlines and barrier checks. Without one the
         * orchestrator creates and later shuts down its own.
         */
        public Builder<A> withScheduler(MonotonicScheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Executor scenario code runs on. Not shut down by the orchestrator.
         */
        public Builder<A> withScenarioExecutor(ExecutorService executor)
        {
            this.scenarioExecutor = executor;
            return this;
        }

        /**
         * Chooses the spawner for a machine endpoint. Called at most once per
         * endpoint per run. By default {@link MachineConfigs#LOCAL} gets a
         * {@link ProcessConductorSpawner} and any other endpoint is treated as
         * a remote control server URL.
         */
        public Builder<A> withSpawnerResolver(Function<String, ConductorSpawner> resolver)
        {
            this.spawnerResolver = resolver;
            return this;
        }

        public Builder<A> withSignalHandler(Consumer<Signal> handler)
        {
            this.signalHandler = handler;
            return this;
        }

        /**
         * How long no consistency signal may arrive before the network counts as settled.
         */
        public Builder<A> withQuietPeriod(Duration quietPeriod)
        {
            this.quietPeriod = quietPeriod;
            return this;
        }

        public Orchestrator<A> build()
        {
            Objects.requireNonNull(globalConfig, "globalConfig");
            Objects.requireNonNull(environment, "environment");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(quietPeriod, "quietPeriod");
            return new Orchestrator<>(this);
        }
    }
}
