package com.questrail.harness.conductor;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.api.AppSource;
import com.questrail.harness.api.CellId;
import com.questrail.harness.api.ConductorState;
import com.questrail.harness.api.DnaDeclaration;
import com.questrail.harness.api.DnaSource;
import com.questrail.harness.api.InstalledApp;
import com.questrail.harness.api.InstalledCell;
import com.questrail.harness.api.Signal;
import com.questrail.harness.backend.BackendStrategy;
import com.questrail.harness.backend.SignalSubscription;
import com.questrail.harness.backend.TunnelRpc;
import com.questrail.harness.config.ConductorEnvironment;
import com.questrail.harness.error.ActivationException;
import com.questrail.harness.error.ConductorConfigurationException;
import com.questrail.harness.error.ConductorConnectionException;
import com.questrail.harness.error.UnsupportedConductorOperationException;
import com.questrail.harness.internal.exec.ActivityTracker;
import com.questrail.harness.internal.exec.CallDispatcher;
import com.questrail.harness.internal.exec.CallTarget;
import com.questrail.harness.internal.time.MonotonicClock;
import com.questrail.harness.internal.time.MonotonicScheduler;
import com.questrail.harness.internal.time.SystemMonotonicClock;
import com.questrail.harness.internal.time.SystemWallClock;
import com.questrail.harness.internal.time.WallClock;
import com.questrail.harness.observability.ConductorStateTransitionEvent;
import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.observability.TransportObservabilityEvent;
import com.questrail.harness.transport.AdminClient;
import com.questrail.harness.transport.AppClient;
import com.questrail.harness.transport.ControlChannelConnector;
import com.questrail.harness.transport.ControlChannelListener;
import com.questrail.harness.transport.tunnel.TunneledAdminChannel;
import com.questrail.harness.transport.tunnel.TunneledAppChannel;
import com.questrail.harness.transport.ws.netty.NettyWebSocketConnector;
import com.questrail.harness.util.Futures;
import com.questrail.harness.util.Jsons;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Conductor
 * =============================================================================
 * One managed conductor process, reached through exactly one
 * {@link BackendStrategy} for its whole lifetime.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   UNINITIALIZED ──initialize()──▶ CONNECTING ──▶ CONNECTED ──kill()──▶ KILLED
 *                                        └──setup failed──────────────▶ KILLED
 * </pre>
 * A killed conductor is never reused; spawning again means building a new
 * instance, which starts with an empty install index.
 *
 * <h2>Threading</h2>
 * Every operation returns a {@link CompletableFuture} and never blocks.
 * Continuations may run on channel event loops or scheduler threads. State
 * changes go through compare-and-set so a kill racing connection setup or a
 * second kill are both harmless.
 *
 * <h2>Errors</h2>
 * Failures complete the returned future exceptionally with a
 * {@link com.questrail.harness.error.HarnessException} subtype, or with
 * {@link IllegalStateException} when an operation is used in the wrong state.
 */
public final class Conductor
{
    /** Capability secret sent with every call unless configured otherwise: 64 bytes of 0xAA. */
    public static final String DEFAULT_CAP_SECRET;

    static {
        byte[] secret = new byte[64];
        Arrays.fill(secret, (byte) 0xAA);
        DEFAULT_CAP_SECRET = Base64.getEncoder().encodeToString(secret);
    }

    private final String name;
    private final BackendStrategy backend;
    private final ControlChannelConnector connector;
    private final ProcessTerminator terminator;
    private final ConductorEnvironment environment;
    private final CallDispatcher dispatcher;
    private final ActivityTracker activity;
    private final SignalRouter signals;
    private final ProvenancePolicy provenancePolicy;
    private final String capSecret;
    private final HarnessObservabilitySink sink;
    private final WallClock wallClock;

    private final CellIndex cellIndex = new CellIndex();
    private final Set<String> installing = ConcurrentHashMap.newKeySet();
    private final AtomicReference<ConductorState> state = new AtomicReference<>(ConductorState.UNINITIALIZED);
    private final AtomicBoolean killStarted = new AtomicBoolean(false);
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private final Object channelLock = new Object();

    private AdminClient admin;
    private AppClient app;
    private SignalSubscription signalSubscription;

    private Conductor(Builder b)
    {
        this.name = b.name;
        this.backend = b.backend;
        this.connector = b.connector;
        this.terminator = b.terminator;
        this.environment = b.environment;
        this.sink = b.sink;
        this.wallClock = b.wallClock;
        this.provenancePolicy = b.provenancePolicy;
        this.capSecret = b.capSecret;
        this.activity = new ActivityTracker(b.clock, b.onActivity);
        this.dispatcher = new CallDispatcher(b.clock, b.scheduler, b.wallClock, b.environment.timingPolicy(), b.sink);
        this.signals = new SignalRouter(b.name, b.consistencyListener, b.signalHandler, activity, b.sink, b.wallClock);
    }

    public String name()
    {
        return name;
    }

    public ConductorState state()
    {
        return state.get();
    }

    public BackendStrategy backend()
    {
        return backend;
    }

    /**
     * Monotonic time of the last successful interaction, or 0 if none.
     */
    public long lastActivityNanos()
    {
        return activity.lastActivityNanos();
    }

    /**
     * Calls issued through this conductor that have not settled yet.
     */
    public int pendingCallCount()
    {
        return dispatcher.pendingCount();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Open the admin and application channels.
     *
     * <p>Valid only once, from {@link ConductorState#UNINITIALIZED}. A stub
     * backend fails with {@link ConductorConfigurationException} and stays
     * uninitialized. Any channel failure moves the conductor to
     * {@link ConductorState#KILLED}, closes whatever was opened, and fails with
     * {@link ConductorConnectionException}; {@link #kill(Optional)} must still
     * be called to end the process.</p>
     */
    public CompletableFuture<Void> initialize()
    {
        return backend.accept(new BackendStrategy.Visitor<CompletableFuture<Void>>() {
            @Override
            public CompletableFuture<Void> visitLocal(BackendStrategy.Local local)
            {
                return connect(() -> connectLocal(local));
            }

            @Override
            public CompletableFuture<Void> visitTunneled(BackendStrategy.Tunneled tunneled)
            {
                return connect(() -> connectTunneled(tunneled.rpc()));
            }

            @Override
            public CompletableFuture<Void> visitStub(BackendStrategy.Stub stub)
            {
                return CompletableFuture.failedFuture(new ConductorConfigurationException(
                        "Conductor '" + name + "' has a stub backend and cannot be initialized"));
            }
        });
    }

    private CompletableFuture<Void> connect(Supplier<CompletableFuture<Void>> setup)
    {
        if (!transition(ConductorState.UNINITIALIZED, ConductorState.CONNECTING)) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "Conductor '" + name + "' cannot be initialized in state " + state.get()));
        }
        activity.recordActivity();

        CompletableFuture<Void> attempt;
        try {
            attempt = setup.get();
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }

        return attempt.handle((ignored, error) -> {
            if (error == null) {
                if (transition(ConductorState.CONNECTING, ConductorState.CONNECTED)) {
                    return CompletableFuture.<Void>completedFuture(null);
                }
                // killed while connecting
                return failAfterClose(new ConductorConnectionException(name, "killed during connection setup", null));
            }

            Throwable cause = Futures.unwrap(error);
            ConductorConnectionException failure = cause instanceof ConductorConnectionException
                    ? (ConductorConnectionException) cause
                    : new ConductorConnectionException(name, "connection setup failed", cause);
            transition(ConductorState.CONNECTING, ConductorState.KILLED);
            return failAfterClose(failure);
        }).thenCompose(Function.identity());
    }

    private CompletableFuture<Void> failAfterClose(ConductorConnectionException failure)
    {
        return closeChannels().<Void>handle((ignored, closeError) -> {
            if (closeError != null) {
                failure.addSuppressed(Futures.unwrap(closeError));
            }
            throw failure;
        });
    }

    private CompletableFuture<Void> connectLocal(BackendStrategy.Local local)
    {
        URI adminUri = endpoint(local.host(), local.adminPort());
        return stage("admin interface unreachable at " + adminUri,
                connector.connect(adminUri, listener("admin", false)))
                .thenCompose(channel -> {
                    AdminClient client = new AdminClient(channel);
                    synchronized (channelLock) {
                        admin = client;
                    }
                    channelUp("admin", adminUri.toString());
                    activity.recordActivity();
                    return stage("attach_app_interface failed", client.attachAppInterface(local.appPort()));
                })
                .thenCompose(port -> {
                    URI appUri = endpoint(local.host(), port);
                    return stage("app interface unreachable at " + appUri,
                            connector.connect(appUri, listener("app", true)))
                            .thenAccept(channel -> {
                                synchronized (channelLock) {
                                    app = new AppClient(channel);
                                }
                                channelUp("app", appUri.toString());
                            });
                });
    }

    private CompletableFuture<Void> connectTunneled(TunnelRpc rpc)
    {
        AdminClient client = new AdminClient(new TunneledAdminChannel(rpc));
        synchronized (channelLock) {
            admin = client;
        }
        channelUp("admin", "tunnel");

        return stage("attach_app_interface through tunnel failed", client.attachAppInterface(0))
                .thenCompose(port -> stage("connect_app_interface for port " + port + " failed",
                        rpc.connectAppPort(port)).thenApply(v -> port))
                .thenCompose(port -> {
                    synchronized (channelLock) {
                        app = new AppClient(new TunneledAppChannel(rpc, port));
                    }
                    channelUp("app", "tunnel:" + port);
                    return stage("signal subscription for port " + port + " failed",
                            SignalSubscription.acquire(rpc, port, signals::route));
                })
                .thenAccept(subscription -> {
                    synchronized (channelLock) {
                        signalSubscription = subscription;
                    }
                });
    }

    /**
     * Tear down: app channel, then admin channel, then the process.
     *
     * <p>Safe in every state, including when no channel was ever opened. Only
     * the first call does anything; later calls return the same completion.
     * The returned future fails if a close step or the terminator failed, but
     * every step is attempted regardless.</p>
     *
     * @param signal signal name passed to the process terminator
     */
    public CompletableFuture<Void> kill(Optional<String> signal)
    {
        Objects.requireNonNull(signal, "signal");
        if (!killStarted.compareAndSet(false, true)) {
            return closed.copy();
        }

        ConductorState previous = state.getAndSet(ConductorState.KILLED);
        if (previous != ConductorState.KILLED) {
            sink.onStateTransition(new ConductorStateTransitionEvent(
                    wallClock.now(), name, previous, ConductorState.KILLED));
        }

        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        closeChannels()
                .handle((ignored, error) -> {
                    if (error != null) {
                        firstFailure.compareAndSet(null, Futures.unwrap(error));
                    }
                    return null;
                })
                .thenCompose(ignored -> Futures.invoke(() -> terminator.terminate(signal)))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        firstFailure.compareAndSet(null, Futures.unwrap(error));
                    }
                    Throwable failure = firstFailure.get();
                    if (failure == null) {
                        closed.complete(null);
                    } else {
                        closed.completeExceptionally(failure);
                    }
                });
        return closed.copy();
    }

    public CompletableFuture<Void> kill()
    {
        return kill(Optional.empty());
    }

    /**
     * Completes once {@link #kill(Optional)} has finished.
     */
    public CompletableFuture<Void> awaitClosed()
    {
        return closed.copy();
    }

    private CompletableFuture<Void> closeChannels()
    {
        SignalSubscription subscription;
        AppClient appClient;
        AdminClient adminClient;
        synchronized (channelLock) {
            subscription = signalSubscription;
            appClient = app;
            adminClient = admin;
            signalSubscription = null;
            app = null;
            admin = null;
        }

        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        if (subscription != null) {
            chain = closeStep(chain, subscription::release, firstFailure);
        }
        if (appClient != null) {
            chain = closeStep(chain, () -> appClient.channel().close(), firstFailure);
        }
        if (adminClient != null) {
            chain = closeStep(chain, () -> adminClient.channel().close(), firstFailure);
        }
        return chain.thenCompose(ignored -> firstFailure.get() == null
                ? CompletableFuture.<Void>completedFuture(null)
                : CompletableFuture.<Void>failedFuture(firstFailure.get()));
    }

    private static CompletableFuture<Void> closeStep(CompletableFuture<Void> previous,
                                                     Supplier<CompletableFuture<Void>> step,
                                                     AtomicReference<Throwable> firstFailure)
    {
        return previous.thenCompose(ignored -> Futures.invoke(step).<Void>handle((v, error) -> {
            if (error != null) {
                firstFailure.compareAndSet(null, Futures.unwrap(error));
            }
            return null;
        }));
    }

    // -------------------------------------------------------------------------
    // Applications
    // -------------------------------------------------------------------------

    /**
     * Install and enable an application.
     *
     * <p>Without an agent key one is generated first. DNA sources are resolved
     * for this conductor's backend and registered, then the app is installed
     * and explicitly enabled. If enable reports errors the operation fails with
     * {@link ActivationException}; the install is not undone. The app's cells
     * are indexed by nickname only after enable succeeded.</p>
     *
     * @param agentKey agent public key, or empty to generate one
     * @param source   DNAs or bundle to install
     * @param appId    application id, or empty to generate one
     */
    public CompletableFuture<InstalledApp> installApplication(Optional<String> agentKey,
                                                              AppSource source,
                                                              Optional<String> appId)
    {
        Objects.requireNonNull(agentKey, "agentKey");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(appId, "appId");

        AdminClient adminClient;
        try {
            adminClient = liveAdmin();
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }

        String id = appId.orElseGet(() -> "app-" + UUID.randomUUID());
        // Reserved until the install settles; an indexed app is registered before its reservation ends.
        if (!installing.add(id)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "App '" + id + "' is already being installed on conductor '" + name + "'"));
        }
        if (cellIndex.contains(id)) {
            installing.remove(id);
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "App '" + id + "' is already installed on conductor '" + name + "'"));
        }

        CompletableFuture<String> key = Futures.invoke(() -> agentKey
                .map(CompletableFuture::completedFuture)
                .orElseGet(adminClient::generateAgentPubKey));

        return key
                .thenCompose(k -> install(adminClient, id, k, source).thenApply(cells -> new InstalledApp(id, k, cells)))
                .thenCompose(installed -> adminClient.enableApp(id).thenApply(errors -> {
                    if (!errors.isEmpty()) {
                        throw new ActivationException(id, errors);
                    }
                    return installed;
                }))
                .thenApply(installed -> {
                    cellIndex.register(installed);
                    activity.recordActivity();
                    return installed;
                })
                .whenComplete((installed, error) -> installing.remove(id));
    }

    private CompletableFuture<List<InstalledCell>> install(AdminClient adminClient,
                                                           String appId,
                                                           String agentKey,
                                                           AppSource source)
    {
        if (source instanceof AppSource.Dnas dnas) {
            List<CompletableFuture<AdminClient.InstallDna>> registrations = new ArrayList<>();
            for (DnaDeclaration dna : dnas.dnas()) {
                registrations.add(resolve(dna.source())
                        .thenCompose(resolved -> adminClient.registerDna(resolved, dna.uid(), dna.properties()))
                        .thenApply(hash -> new AdminClient.InstallDna(hash, dna.nick(), dna.membraneProof())));
            }
            return CompletableFuture.allOf(registrations.toArray(new CompletableFuture<?>[0]))
                    .thenCompose(ignored -> adminClient.installApp(appId, agentKey,
                            registrations.stream().map(CompletableFuture::join).collect(Collectors.toList())));
        }
        if (source instanceof AppSource.Bundle bundle) {
            return resolve(bundle.source()).thenCompose(resolved -> adminClient.installAppBundle(
                    resolved, appId, agentKey, bundle.membraneProofs(), bundle.uid()));
        }
        throw new AssertionError("Unhandled app source " + source);
    }

    private CompletableFuture<DnaSource> resolve(DnaSource source)
    {
        if (source instanceof DnaSource.Hash) {
            return CompletableFuture.completedFuture(source);
        }
        String ref = source instanceof DnaSource.Path path ? path.path() : ((DnaSource.Url) source).url();

        return backend.accept(new BackendStrategy.Visitor<CompletableFuture<DnaSource>>() {
            @Override
            public CompletableFuture<DnaSource> visitLocal(BackendStrategy.Local local)
            {
                return CompletableFuture.completedFuture(source);
            }

            @Override
            public CompletableFuture<DnaSource> visitTunneled(BackendStrategy.Tunneled tunneled)
            {
                return tunneled.rpc().fetchRemoteResource(ref).thenApply(DnaSource::path);
            }

            @Override
            public CompletableFuture<DnaSource> visitStub(BackendStrategy.Stub stub)
            {
                throw new IllegalStateException("A stub conductor is never connected");
            }
        });
    }

    /**
     * Ids of the installed apps, optionally filtered by status.
     */
    public CompletableFuture<List<String>> listApps(Optional<String> statusFilter)
    {
        Objects.requireNonNull(statusFilter, "statusFilter");
        try {
            return liveAdmin().listApps(statusFilter).thenApply(apps -> {
                activity.recordActivity();
                return apps;
            });
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Cell id indexed for {@code (appId, cellNick)}.
     *
     * @throws com.questrail.harness.error.UnknownCellException if nothing was installed under that pair
     */
    public CellId cellId(String appId, String cellNick)
    {
        return cellIndex.resolve(appId, cellNick);
    }

    /**
     * Nickname to cell id for one installed app; empty if unknown.
     */
    public Map<String, CellId> cells(String appId)
    {
        return cellIndex.cells(appId);
    }

    // -------------------------------------------------------------------------
    // Calls
    // -------------------------------------------------------------------------

    /**
     * Call a zome function on an installed cell under the configured
     * deadlines.
     *
     * @param payload any Jackson-serializable value; a {@link JsonNode} is sent as is
     * @return the function's result; fails with
     *         {@link com.questrail.harness.error.UnknownCellException},
     *         {@link com.questrail.harness.error.CallTimeoutException} or
     *         {@link com.questrail.harness.error.RemoteCallException}
     */
    public CompletableFuture<JsonNode> callFunction(String appId,
                                                    String cellNick,
                                                    String zomeName,
                                                    String fnName,
                                                    Object payload)
    {
        Objects.requireNonNull(zomeName, "zomeName");
        Objects.requireNonNull(fnName, "fnName");

        AppClient appClient;
        AdminClient adminClient;
        CellId cellId;
        JsonNode body;
        try {
            synchronized (channelLock) {
                appClient = app;
                adminClient = admin;
            }
            if (state.get() != ConductorState.CONNECTED || appClient == null) {
                throw new IllegalStateException("Conductor '" + name + "' is not connected (" + state.get() + ")");
            }
            cellId = cellIndex.resolve(appId, cellNick);
            body = payload instanceof JsonNode ? (JsonNode) payload : Jsons.toTree(payload);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        CallTarget target = new CallTarget(name, appId, cellNick, cellId, zomeName, fnName);
        String provenance = provenancePolicy.provenanceFor(cellId);

        return dispatcher.dispatch(
                target,
                () -> appClient.callZome(cellId, zomeName, fnName, capSecret, body, provenance),
                t -> adminClient == null
                        ? CompletableFuture.failedFuture(new IllegalStateException("admin channel closed"))
                        : adminClient.dumpState(t.cellId()))
                .thenApply(result -> {
                    activity.recordActivity();
                    return result;
                });
    }

    /**
     * Raw admin request.
     *
     * <p>Fails with {@link UnsupportedConductorOperationException}, without
     * sending anything, for a stub backend or when the environment selects the
     * legacy protocol.</p>
     */
    public CompletableFuture<JsonNode> callAdmin(String method, JsonNode params)
    {
        Objects.requireNonNull(method, "method");

        Optional<String> refusal = backend.accept(new BackendStrategy.Visitor<Optional<String>>() {
            @Override
            public Optional<String> visitLocal(BackendStrategy.Local local)
            {
                return legacyRefusal();
            }

            @Override
            public Optional<String> visitTunneled(BackendStrategy.Tunneled tunneled)
            {
                return legacyRefusal();
            }

            @Override
            public Optional<String> visitStub(BackendStrategy.Stub stub)
            {
                return Optional.of("admin calls are not available on a stub conductor");
            }
        });
        if (refusal.isPresent()) {
            return CompletableFuture.failedFuture(new UnsupportedConductorOperationException(
                    "Conductor '" + name + "': " + refusal.get()));
        }

        try {
            return liveAdmin().call(method, params == null ? Jsons.object() : params).thenApply(result -> {
                activity.recordActivity();
                return result;
            });
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Optional<String> legacyRefusal()
    {
        return environment.legacyProtocol()
                ? Optional.of("admin calls are disabled in legacy protocol mode")
                : Optional.empty();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private AdminClient liveAdmin()
    {
        AdminClient client;
        synchronized (channelLock) {
            client = admin;
        }
        if (state.get() != ConductorState.CONNECTED || client == null) {
            throw new IllegalStateException("Conductor '" + name + "' is not connected (" + state.get() + ")");
        }
        return client;
    }

    private boolean transition(ConductorState from, ConductorState to)
    {
        if (!from.canTransitionTo(to) || !state.compareAndSet(from, to)) {
            return false;
        }
        sink.onStateTransition(new ConductorStateTransitionEvent(wallClock.now(), name, from, to));
        return true;
    }

    private ControlChannelListener listener(String role, boolean routeSignals)
    {
        return new ControlChannelListener() {
            @Override
            public void onSignal(Signal signal)
            {
                if (routeSignals) {
                    signals.route(signal);
                }
            }

            @Override
            public void onClosed(Throwable cause)
            {
                sink.onTransportEvent(new TransportObservabilityEvent.ChannelDown(wallClock.now(), name, role, cause));
            }
        };
    }

    private void channelUp(String role, String endpoint)
    {
        sink.onTransportEvent(new TransportObservabilityEvent.ChannelUp(wallClock.now(), name, role, endpoint));
    }

    private <T> CompletableFuture<T> stage(String what, CompletableFuture<T> future)
    {
        return future.handle((value, error) -> {
            if (error != null) {
                throw new ConductorConnectionException(name, what, Futures.unwrap(error));
            }
            return value;
        });
    }

    private static URI endpoint(String host, int port)
    {
        return URI.create("ws://" + host + ":" + port);
    }

    @Override
    public String toString()
    {
        return "Conductor[" + name + ", " + state.get() + "]";
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static Builder builder(String name, BackendStrategy backend)
    {
        return new Builder(name, backend);
    }

    public static final class Builder
    {
        private final String name;
        private final BackendStrategy backend;

        private ControlChannelConnector connector;
        private ProcessTerminator terminator = ProcessTerminator.NONE;
        private ConductorEnvironment environment = ConductorEnvironment.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private HarnessObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private Runnable onActivity = () -> { };
        private Optional<Consumer<Signal>> signalHandler = Optional.empty();
        private Consumer<Signal> consistencyListener = signal -> { };
        private ProvenancePolicy provenancePolicy = ProvenancePolicy.CALLEE_AGENT;
        private String capSecret = DEFAULT_CAP_SECRET;

        private Builder(String name, BackendStrategy backend)
        {
            this.name = Objects.requireNonNull(name, "name");
            this.backend = Objects.requireNonNull(backend, "backend");
        }

        public Builder withConnector(ControlChannelConnector connector)
        {
            this.connector = connector;
            return this;
        }

        public Builder withTerminator(ProcessTerminator terminator)
        {
            this.terminator = terminator;
            return this;
        }

        public Builder withEnvironment(ConductorEnvironment environment)
        {
            this.environment = environment;
            return this;
        }

        public Builder withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(HarnessObservabilitySink sink)
        {
            this.sink = sink;
            return this;
        }

        /**
         * Invoked on every successful interaction and every received signal.
         */
        public Builder withActivityCallback(Runnable onActivity)
        {
            this.onActivity = onActivity;
            return this;
        }

        /**
         * Receives every signal whose kind is not handled internally.
         */
        public Builder withSignalHandler(Consumer<Signal> handler)
        {
            this.signalHandler = Optional.of(handler);
            return this;
        }

        public Builder withConsistencyListener(Consumer<Signal> listener)
        {
            this.consistencyListener = listener;
            return this;
        }

        public Builder withProvenancePolicy(ProvenancePolicy policy)
        {
            this.provenancePolicy = policy;
            return this;
        }

        public Builder withCapSecret(String capSecret)
        {
            this.capSecret = capSecret;
            return this;
        }

        public Conductor build()
        {
            if (name.isBlank()) {
                throw new IllegalStateException("Conductor name must not be blank");
            }
            if (scheduler == null) {
                throw new IllegalStateException("A scheduler is required for call deadlines");
            }
            if (connector == null) {
                connector = new NettyWebSocketConnector();
            }
            Objects.requireNonNull(terminator, "terminator");
            Objects.requireNonNull(environment, "environment");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(onActivity, "onActivity");
            Objects.requireNonNull(consistencyListener, "consistencyListener");
            Objects.requireNonNull(provenancePolicy, "provenancePolicy");
            Objects.requireNonNull(capSecret, "capSecret");
            return new Conductor(this);
        }
    }
}
