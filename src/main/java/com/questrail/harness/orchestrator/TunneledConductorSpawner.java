package com.questrail.harness.orchestrator;

import com.questrail.harness.backend.BackendStrategy;
import com.questrail.harness.conductor.Conductor;
import com.questrail.harness.config.ConductorConfigGenerator;
import com.questrail.harness.config.ConfigSeedArgs;
import com.questrail.harness.config.GlobalConfig;
import com.questrail.harness.internal.time.MonotonicClock;
import com.questrail.harness.internal.time.MonotonicScheduler;
import com.questrail.harness.transport.ControlChannelConnector;
import com.questrail.harness.transport.remote.RemoteControlSession;
import com.questrail.harness.transport.remote.SessionTunnelRpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Spawns conductors on a remote host through its control server.
 *
 * <p>One control session is opened on first use and shared by every player
 * placed on the host. Each spawn uploads a generated conductor config, asks
 * the server to start the conductor and returns a conductor whose traffic is
 * tunneled through the session. Killing that conductor asks the server to
 * kill the process.</p>
 */
public final class TunneledConductorSpawner implements ConductorSpawner
{
    private static final Logger log = LoggerFactory.getLogger(TunneledConductorSpawner.class);

    private final URI endpoint;
    private final ControlChannelConnector connector;
    private final ConductorConfigGenerator generator;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Duration signalPollInterval;
    private final String runId;

    private final Object lock = new Object();
    private CompletableFuture<RemoteControlSession> session;

    public TunneledConductorSpawner(URI endpoint,
                                    ControlChannelConnector connector,
                                    ConductorConfigGenerator generator,
                                    MonotonicClock clock,
                                    MonotonicScheduler scheduler,
                                    Duration signalPollInterval,
                                    String runId)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.signalPollInterval = Objects.requireNonNull(signalPollInterval, "signalPollInterval");
        this.runId = Objects.requireNonNull(runId, "runId");
    }

    private CompletableFuture<RemoteControlSession> session()
    {
        synchronized (lock) {
            if (session == null || session.isCompletedExceptionally()) {
                session = RemoteControlSession.connect(endpoint, connector);
            }
            return session;
        }
    }

    @Override
    public CompletableFuture<Conductor> spawn(String playerName, GlobalConfig global, ConductorFactory factory)
    {
        return session().thenCompose(s -> s.placement().thenCompose(placement -> {
            ConfigSeedArgs seed = new ConfigSeedArgs(
                    placement.adminPort(), placement.appPort(), Path.of(placement.configDir()), runId, playerName);
            String config = generator.generate(seed, global);
            log.info("Spawning player '{}' on {}", playerName, endpoint);

            return s.player(playerName, config)
                    .thenCompose(v -> s.spawn(playerName))
                    .thenApply(v -> factory.create(
                            playerName,
                            new BackendStrategy.Tunneled(new SessionTunnelRpc(s, clock, scheduler, signalPollInterval)),
                            signal -> s.kill(playerName, signal)));
        }));
    }

    @Override
    public CompletableFuture<Void> close()
    {
        CompletableFuture<RemoteControlSession> current;
        synchronized (lock) {
            current = session;
            session = null;
        }
        if (current == null || current.isCompletedExceptionally()) {
            return CompletableFuture.completedFuture(null);
        }
        return current.thenCompose(RemoteControlSession::close);
    }
}
