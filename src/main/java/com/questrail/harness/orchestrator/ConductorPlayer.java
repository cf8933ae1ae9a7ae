package com.questrail.harness.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.api.ConductorState;
import com.questrail.harness.api.InstalledApp;
import com.questrail.harness.conductor.Conductor;
import com.questrail.harness.config.GlobalConfig;
import com.questrail.harness.config.PlayerConfig;
import com.questrail.harness.error.UnknownCellException;
import com.questrail.harness.scenario.InstanceInfo;
import com.questrail.harness.scenario.Player;
import com.questrail.harness.util.Futures;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * A {@link Player} backed by one {@link Conductor} at a time.
 *
 * <p>Every {@link #spawn()} starts a fresh conductor process, initializes it
 * and installs one application whose cells are the player's instances, each
 * under its instance id. A player can be killed and spawned again; the new
 * conductor knows nothing of the previous one's installs.</p>
 */
public final class ConductorPlayer implements Player
{
    private final String name;
    private final PlayerConfig config;
    private final GlobalConfig global;
    private final ConductorSpawner spawner;
    private final ConductorFactory factory;

    private final Object lock = new Object();
    private Conductor conductor;
    private InstalledApp app;
    private boolean spawning;

    public ConductorPlayer(String name,
                           PlayerConfig config,
                           GlobalConfig global,
                           ConductorSpawner spawner,
                           ConductorFactory factory)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.global = Objects.requireNonNull(global, "global");
        this.spawner = Objects.requireNonNull(spawner, "spawner");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public String name()
    {
        return name;
    }

    public Optional<Conductor> conductor()
    {
        synchronized (lock) {
            return Optional.ofNullable(conductor);
        }
    }

    @Override
    public CompletableFuture<Void> spawn()
    {
        synchronized (lock) {
            if (spawning || (conductor != null && conductor.state() != ConductorState.KILLED)) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Player '" + name + "' is already running"));
            }
            spawning = true;
            app = null;
        }

        return Futures.invoke(() -> spawner.spawn(name, global, factory))
                .thenCompose(c -> {
                    synchronized (lock) {
                        conductor = c;
                    }
                    return c.initialize()
                            .thenCompose(v -> c.installApplication(Optional.empty(), config.toAppSource(), config.appId()))
                            .handle((installed, error) -> {
                                if (error == null) {
                                    synchronized (lock) {
                                        app = installed;
                                    }
                                    return CompletableFuture.<Void>completedFuture(null);
                                }
                                Throwable cause = Futures.unwrap(error);
                                return c.kill().<Void>handle((ignored, killError) -> {
                                    if (killError != null) {
                                        cause.addSuppressed(Futures.unwrap(killError));
                                    }
                                    throw new CompletionException(cause);
                                });
                            })
                            .thenCompose(Function.identity());
                })
                .whenComplete((ignored, error) -> {
                    synchronized (lock) {
                        spawning = false;
                    }
                });
    }

    @Override
    public CompletableFuture<Void> kill()
    {
        Conductor c;
        synchronized (lock) {
            c = conductor;
        }
        return c == null ? CompletableFuture.completedFuture(null) : c.kill();
    }

    @Override
    public CompletableFuture<JsonNode> call(String instanceId, String zome, String fn, Object payload)
    {
        Conductor c;
        InstalledApp installed;
        synchronized (lock) {
            c = conductor;
            installed = app;
        }
        if (c == null || installed == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Player '" + name + "' is not spawned"));
        }
        return c.callFunction(installed.appId(), instanceId, zome, fn, payload);
    }

    @Override
    public InstanceInfo instance(String instanceId)
    {
        InstalledApp installed;
        synchronized (lock) {
            installed = app;
        }
        if (installed == null) {
            throw new IllegalStateException("Player '" + name + "' is not spawned");
        }
        return installed.cell(instanceId)
                .map(cell -> new InstanceInfo(instanceId, installed.appId(), installed.agentKey(), cell.cellId()))
                .orElseThrow(() -> new UnknownCellException(installed.appId(), instanceId));
    }

    @Override
    public CompletableFuture<JsonNode> admin(String method, JsonNode params)
    {
        Conductor c;
        synchronized (lock) {
            c = conductor;
        }
        if (c == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Player '" + name + "' is not spawned"));
        }
        return c.callAdmin(method, params);
    }

    @Override
    public String toString()
    {
        return "ConductorPlayer[" + name + "]";
    }
}
