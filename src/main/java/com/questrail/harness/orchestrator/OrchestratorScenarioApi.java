package com.questrail.harness.orchestrator;

import com.questrail.harness.config.GlobalConfig;
import com.questrail.harness.config.MachineConfigs;
import com.questrail.harness.config.PlayerConfig;
import com.questrail.harness.config.PlayerConfigs;
import com.questrail.harness.scenario.ConsistencyBarrier;
import com.questrail.harness.scenario.Player;
import com.questrail.harness.scenario.ScenarioApi;
import com.questrail.harness.util.Futures;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * The {@link ScenarioApi} the orchestrator hands to the innermost scenario.
 * Remembers every player it created so they can all be killed afterwards.
 */
final class OrchestratorScenarioApi implements ScenarioApi<MachineConfigs, Player>
{
    private final String description;
    private final GlobalConfig global;
    private final ConsistencyBarrier barrier;
    private final ConductorFactory factory;
    private final Function<String, ConductorSpawner> spawners;

    private final List<ConductorPlayer> created = new CopyOnWriteArrayList<>();

    OrchestratorScenarioApi(String description,
                            GlobalConfig global,
                            ConsistencyBarrier barrier,
                            ConductorFactory factory,
                            Function<String, ConductorSpawner> spawners)
    {
        this.description = description;
        this.global = global;
        this.barrier = barrier;
        this.factory = factory;
        this.spawners = spawners;
    }

    @Override
    public String description()
    {
        return description;
    }

    @Override
    public CompletableFuture<Map<String, Player>> players(MachineConfigs machines, boolean start)
    {
        Map<String, Player> players = new LinkedHashMap<>();
        List<CompletableFuture<Void>> spawns = new ArrayList<>();
        try {
            // rejects a name declared on two machines
            machines.allPlayers();
            for (Map.Entry<String, PlayerConfigs> machine : machines.machines().entrySet()) {
                ConductorSpawner spawner = spawners.apply(machine.getKey());
                for (Map.Entry<String, PlayerConfig> entry : machine.getValue().players().entrySet()) {
                    ConductorPlayer player = new ConductorPlayer(entry.getKey(), entry.getValue(), global, spawner, factory);
                    created.add(player);
                    players.put(entry.getKey(), player);
                    if (start) {
                        spawns.add(player.spawn());
                    }
                }
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.allOf(spawns.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> players);
    }

    @Override
    public CompletableFuture<Void> consistency()
    {
        return barrier.await();
    }

    @Override
    public GlobalConfig globalConfig()
    {
        return global;
    }

    /**
     * Kill every player created through this api. Completes once all kills
     * have settled; fails with the first kill failure.
     */
    CompletableFuture<Void> killAll()
    {
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        List<CompletableFuture<Void>> kills = new ArrayList<>();
        for (ConductorPlayer player : created) {
            kills.add(Futures.invoke(player::kill).<Void>handle((ignored, error) -> {
                if (error != null) {
                    firstFailure.compareAndSet(null, Futures.unwrap(error));
                }
                return null;
            }));
        }
        return CompletableFuture.allOf(kills.toArray(new CompletableFuture<?>[0])).thenCompose(ignored ->
                firstFailure.get() == null
                        ? CompletableFuture.<Void>completedFuture(null)
                        : CompletableFuture.<Void>failedFuture(firstFailure.get()));
    }
}
