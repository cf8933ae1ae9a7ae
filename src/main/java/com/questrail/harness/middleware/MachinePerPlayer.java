package com.questrail.harness.middleware;

import com.questrail.harness.config.MachineConfigs;
import com.questrail.harness.config.PlayerConfig;
import com.questrail.harness.config.PlayerConfigs;
import com.questrail.harness.scenario.Player;
import com.questrail.harness.scenario.Scenario;
import com.questrail.harness.scenario.ScenarioApi;
import com.questrail.harness.scenario.ScenarioApis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Lets scenarios declare players without machines: each player gets a machine
 * of its own from a {@link MachineAllocator}.
 *
 * <p>Machines are acquired concurrently. Should the allocator return one
 * endpoint twice, the players sharing it are merged under that endpoint.</p>
 */
public final class MachinePerPlayer<P extends Player>
        implements Middleware<Scenario<ScenarioApi<PlayerConfigs, P>>, Scenario<ScenarioApi<MachineConfigs, P>>>
{
    private final MachineAllocator allocator;

    public MachinePerPlayer(MachineAllocator allocator)
    {
        this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    @Override
    public CompletableFuture<Void> apply(Runner<Scenario<ScenarioApi<MachineConfigs, P>>> run,
                                         Scenario<ScenarioApi<PlayerConfigs, P>> original)
    {
        return run.run(s -> original.run(ScenarioApis.<PlayerConfigs, P>withPlayers(s,
                (configs, start) -> allocate(configs).thenCompose(machines -> s.players(machines, start)))));
    }

    private CompletableFuture<MachineConfigs> allocate(PlayerConfigs configs)
    {
        List<String> names = new ArrayList<>(configs.players().keySet());
        List<CompletableFuture<String>> endpoints = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            endpoints.add(allocator.acquire());
        }

        return CompletableFuture.allOf(endpoints.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
            Map<String, PlayerConfigs> machines = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++) {
                String name = names.get(i);
                PlayerConfig config = configs.players().get(name);
                machines.merge(endpoints.get(i).join(), PlayerConfigs.of(name, config),
                        (existing, added) -> existing.with(name, config));
            }
            return new MachineConfigs(machines);
        });
    }
}
