package com.questrail.harness.middleware;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.config.AdjoiningConfigCombinator;
import com.questrail.harness.config.ConfigCombinator;
import com.questrail.harness.config.InstanceNamespace;
import com.questrail.harness.config.MachineConfigs;
import com.questrail.harness.config.PlayerConfig;
import com.questrail.harness.config.PlayerConfigs;
import com.questrail.harness.error.HarnessException;
import com.questrail.harness.error.UnsupportedConductorOperationException;
import com.questrail.harness.scenario.InstanceInfo;
import com.questrail.harness.scenario.Player;
import com.questrail.harness.scenario.Scenario;
import com.questrail.harness.scenario.ScenarioApi;
import com.questrail.harness.scenario.ScenarioApis;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * SingleConductor
 * =============================================================================
 * Runs every declared player, across all machines, inside one conductor on
 * the local machine.
 *
 * <p>The players' configurations are merged by a {@link ConfigCombinator}
 * (by default each instance becomes {@code player::instance}). The scenario
 * still receives one handle per declared player; each translates instance
 * ids into its own namespace before delegating to the shared conductor's
 * player. Because there is only one process, {@code spawn} and {@code kill}
 * on these handles fail with {@link UnsupportedConductorOperationException}.</p>
 */
public final class SingleConductor
        implements Middleware<Scenario<ScenarioApi<MachineConfigs, Player>>, Scenario<ScenarioApi<MachineConfigs, Player>>>
{
    static final String COMBINED_PLAYER = "combined";

    private final ConfigCombinator combinator;

    public SingleConductor()
    {
        this(AdjoiningConfigCombinator.INSTANCE);
    }

    public SingleConductor(ConfigCombinator combinator)
    {
        this.combinator = Objects.requireNonNull(combinator, "combinator");
    }

    @Override
    public CompletableFuture<Void> apply(Runner<Scenario<ScenarioApi<MachineConfigs, Player>>> run,
                                         Scenario<ScenarioApi<MachineConfigs, Player>> original)
    {
        return run.run(s -> original.run(ScenarioApis.<MachineConfigs, Player>withPlayers(s,
                (machines, start) -> players(s, machines))));
    }

    private CompletableFuture<Map<String, Player>> players(ScenarioApi<MachineConfigs, Player> s, MachineConfigs machines)
    {
        PlayerConfigs all;
        PlayerConfig combined;
        try {
            all = machines.allPlayers();
            all.players().keySet().forEach(InstanceNamespace::requireValidPlayer);
            combined = combinator.combine(all);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        return s.players(MachineConfigs.local(PlayerConfigs.of(COMBINED_PLAYER, combined)), true)
                .thenApply(spawned -> {
                    Player shared = spawned.get(COMBINED_PLAYER);
                    if (shared == null) {
                        throw new HarnessException("No '" + COMBINED_PLAYER + "' player was created");
                    }
                    Map<String, Player> handles = new LinkedHashMap<>();
                    for (String name : all.players().keySet()) {
                        handles.put(name, new NamespacedPlayer(name, shared));
                    }
                    return handles;
                });
    }

    static final class NamespacedPlayer implements Player
    {
        private final String name;
        private final Player shared;

        NamespacedPlayer(String name, Player shared)
        {
            this.name = name;
            this.shared = shared;
        }

        @Override
        public String name()
        {
            return name;
        }

        @Override
        public CompletableFuture<JsonNode> call(String instanceId, String zome, String fn, Object payload)
        {
            return shared.call(InstanceNamespace.adjoin(name, instanceId), zome, fn, payload);
        }

        @Override
        public InstanceInfo instance(String instanceId)
        {
            return shared.instance(InstanceNamespace.adjoin(name, instanceId));
        }

        @Override
        public CompletableFuture<JsonNode> admin(String method, JsonNode params)
        {
            return shared.admin(method, params);
        }

        @Override
        public CompletableFuture<Void> spawn()
        {
            return CompletableFuture.failedFuture(
                    new UnsupportedConductorOperationException("player.spawn is disabled by singleConductor middleware"));
        }

        @Override
        public CompletableFuture<Void> kill()
        {
            return CompletableFuture.failedFuture(
                    new UnsupportedConductorOperationException("player.kill is disabled by singleConductor middleware"));
        }
    }
}
