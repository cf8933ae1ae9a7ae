package com.questrail.harness.middleware;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.harness.scenario.InstanceInfo;
import com.questrail.harness.scenario.Player;
import com.questrail.harness.scenario.Scenario;
import com.questrail.harness.scenario.ScenarioApi;
import com.questrail.harness.scenario.ScenarioApis;
import com.questrail.harness.scenario.SyncPlayer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Gives every player handle {@link SyncPlayer#callSync}: the call, followed by
 * the scenario's consistency barrier.
 */
public final class CallSync<C, P extends Player>
        implements Middleware<Scenario<ScenarioApi<C, SyncPlayer>>, Scenario<ScenarioApi<C, P>>>
{
    @Override
    public CompletableFuture<Void> apply(Runner<Scenario<ScenarioApi<C, P>>> run,
                                         Scenario<ScenarioApi<C, SyncPlayer>> original)
    {
        return run.run(s -> original.run(ScenarioApis.<C, SyncPlayer>withPlayers(s,
                (configs, start) -> s.players(configs, start).thenApply(players -> {
                    Map<String, SyncPlayer> synced = new LinkedHashMap<>();
                    players.forEach((name, player) -> synced.put(name, new Synced(player, s)));
                    return synced;
                }))));
    }

    private static final class Synced implements SyncPlayer
    {
        private final Player player;
        private final ScenarioApi<?, ?> api;

        Synced(Player player, ScenarioApi<?, ?> api)
        {
            this.player = player;
            this.api = api;
        }

        @Override
        public CompletableFuture<JsonNode> callSync(String instanceId, String zome, String fn, Object payload)
        {
            return player.call(instanceId, zome, fn, payload)
                    .thenCompose(result -> api.consistency().thenApply(ignored -> result));
        }

        @Override
        public String name()
        {
            return player.name();
        }

        @Override
        public CompletableFuture<JsonNode> call(String instanceId, String zome, String fn, Object payload)
        {
            return player.call(instanceId, zome, fn, payload);
        }

        @Override
        public InstanceInfo instance(String instanceId)
        {
            return player.instance(instanceId);
        }

        @Override
        public CompletableFuture<JsonNode> admin(String method, JsonNode params)
        {
            return player.admin(method, params);
        }

        @Override
        public CompletableFuture<Void> spawn()
        {
            return player.spawn();
        }

        @Override
        public CompletableFuture<Void> kill()
        {
            return player.kill();
        }
    }
}
