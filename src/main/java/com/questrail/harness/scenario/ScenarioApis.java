package com.questrail.harness.scenario;

import com.questrail.harness.config.GlobalConfig;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

/**
 * Helpers for middlewares that adapt a {@link ScenarioApi}.
 */
public final class ScenarioApis
{
    private ScenarioApis() {
    }

    /**
     * A view of {@code base} whose {@code players} is replaced; everything
     * else is delegated.
     */
    public static <C, P extends Player> ScenarioApi<C, P> withPlayers(
            ScenarioApi<?, ?> base,
            BiFunction<C, Boolean, CompletableFuture<Map<String, P>>> players)
    {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(players, "players");

        return new ScenarioApi<>() {
            @Override
            public String description()
            {
                return base.description();
            }

            @Override
            public CompletableFuture<Map<String, P>> players(C configs, boolean start)
            {
                return players.apply(configs, start);
            }

            @Override
            public CompletableFuture<Void> consistency()
            {
                return base.consistency();
            }

            @Override
            public GlobalConfig globalConfig()
            {
                return base.globalConfig();
            }
        };
    }
}
