package com.questrail.harness.scenario;

import com.questrail.harness.config.GlobalConfig;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The object a scenario receives.
 *
 * @param <C> how players are configured, e.g.
 *            {@link com.questrail.harness.config.MachineConfigs} or
 *            {@link com.questrail.harness.config.PlayerConfigs}
 * @param <P> the player handle type handed back
 */
public interface ScenarioApi<C, P extends Player>
{
    String description();

    /**
     * Create the configured players.
     *
     * @param start spawn every player before completing
     * @return player name to handle
     */
    CompletableFuture<Map<String, P>> players(C configs, boolean start);

    /**
     * Wait until the network of this scenario has settled.
     */
    CompletableFuture<Void> consistency();

    GlobalConfig globalConfig();
}
