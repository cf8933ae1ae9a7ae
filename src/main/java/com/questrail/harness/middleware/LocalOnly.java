package com.questrail.harness.middleware;

import com.questrail.harness.config.MachineConfigs;
import com.questrail.harness.config.PlayerConfigs;
import com.questrail.harness.scenario.Player;
import com.questrail.harness.scenario.Scenario;
import com.questrail.harness.scenario.ScenarioApi;
import com.questrail.harness.scenario.ScenarioApis;

import java.util.concurrent.CompletableFuture;

/**
 * Lets scenarios declare players without machines: every player runs on the
 * {@link MachineConfigs#LOCAL} machine.
 */
public final class LocalOnly<P extends Player>
        implements Middleware<Scenario<ScenarioApi<PlayerConfigs, P>>, Scenario<ScenarioApi<MachineConfigs, P>>>
{
    @Override
    public CompletableFuture<Void> apply(Runner<Scenario<ScenarioApi<MachineConfigs, P>>> run,
                                         Scenario<ScenarioApi<PlayerConfigs, P>> original)
    {
        return run.run(s -> original.run(ScenarioApis.<PlayerConfigs, P>withPlayers(s,
                (configs, start) -> s.players(MachineConfigs.local(configs), start))));
    }
}
