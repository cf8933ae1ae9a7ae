package com.questrail.harness.orchestrator;

import com.questrail.harness.conductor.Conductor;
import com.questrail.harness.config.GlobalConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Starts conductor processes on one machine.
 */
public interface ConductorSpawner
{
    /**
     * Start a conductor process for {@code playerName}.
     *
     * @return a conductor for the new process, not yet initialized
     */
    CompletableFuture<Conductor> spawn(String playerName, GlobalConfig global, ConductorFactory factory);

    /**
     * Release what this spawner holds for the machine, such as a control
     * session. Called once, when the run is over.
     */
    default CompletableFuture<Void> close()
    {
        return CompletableFuture.completedFuture(null);
    }
}
