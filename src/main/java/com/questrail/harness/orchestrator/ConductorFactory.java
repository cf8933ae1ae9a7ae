package com.questrail.harness.orchestrator;

import com.questrail.harness.backend.BackendStrategy;
import com.questrail.harness.conductor.Conductor;
import com.questrail.harness.conductor.ProcessTerminator;

/**
 * Builds conductors wired to the run's shared scheduler, environment, sink
 * and consistency barrier. Spawners only decide the backend and how the
 * process ends.
 */
@FunctionalInterface
public interface ConductorFactory
{
    Conductor create(String name, BackendStrategy backend, ProcessTerminator terminator);
}
