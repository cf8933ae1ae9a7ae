package com.questrail.harness.orchestrator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one orchestrator run.
 *
 * @param successes number of scenarios that completed normally
 * @param errors    failure cause per scenario description, in registration order
 */
public record OrchestratorStats(int successes, Map<String, Throwable> errors) {

    public OrchestratorStats {
        Objects.requireNonNull(errors, "errors");
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public int total() {
        return successes + errors.size();
    }

    public boolean allPassed() {
        return errors.isEmpty();
    }
}
