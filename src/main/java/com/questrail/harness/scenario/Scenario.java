package com.questrail.harness.scenario;

import java.util.concurrent.CompletableFuture;

/**
 * A scenario over one context object, typically a {@link ScenarioApi}.
 */
@FunctionalInterface
public interface Scenario<S>
{
    CompletableFuture<Void> run(S s);
}
