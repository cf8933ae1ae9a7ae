package com.questrail.harness.scenario;

import java.util.concurrent.CompletableFuture;

/**
 * A scenario that also receives a second context, such as a {@link TestCase}
 * to assert against.
 */
@FunctionalInterface
public interface Scenario2<S, T>
{
    CompletableFuture<Void> run(S s, T t);
}
