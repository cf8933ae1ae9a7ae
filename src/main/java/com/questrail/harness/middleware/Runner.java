package com.questrail.harness.middleware;

import java.util.concurrent.CompletableFuture;

/**
 * Executes a scenario function of shape {@code B}. Supplied by the
 * orchestrator, handed through the middleware chain.
 */
@FunctionalInterface
public interface Runner<B>
{
    CompletableFuture<Void> run(B scenario);
}
