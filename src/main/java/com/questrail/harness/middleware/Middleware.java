package com.questrail.harness.middleware;

import java.util.concurrent.CompletableFuture;

/**
 * Middleware
 * =============================================================================
 * Decorates scenario functions. Given the runner for scenarios of shape
 * {@code B} and a scenario of shape {@code A}, a middleware builds a
 * {@code B}-shaped scenario around the original and hands it to the runner.
 *
 * <p>Exposing the runner lets a middleware set up context outside the
 * scenario itself, such as registering a test case before anything runs.</p>
 *
 * <p>Middlewares are chained with {@link Middlewares#compose}.</p>
 *
 * @param <A> the scenario shape the author writes against
 * @param <B> the scenario shape passed on towards the orchestrator
 */
@FunctionalInterface
public interface Middleware<A, B>
{
    CompletableFuture<Void> apply(Runner<B> run, A original);
}
