package com.questrail.harness.scenario;

import java.util.concurrent.CompletableFuture;

/**
 * Waits until state propagated between cells has settled.
 */
@FunctionalInterface
public interface ConsistencyBarrier
{
    CompletableFuture<Void> await();
}
