package com.questrail.harness.middleware;

import java.util.concurrent.CompletableFuture;

/**
 * Hands out machine endpoints (remote control server URLs) for players.
 */
@FunctionalInterface
public interface MachineAllocator
{
    CompletableFuture<String> acquire();
}
