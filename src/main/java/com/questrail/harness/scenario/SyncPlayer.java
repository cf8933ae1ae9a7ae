package com.questrail.harness.scenario;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * A {@link Player} that can also wait for the network to settle after a call.
 */
public interface SyncPlayer extends Player
{
    /**
     * Like {@link #call}, but completes only after the consistency barrier
     * that follows the call has completed.
     */
    CompletableFuture<JsonNode> callSync(String instanceId, String zome, String fn, Object payload);
}
