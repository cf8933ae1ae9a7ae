package com.questrail.harness.scenario;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Handle a scenario uses to drive one player.
 *
 * <p>Instance ids are the ids declared in the player's configuration.
 * Middlewares may hand out handles that translate ids or refuse some
 * operations.</p>
 */
public interface Player
{
    String name();

    /**
     * Call {@code zome}/{@code fn} on the cell running {@code instanceId}.
     */
    CompletableFuture<JsonNode> call(String instanceId, String zome, String fn, Object payload);

    /**
     * @throws com.questrail.harness.error.UnknownCellException if the instance is not installed
     */
    InstanceInfo instance(String instanceId);

    CompletableFuture<JsonNode> admin(String method, JsonNode params);

    /**
     * Start the player's conductor and install its instances.
     */
    CompletableFuture<Void> spawn();

    CompletableFuture<Void> kill();
}
