package com.questrail.harness.config;

import java.util.Objects;

/**
 * Qualifies instance ids with their player's name so that several players can
 * share one conductor.
 *
 * <p>{@code adjoin("alice", "X")} is {@code "alice::X"}. Player names may not
 * contain {@link #SEPARATOR}, which keeps the mapping injective.</p>
 */
public final class InstanceNamespace
{
    public static final String SEPARATOR = "::";

    private InstanceNamespace() {
    }

    public static String adjoin(String player, String instanceId)
    {
        requireValidPlayer(player);
        Objects.requireNonNull(instanceId, "instanceId");
        return player + SEPARATOR + instanceId;
    }

    public static void requireValidPlayer(String player)
    {
        Objects.requireNonNull(player, "player");
        if (player.isEmpty() || player.contains(SEPARATOR)) {
            throw new IllegalArgumentException(
                    "Player name must be non-empty and must not contain '" + SEPARATOR + "': " + player);
        }
    }
}
