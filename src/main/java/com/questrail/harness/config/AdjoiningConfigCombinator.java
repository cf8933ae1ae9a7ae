package com.questrail.harness.config;

import com.questrail.harness.api.DnaDeclaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Concatenates every player's instances, renaming each to
 * {@code player::instance} (see {@link InstanceNamespace}).
 */
public final class AdjoiningConfigCombinator implements ConfigCombinator
{
    public static final AdjoiningConfigCombinator INSTANCE = new AdjoiningConfigCombinator();

    private AdjoiningConfigCombinator() {
    }

    @Override
    public PlayerConfig combine(PlayerConfigs players)
    {
        if (players.players().isEmpty()) {
            throw new IllegalArgumentException("Nothing to combine: no players");
        }
        List<DnaDeclaration> merged = new ArrayList<>();
        players.players().forEach((player, config) ->
                merged.addAll(config.renamed(id -> InstanceNamespace.adjoin(player, id)).instances()));
        return new PlayerConfig(merged, Optional.empty());
    }
}
