package com.questrail.harness.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Player name to player configuration, in declaration order.
 */
public record PlayerConfigs(Map<String, PlayerConfig> players) {

    public PlayerConfigs {
        Objects.requireNonNull(players, "players");
        players.forEach((name, config) -> {
            Objects.requireNonNull(name, "player name");
            Objects.requireNonNull(config, "config of " + name);
        });
        players = Collections.unmodifiableMap(new LinkedHashMap<>(players));
    }

    public static PlayerConfigs of(String name, PlayerConfig config) {
        return new PlayerConfigs(Map.of(name, config));
    }

    public static PlayerConfigs of(String name1, PlayerConfig config1, String name2, PlayerConfig config2) {
        Map<String, PlayerConfig> players = new LinkedHashMap<>();
        players.put(name1, config1);
        players.put(name2, config2);
        return new PlayerConfigs(players);
    }

    public PlayerConfigs with(String name, PlayerConfig config) {
        Map<String, PlayerConfig> players = new LinkedHashMap<>(this.players);
        if (players.putIfAbsent(name, config) != null) {
            throw new IllegalArgumentException("Duplicate player: " + name);
        }
        return new PlayerConfigs(players);
    }

    public int size() {
        return players.size();
    }
}
