package com.questrail.harness.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Machine endpoint to the players that run on it.
 *
 * <p>The endpoint is opaque here: {@link #LOCAL} for this host, otherwise
 * whatever address a machine allocator handed out.</p>
 */
public record MachineConfigs(Map<String, PlayerConfigs> machines) {

    public static final String LOCAL = "local";

    public MachineConfigs {
        Objects.requireNonNull(machines, "machines");
        machines = Collections.unmodifiableMap(new LinkedHashMap<>(machines));
    }

    public static MachineConfigs local(PlayerConfigs players) {
        return new MachineConfigs(Map.of(LOCAL, players));
    }

    /**
     * Every player of every machine. Player names must be unique across machines.
     */
    public PlayerConfigs allPlayers() {
        Map<String, PlayerConfig> all = new LinkedHashMap<>();
        machines.forEach((endpoint, players) -> players.players().forEach((name, config) -> {
            if (all.putIfAbsent(name, config) != null) {
                throw new IllegalArgumentException("Player '" + name + "' is declared on more than one machine");
            }
        }));
        return new PlayerConfigs(all);
    }
}
