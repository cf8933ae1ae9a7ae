package com.questrail.harness.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Per-process values a conductor config is generated from.
 *
 * @param adminPort     admin interface port the conductor binds
 * @param appPort       application interface port to request; 0 means any
 * @param configDir     working directory holding the config and the conductor's data
 * @param uuid          run-unique id, used to keep networks of different runs apart
 * @param conductorName conductor (player) name
 */
public record ConfigSeedArgs(int adminPort, int appPort, Path configDir, String uuid, String conductorName) {

    public ConfigSeedArgs {
        Objects.requireNonNull(configDir, "configDir");
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(conductorName, "conductorName");
        if (adminPort <= 0 || adminPort > 65535) {
            throw new IllegalArgumentException("adminPort out of range: " + adminPort);
        }
        if (appPort < 0 || appPort > 65535) {
            throw new IllegalArgumentException("appPort out of range: " + appPort);
        }
    }
}
