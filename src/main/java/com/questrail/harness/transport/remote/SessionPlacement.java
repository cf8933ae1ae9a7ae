package com.questrail.harness.transport.remote;

import java.util.Objects;

/**
 * Process placement a remote control server hands out for one session.
 *
 * @param adminPort admin interface port the conductor should bind
 * @param appPort   application interface port to request
 * @param configDir working directory on the remote host
 */
public record SessionPlacement(int adminPort, int appPort, String configDir) {

    public SessionPlacement {
        Objects.requireNonNull(configDir, "configDir");
    }
}
