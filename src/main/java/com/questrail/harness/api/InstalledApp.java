package com.questrail.harness.api;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * InstalledApp
 * -----------------------------------------------------------------------------
 * Result of a successful install-and-enable sequence. Immutable; the cell list
 * keeps the order in which the conductor reported the cells.
 */
public record InstalledApp(String appId, String agentKey, List<InstalledCell> cells) {

    public InstalledApp {
        Objects.requireNonNull(appId, "appId");
        Objects.requireNonNull(agentKey, "agentKey");
        cells = List.copyOf(Objects.requireNonNull(cells, "cells"));

        Set<String> nicks = new LinkedHashSet<>();
        for (InstalledCell cell : cells) {
            if (!nicks.add(cell.nick())) {
                throw new IllegalArgumentException("Duplicate cell nickname in app " + appId + ": " + cell.nick());
            }
        }
    }

    public Optional<InstalledCell> cell(String nick) {
        return cells.stream().filter(c -> c.nick().equals(nick)).findFirst();
    }
}
