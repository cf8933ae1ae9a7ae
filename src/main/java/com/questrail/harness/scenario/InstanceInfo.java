package com.questrail.harness.scenario;

import com.questrail.harness.api.CellId;

import java.util.Objects;

/**
 * Where one of a player's instances ended up after install.
 */
public record InstanceInfo(String instanceId, String appId, String agentKey, CellId cellId) {

    public InstanceInfo {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(appId, "appId");
        Objects.requireNonNull(agentKey, "agentKey");
        Objects.requireNonNull(cellId, "cellId");
    }
}
