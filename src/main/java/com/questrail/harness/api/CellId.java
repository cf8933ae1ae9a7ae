package com.questrail.harness.api;

import java.util.Objects;

/**
 * Identity of one running cell: the DNA content hash paired with the agent
 * public key that runs it. Both halves are carried in their base64 wire form.
 */
public record CellId(String dnaHash, String agentKey) {

    public CellId {
        Objects.requireNonNull(dnaHash, "dnaHash");
        Objects.requireNonNull(agentKey, "agentKey");
    }

    @Override
    public String toString() {
        return "[" + dnaHash + ", " + agentKey + "]";
    }
}
