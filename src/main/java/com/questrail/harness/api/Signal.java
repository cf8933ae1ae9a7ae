package com.questrail.harness.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Out-of-band push message from a conductor's application channel.
 *
 * @param kind    discriminator; only {@link #CONSISTENCY} is acted on internally
 * @param cellId  originating cell, as reported by the conductor (may be {@code null})
 * @param payload kind-specific body
 */
public record Signal(String kind, CellId cellId, JsonNode payload) {

    public static final String CONSISTENCY = "consistency";

    public Signal {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
    }

    public boolean isConsistency() {
        return CONSISTENCY.equals(kind);
    }
}
