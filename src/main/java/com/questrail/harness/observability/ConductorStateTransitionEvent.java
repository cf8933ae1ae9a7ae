package com.questrail.harness.observability;

import com.questrail.harness.api.ConductorState;

import java.time.Instant;

/**
 * Record representing a lifecycle transition of one conductor.
 */
public record ConductorStateTransitionEvent(
    Instant timestamp,
    String conductorName,
    ConductorState oldState,
    ConductorState newState
) {
}
