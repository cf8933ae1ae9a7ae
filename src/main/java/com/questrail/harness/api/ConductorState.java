package com.questrail.harness.api;

/**
 * ConductorState
 * -----------------------------------------------------------------------------
 * Lifecycle state of a single managed conductor.
 *
 * <pre>
 *   UNINITIALIZED ──initialize()──▶ CONNECTING ──channels up──▶ CONNECTED
 *                                        │                          │
 *                                        └──setup failed──▶ KILLED ◀┘ kill()
 * </pre>
 *
 * {@link #KILLED} is terminal. A conductor is never reconnected; a new one is
 * created instead.
 */
public enum ConductorState
{
    /** Constructed; no channel has been opened. */
    UNINITIALIZED,

    /** Admin and/or application channel setup is in progress. */
    CONNECTING,

    /** Both channels are live; install and call operations are permitted. */
    CONNECTED,

    /** Torn down, either explicitly or because connection setup failed. */
    KILLED;

    /**
     * Whether {@code next} is a legal successor of this state.
     */
    public boolean canTransitionTo(ConductorState next) {
        return switch (this) {
            case UNINITIALIZED -> next == CONNECTING || next == KILLED;
            case CONNECTING -> next == CONNECTED || next == KILLED;
            case CONNECTED -> next == KILLED;
            case KILLED -> false;
        };
    }
}
