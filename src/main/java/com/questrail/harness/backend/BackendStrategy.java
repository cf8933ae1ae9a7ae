package com.questrail.harness.backend;

import java.util.Objects;

/**
 * BackendStrategy
 * =============================================================================
 * How a conductor's admin and application channels are reached. Exactly one
 * variant is active for a conductor's whole lifetime.
 *
 * <h2>Exhaustive dispatch</h2>
 * Sites that behave differently per variant go through {@link #accept(Visitor)}.
 * Adding a variant adds a method to {@link Visitor}, which breaks every such
 * site at compile time until it handles the new variant.
 */
public sealed interface BackendStrategy
        permits BackendStrategy.Local, BackendStrategy.Tunneled, BackendStrategy.Stub
{
    <R> R accept(Visitor<R> visitor);

    interface Visitor<R>
    {
        R visitLocal(Local local);

        R visitTunneled(Tunneled tunneled);

        R visitStub(Stub stub);
    }

    /**
     * Direct WebSocket connections to a process on a reachable host.
     *
     * @param host      host name or address
     * @param adminPort admin interface port
     * @param appPort   application interface port to request; 0 means any free port
     */
    record Local(String host, int adminPort, int appPort) implements BackendStrategy {
        public Local {
            Objects.requireNonNull(host, "host");
            if (adminPort <= 0 || adminPort > 65535) {
                throw new IllegalArgumentException("adminPort out of range: " + adminPort);
            }
            if (appPort < 0 || appPort > 65535) {
                throw new IllegalArgumentException("appPort out of range: " + appPort);
            }
        }

        public static Local of(String host, int adminPort) {
            return new Local(host, adminPort, 0);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLocal(this);
        }
    }

    /**
     * All traffic multiplexed through a remote control server.
     */
    record Tunneled(TunnelRpc rpc) implements BackendStrategy {
        public Tunneled {
            Objects.requireNonNull(rpc, "rpc");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTunneled(this);
        }
    }

    /**
     * No live channel. A conductor with this backend can be named, observed
     * and killed, but never initialized.
     */
    record Stub() implements BackendStrategy {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStub(this);
        }
    }
}
