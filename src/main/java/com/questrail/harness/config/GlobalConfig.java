package com.questrail.harness.config;

import java.util.Map;
import java.util.Objects;

/**
 * Run-wide settings written into every generated conductor config.
 *
 * @param networkTransport network transport name, e.g. {@code quic}
 * @param logLevel         conductor log filter, e.g. {@code warn}
 * @param extra            additional top-level conductor config entries, passed through as is
 */
public record GlobalConfig(String networkTransport, String logLevel, Map<String, Object> extra) {

    public GlobalConfig {
        Objects.requireNonNull(networkTransport, "networkTransport");
        Objects.requireNonNull(logLevel, "logLevel");
        extra = Map.copyOf(Objects.requireNonNull(extra, "extra"));
    }

    public static GlobalConfig defaults() {
        return new GlobalConfig("quic", "warn", Map.of());
    }

    public GlobalConfig withLogLevel(String logLevel) {
        return new GlobalConfig(networkTransport, logLevel, extra);
    }
}
