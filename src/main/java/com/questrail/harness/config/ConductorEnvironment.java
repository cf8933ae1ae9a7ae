package com.questrail.harness.config;

import com.questrail.harness.internal.exec.CallTimingPolicy;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Environment-level settings consumed by every conductor of a run.
 *
 * @param callTimeout        hard deadline for application function calls
 * @param softTimeoutRatio   soft deadline as a fraction of the hard deadline, in (0, 1]
 * @param stateDumpOnTimeout capture a cell state dump before failing a timed out call
 * @param legacyProtocol     conductors speak the legacy protocol; raw admin calls are disabled
 */
public record ConductorEnvironment(
    Duration callTimeout,
    double softTimeoutRatio,
    boolean stateDumpOnTimeout,
    boolean legacyProtocol
) {
    public static final String CALL_TIMEOUT_MS = "HARNESS_CALL_TIMEOUT_MS";
    public static final String STATE_DUMP_ON_TIMEOUT = "HARNESS_STATE_DUMP_ON_TIMEOUT";
    public static final String LEGACY_PROTOCOL = "HARNESS_LEGACY_PROTOCOL";

    public ConductorEnvironment {
        Objects.requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
        if (!(softTimeoutRatio > 0.0 && softTimeoutRatio <= 1.0)) {
            throw new IllegalArgumentException("softTimeoutRatio must be in (0, 1]: " + softTimeoutRatio);
        }
    }

    public static ConductorEnvironment defaults() {
        return builder().build();
    }

    /**
     * Reads the process environment.
     */
    public static ConductorEnvironment fromSystem() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads {@value #CALL_TIMEOUT_MS}, {@value #STATE_DUMP_ON_TIMEOUT} and
     * {@value #LEGACY_PROTOCOL}; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a present value cannot be parsed
     */
    public static ConductorEnvironment fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder builder = builder();

        String timeout = env.get(CALL_TIMEOUT_MS);
        if (timeout != null && !timeout.isBlank()) {
            try {
                builder.withCallTimeout(Duration.ofMillis(Long.parseLong(timeout.trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(CALL_TIMEOUT_MS + " is not a number: " + timeout, e);
            }
        }

        String dump = env.get(STATE_DUMP_ON_TIMEOUT);
        if (dump != null && !dump.isBlank()) {
            builder.withStateDumpOnTimeout(parseFlag(STATE_DUMP_ON_TIMEOUT, dump));
        }

        String legacy = env.get(LEGACY_PROTOCOL);
        if (legacy != null && !legacy.isBlank()) {
            builder.withLegacyProtocol(parseFlag(LEGACY_PROTOCOL, legacy));
        }
        return builder.build();
    }

    private static boolean parseFlag(String key, String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1":
            case "true":
            case "yes":
                return true;
            case "0":
            case "false":
            case "no":
                return false;
            default:
                throw new IllegalArgumentException(key + " is not a boolean flag: " + value);
        }
    }

    public CallTimingPolicy timingPolicy() {
        long softNanos = Math.max(1L, Math.round(callTimeout.toNanos() * softTimeoutRatio));
        return new CallTimingPolicy(callTimeout, Duration.ofNanos(softNanos), stateDumpOnTimeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration callTimeout = Duration.ofSeconds(60);
        private double softTimeoutRatio = 0.5;
        private boolean stateDumpOnTimeout = false;
        private boolean legacyProtocol = false;

        public Builder withCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder withSoftTimeoutRatio(double ratio) {
            this.softTimeoutRatio = ratio;
            return this;
        }

        public Builder withStateDumpOnTimeout(boolean enabled) {
            this.stateDumpOnTimeout = enabled;
            return this;
        }

        public Builder withLegacyProtocol(boolean enabled) {
            this.legacyProtocol = enabled;
            return this;
        }

        public ConductorEnvironment build() {
            return new ConductorEnvironment(callTimeout, softTimeoutRatio, stateDumpOnTimeout, legacyProtocol);
        }
    }
}
