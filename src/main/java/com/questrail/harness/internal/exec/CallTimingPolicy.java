package com.questrail.harness.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * CallTimingPolicy
 * -----------------------------------------------------------------------------
 * Deadlines applied to every application function call.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>hardTimeout</b>: the call is abandoned locally and fails with
 *       {@code CallTimeoutException}. The remote call is not cancelled.</li>
 *   <li><b>softTimeout</b>: a still-waiting warning is emitted and the call
 *       continues. When equal to the hard timeout no warning is armed.</li>
 *   <li><b>stateDumpOnTimeout</b>: before failing a timed out call, ask the
 *       admin channel for a state dump of the target cell and log it. The
 *       dump is awaited for at most {@link #stateDumpTimeout()}.</li>
 * </ul>
 */
public record CallTimingPolicy(
        Duration hardTimeout,
        Duration softTimeout,
        boolean stateDumpOnTimeout
) {
    public CallTimingPolicy {
        Objects.requireNonNull(hardTimeout, "hardTimeout");
        Objects.requireNonNull(softTimeout, "softTimeout");

        if (hardTimeout.isNegative() || hardTimeout.isZero()) {
            throw new IllegalArgumentException("hardTimeout must be positive");
        }
        if (softTimeout.isNegative() || softTimeout.isZero()) {
            throw new IllegalArgumentException("softTimeout must be positive");
        }
        if (softTimeout.compareTo(hardTimeout) > 0) {
            throw new IllegalArgumentException("softTimeout must not exceed hardTimeout");
        }
    }

    /**
     * Soft deadline at half the hard deadline, no state dump.
     */
    public static CallTimingPolicy withHardTimeout(Duration hardTimeout) {
        Objects.requireNonNull(hardTimeout, "hardTimeout");
        Duration soft = hardTimeout.dividedBy(2);
        return new CallTimingPolicy(hardTimeout, soft.isZero() ? hardTimeout : soft, false);
    }

    /**
     * 60 s hard deadline, 30 s soft deadline, no state dump.
     */
    public static CallTimingPolicy defaults() {
        return withHardTimeout(Duration.ofSeconds(60));
    }

    public CallTimingPolicy withStateDumpOnTimeout(boolean enabled) {
        return new CallTimingPolicy(hardTimeout, softTimeout, enabled);
    }

    /**
     * How long a timed out call waits for its state dump before failing
     * without one. Equal to the soft timeout.
     */
    public Duration stateDumpTimeout() {
        return softTimeout;
    }

    public boolean hasSoftDeadline() {
        return softTimeout.compareTo(hardTimeout) < 0;
    }
}
