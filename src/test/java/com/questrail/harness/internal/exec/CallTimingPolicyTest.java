package com.questrail.harness.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallTimingPolicyTest {

    @Test
    void defaultsAreSixtySecondsHardThirtySoft() {
        CallTimingPolicy policy = CallTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(60), policy.hardTimeout());
        assertEquals(Duration.ofSeconds(30), policy.softTimeout());
        assertFalse(policy.stateDumpOnTimeout());
        assertTrue(policy.hasSoftDeadline());
    }

    @Test
    void softEqualToHardDisablesWarning() {
        CallTimingPolicy policy = new CallTimingPolicy(Duration.ofSeconds(5), Duration.ofSeconds(5), false);

        assertFalse(policy.hasSoftDeadline());
    }

    @Test
    void rejectsSoftAfterHard() {
        assertThrows(IllegalArgumentException.class,
                () -> new CallTimingPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), false));
    }

    @Test
    void rejectsNonPositiveTimeouts() {
        assertThrows(IllegalArgumentException.class,
                () -> new CallTimingPolicy(Duration.ZERO, Duration.ZERO, false));
        assertThrows(IllegalArgumentException.class,
                () -> CallTimingPolicy.withHardTimeout(Duration.ofMillis(-1)));
    }
}
