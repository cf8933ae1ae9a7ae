package com.questrail.harness.scenario;

import java.util.Objects;

/**
 * One registered test case: the assertion context a two-argument scenario
 * receives.
 */
public interface TestCase
{
    String description();

    /**
     * Record a failure. The case keeps running.
     */
    void fail(String message);

    /**
     * Mark the case complete. Later calls are ignored.
     */
    void end();

    default void ok(boolean condition, String message)
    {
        if (!condition) {
            fail(message);
        }
    }

    default void equal(Object expected, Object actual, String message)
    {
        if (!Objects.equals(expected, actual)) {
            fail(message + ": expected <" + expected + "> but was <" + actual + ">");
        }
    }
}
