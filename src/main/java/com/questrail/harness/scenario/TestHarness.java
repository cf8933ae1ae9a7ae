package com.questrail.harness.scenario;

/**
 * The test framework scenarios are reported to.
 */
@FunctionalInterface
public interface TestHarness
{
    /**
     * Register a new case named {@code description}.
     */
    TestCase register(String description);
}
