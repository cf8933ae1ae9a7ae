package com.questrail.harness.scenario;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollectingTestHarnessTest {

    @Test
    void casePassesUntilSomethingFails() {
        CollectingTestHarness harness = new CollectingTestHarness();
        TestCase c = harness.register("gossip reaches bob");

        c.ok(true, "never recorded");
        c.equal(2, 1 + 1, "never recorded");
        c.end();
        assertTrue(harness.allPassed());

        c.equal("hello", "bye", "greeting");
        CollectingTestHarness.Case recorded = harness.find("gossip reaches bob").orElseThrow();
        assertFalse(recorded.passed());
        assertEquals(List.of("greeting: expected <hello> but was <bye>"), recorded.failures());
        assertFalse(harness.allPassed());
    }

    @Test
    void unfinishedCaseDoesNotCountAsPassed() {
        CollectingTestHarness harness = new CollectingTestHarness();
        harness.register("one").end();
        harness.register("two");

        assertFalse(harness.allPassed());
        assertEquals(2, harness.cases().size());
        assertTrue(harness.find("three").isEmpty());
    }
}
