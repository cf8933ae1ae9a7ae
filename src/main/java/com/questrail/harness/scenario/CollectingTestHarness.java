package com.questrail.harness.scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TestHarness} that keeps every case and its failures in memory.
 * Thread-safe; cases of concurrently running scenarios may interleave.
 */
public final class CollectingTestHarness implements TestHarness
{
    private final List<Case> cases = new CopyOnWriteArrayList<>();

    @Override
    public Case register(String description)
    {
        Case c = new Case(description);
        cases.add(c);
        return c;
    }

    public List<Case> cases()
    {
        return Collections.unmodifiableList(cases);
    }

    public Optional<Case> find(String description)
    {
        return cases.stream().filter(c -> c.description().equals(description)).findFirst();
    }

    public boolean allPassed()
    {
        return cases.stream().allMatch(c -> c.ended() && c.passed());
    }

    public static final class Case implements TestCase
    {
        private final String description;
        private final List<String> failures = new CopyOnWriteArrayList<>();
        private final AtomicBoolean ended = new AtomicBoolean(false);

        private Case(String description)
        {
            this.description = description;
        }

        @Override
        public String description()
        {
            return description;
        }

        @Override
        public void fail(String message)
        {
            failures.add(message);
        }

        @Override
        public void end()
        {
            ended.set(true);
        }

        public boolean ended()
        {
            return ended.get();
        }

        public boolean passed()
        {
            return failures.isEmpty();
        }

        public List<String> failures()
        {
            return new ArrayList<>(failures);
        }

        @Override
        public String toString()
        {
            return "Case[" + description + (passed() ? ", passed" : ", failures=" + failures) + "]";
        }
    }
}
