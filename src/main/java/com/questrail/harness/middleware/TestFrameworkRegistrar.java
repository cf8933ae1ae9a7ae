package com.questrail.harness.middleware;

import com.questrail.harness.error.ArityException;
import com.questrail.harness.scenario.Scenario;
import com.questrail.harness.scenario.Scenario2;
import com.questrail.harness.scenario.ScenarioApi;
import com.questrail.harness.scenario.TestCase;
import com.questrail.harness.scenario.TestHarness;
import com.questrail.harness.util.Futures;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Registers each scenario as one test case and passes it to the scenario as
 * a second argument.
 *
 * <p>The scenario must be a {@link Scenario2}; anything else fails with
 * {@link ArityException} before a case is registered. When the scenario
 * fails, the failure and its stack trace (joined onto one line) are recorded
 * against its case, the case is ended, and the returned future fails with the
 * same cause so the orchestrator can count it. Sibling scenarios are not
 * affected.</p>
 *
 * <p>Place this first in a chain: it is the only middleware that sees the
 * author's two-argument function.</p>
 */
public final class TestFrameworkRegistrar<S extends ScenarioApi<?, ?>> implements Middleware<Object, Scenario<S>>
{
    private final TestHarness harness;

    public TestFrameworkRegistrar(TestHarness harness)
    {
        this.harness = Objects.requireNonNull(harness, "harness");
    }

    @Override
    public CompletableFuture<Void> apply(Runner<Scenario<S>> run, Object original)
    {
        if (!(original instanceof Scenario2)) {
            return CompletableFuture.failedFuture(new ArityException(
                    "The test framework registrar requires scenarios taking two arguments (api, test case); got "
                            + (original == null ? "null" : original.getClass().getName())));
        }
        @SuppressWarnings("unchecked")
        Scenario2<S, TestCase> scenario = (Scenario2<S, TestCase>) original;

        return run.run(s -> {
            TestCase t = harness.register(s.description());

            CompletableFuture<Void> outcome;
            try {
                outcome = Objects.requireNonNull(scenario.run(s, t), "scenario returned null");
            } catch (RuntimeException | AssertionError e) {
                outcome = CompletableFuture.failedFuture(e);
            }

            return outcome.<Void>handle((ignored, error) -> {
                if (error == null) {
                    t.end();
                    return null;
                }
                Throwable cause = Futures.unwrap(error);
                t.fail(flattenStackTrace(cause));
                t.end();
                throw new CompletionException(cause);
            });
        });
    }

    static String flattenStackTrace(Throwable error)
    {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString().trim().replaceAll("\\s*\\R\\s*", "; ");
    }
}
