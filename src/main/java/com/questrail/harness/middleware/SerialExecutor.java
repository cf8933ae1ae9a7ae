package com.questrail.harness.middleware;

import java.util.concurrent.CompletableFuture;

/**
 * Runs the scenarios it wraps one after another.
 *
 * <p>Each scenario starts only after the previous one wrapped by the same
 * instance has settled, successfully or not. The chain lives in this
 * instance: create one per run and do not share it between runs that should
 * be independent.</p>
 */
public final class SerialExecutor<A> implements Middleware<A, A>
{
    private final Object lock = new Object();
    private CompletableFuture<Void> last = CompletableFuture.completedFuture(null);

    @Override
    public CompletableFuture<Void> apply(Runner<A> run, A original)
    {
        CompletableFuture<Void> result;
        synchronized (lock) {
            result = last
                    .handle((ignored, error) -> null)
                    .thenCompose(ignored -> run.run(original));
            last = result.<Void>handle((ignored, error) -> null);
        }
        return result;
    }
}
