package com.questrail.harness.util;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

public final class Futures {

    private Futures() {
    }

    /**
     * Strips the {@link CompletionException} / {@link ExecutionException}
     * wrappers that future composition adds.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Runs {@code step}, turning a synchronous throw or a {@code null} result
     * into a failed future.
     */
    public static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> step) {
        try {
            return Objects.requireNonNull(step.get(), "step returned null");
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
