package com.questrail.harness.conductor;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Ends the process behind a conductor. Supplied by whoever spawned it: a
 * local subprocess handle or a remote control session.
 */
@FunctionalInterface
public interface ProcessTerminator
{
    /** For conductors whose process is owned elsewhere. */
    ProcessTerminator NONE = signal -> CompletableFuture.completedFuture(null);

    /**
     * @param signal optional signal name (e.g. {@code SIGTERM}); the
     *               terminator's default applies when empty
     * @return completes once the process is gone
     */
    CompletableFuture<Void> terminate(Optional<String> signal);
}
