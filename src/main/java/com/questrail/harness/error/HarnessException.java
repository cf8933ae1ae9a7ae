package com.questrail.harness.error;

/**
 * Base type for every failure the harness reports to scenario code or to the
 * orchestrator. All subtypes propagate to the immediate caller.
 */
public class HarnessException extends RuntimeException
{
    public HarnessException(String message) {
        super(message);
    }

    public HarnessException(String message, Throwable cause) {
        super(message, cause);
    }
}
