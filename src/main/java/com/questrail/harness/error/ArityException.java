package com.questrail.harness.error;

/**
 * A middleware precondition on the shape of the scenario function was
 * violated. Raised before anything is registered or executed.
 */
public final class ArityException extends HarnessException
{
    public ArityException(String message) {
        super(message);
    }
}
