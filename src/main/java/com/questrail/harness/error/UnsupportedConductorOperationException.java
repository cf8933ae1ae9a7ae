package com.questrail.harness.error;

/**
 * The operation is disabled for the current backend, protocol mode, or
 * middleware policy. Raised instead of attempting the operation.
 */
public final class UnsupportedConductorOperationException extends HarnessException
{
    public UnsupportedConductorOperationException(String message) {
        super(message);
    }
}
