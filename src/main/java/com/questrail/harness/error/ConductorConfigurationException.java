package com.questrail.harness.error;

/**
 * A conductor was asked to do something its configuration can never support,
 * such as initializing a stub backend.
 */
public final class ConductorConfigurationException extends HarnessException
{
    public ConductorConfigurationException(String message) {
        super(message);
    }
}
