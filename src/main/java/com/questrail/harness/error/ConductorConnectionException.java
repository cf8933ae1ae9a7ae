package com.questrail.harness.error;

/**
 * The admin or application channel of a conductor could not be established.
 * Fatal to that conductor; never retried automatically.
 */
public final class ConductorConnectionException extends HarnessException
{
    private final String conductorName;

    public ConductorConnectionException(String conductorName, String message, Throwable cause) {
        super("Conductor '" + conductorName + "': " + message, cause);
        this.conductorName = conductorName;
    }

    public String conductorName() {
        return conductorName;
    }
}
