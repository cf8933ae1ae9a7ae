package com.questrail.harness.error;

import java.util.List;

/**
 * The enable request that follows an install reported errors. The install
 * itself is not rolled back.
 */
public final class ActivationException extends HarnessException
{
    private final String appId;
    private final List<String> errors;

    public ActivationException(String appId, List<String> errors) {
        super("Enabling app '" + appId + "' failed: " + errors);
        this.appId = appId;
        this.errors = List.copyOf(errors);
    }

    public String appId() {
        return appId;
    }

    public List<String> errors() {
        return errors;
    }
}
