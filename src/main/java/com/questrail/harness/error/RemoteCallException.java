package com.questrail.harness.error;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A control channel answered a request with an error response.
 */
public final class RemoteCallException extends HarnessException
{
    private final String method;
    private final transient JsonNode details;

    public RemoteCallException(String method, String message, JsonNode details) {
        super(method + " failed: " + message);
        this.method = method;
        this.details = details;
    }

    public String method() {
        return method;
    }

    public JsonNode details() {
        return details;
    }
}
