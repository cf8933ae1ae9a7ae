package com.questrail.harness.error;

/**
 * A (app id, cell nickname) pair is not present in a conductor's install index.
 */
public final class UnknownCellException extends HarnessException
{
    private final String appId;
    private final String cellNick;

    public UnknownCellException(String appId, String cellNick) {
        super("Unknown cell nickname: " + cellNick + " in app: " + appId);
        this.appId = appId;
        this.cellNick = cellNick;
    }

    public String appId() {
        return appId;
    }

    public String cellNick() {
        return cellNick;
    }
}
