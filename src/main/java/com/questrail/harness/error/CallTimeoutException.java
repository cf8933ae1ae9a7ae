package com.questrail.harness.error;

import java.util.Optional;

/**
 * A function call exceeded its hard deadline. The remote call may still
 * complete; its late response is discarded.
 */
public final class CallTimeoutException extends HarnessException
{
    private final String conductorName;
    private final String cellNick;
    private final String zomeName;
    private final String fnName;
    private final long elapsedMs;
    private final String stateDump;

    public CallTimeoutException(String conductorName,
                                String cellNick,
                                String zomeName,
                                String fnName,
                                long elapsedMs,
                                String stateDump)
    {
        super(String.format("Call %s/%s on cell '%s' of conductor '%s' timed out after %d ms",
                zomeName, fnName, cellNick, conductorName, elapsedMs));
        this.conductorName = conductorName;
        this.cellNick = cellNick;
        this.zomeName = zomeName;
        this.fnName = fnName;
        this.elapsedMs = elapsedMs;
        this.stateDump = stateDump;
    }

    public String conductorName() {
        return conductorName;
    }

    public String cellNick() {
        return cellNick;
    }

    public String zomeName() {
        return zomeName;
    }

    public String fnName() {
        return fnName;
    }

    public long elapsedMs() {
        return elapsedMs;
    }

    /**
     * State dump captured for the target cell before the timeout was raised,
     * when diagnostics were enabled and the dump succeeded.
     */
    public Optional<String> stateDump() {
        return Optional.ofNullable(stateDump);
    }
}
