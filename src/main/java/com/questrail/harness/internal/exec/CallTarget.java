package com.questrail.harness.internal.exec;

import com.questrail.harness.api.CellId;

import java.util.Objects;

/**
 * What a single function call is aimed at. Carried by pending calls,
 * observability events and timeout errors.
 */
public record CallTarget(String conductorName,
                         String appId,
                         String cellNick,
                         CellId cellId,
                         String zomeName,
                         String fnName) {

    public CallTarget {
        Objects.requireNonNull(conductorName, "conductorName");
        Objects.requireNonNull(appId, "appId");
        Objects.requireNonNull(cellNick, "cellNick");
        Objects.requireNonNull(cellId, "cellId");
        Objects.requireNonNull(zomeName, "zomeName");
        Objects.requireNonNull(fnName, "fnName");
    }
}
