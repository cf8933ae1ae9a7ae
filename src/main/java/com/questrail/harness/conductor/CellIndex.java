package com.questrail.harness.conductor;

import com.questrail.harness.api.CellId;
import com.questrail.harness.api.InstalledApp;
import com.questrail.harness.api.InstalledCell;
import com.questrail.harness.error.UnknownCellException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-conductor index from application id to (cell nickname → cell id).
 *
 * <p>Append-only: an application's entry is written once, when its install
 * and enable both succeeded, and never changes afterwards.</p>
 */
final class CellIndex
{
    private final Map<String, Map<String, CellId>> byApp = new ConcurrentHashMap<>();

    boolean contains(String appId)
    {
        return byApp.containsKey(appId);
    }

    void register(InstalledApp app)
    {
        Map<String, CellId> cells = new LinkedHashMap<>();
        for (InstalledCell cell : app.cells()) {
            cells.put(cell.nick(), cell.cellId());
        }
        if (byApp.putIfAbsent(app.appId(), Collections.unmodifiableMap(cells)) != null) {
            throw new IllegalStateException("App already indexed: " + app.appId());
        }
    }

    CellId resolve(String appId, String cellNick)
    {
        Objects.requireNonNull(appId, "appId");
        Objects.requireNonNull(cellNick, "cellNick");

        Map<String, CellId> cells = byApp.get(appId);
        CellId cellId = cells == null ? null : cells.get(cellNick);
        if (cellId == null) {
            throw new UnknownCellException(appId, cellNick);
        }
        return cellId;
    }

    Map<String, CellId> cells(String appId)
    {
        return byApp.getOrDefault(appId, Map.of());
    }

    int appCount()
    {
        return byApp.size();
    }
}
