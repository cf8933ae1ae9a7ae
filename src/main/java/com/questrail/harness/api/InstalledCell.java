package com.questrail.harness.api;

import java.util.Objects;

/**
 * A cell as reported back by an install request, with the nickname it is
 * addressed by inside its application.
 */
public record InstalledCell(String nick, CellId cellId) {

    public InstalledCell {
        Objects.requireNonNull(nick, "nick");
        Objects.requireNonNull(cellId, "cellId");
    }
}
