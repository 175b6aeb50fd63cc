package com.questrail.tilewalk.board;

import com.questrail.tilewalk.api.GridPosition;
import com.questrail.tilewalk.api.TileKind;

/**
 * Immutable picture of a tile's visible state at one moment.
 * <p>
 * This is what renderers receive with a tile-changed signal: enough to pick a
 * sprite (switch lit or not, bridge raised or not, weak floor crack level)
 * without handing out the live, mutable {@link Tile}.
 */
public record TileSnapshot(
        GridPosition position,
        TileKind kind,
        boolean on,
        boolean active,
        int stepsRemaining
) {
}
