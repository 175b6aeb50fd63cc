package com.questrail.tilewalk.board;

import com.questrail.tilewalk.api.TileKind;

import java.util.Objects;

/**
 * TileTemplate
 * -----------------------------------------------------------------------------
 * Placement parameters for one tile, before it is put on a board.
 *
 * <p>
 * Only the parameters relevant to {@link #kind()} are consulted when the tile
 * is materialized; the rest are carried along untouched so that a template can
 * be read straight from a level file without per-kind branching.
 * </p>
 *
 * @param kind                  tile variant
 * @param switchId              identity of a switch, used by bridges to find it
 * @param controlledBySwitchId  for bridges, the switch that drives them
 * @param bridgeInitiallyActive for bridges, the state before switch sync
 * @param activatesWhenSwitchOn for bridges, whether ON (true) or OFF (false)
 *                              makes the bridge walkable
 * @param initialSteps          for weak floors, landings tolerated before collapse
 */
public record TileTemplate(
        TileKind kind,
        int switchId,
        int controlledBySwitchId,
        boolean bridgeInitiallyActive,
        boolean activatesWhenSwitchOn,
        int initialSteps
) {
    public TileTemplate {
        Objects.requireNonNull(kind, "kind");
    }

    /** A template with no kind-specific parameters (floor, wall, start, end). */
    public static TileTemplate of(TileKind kind) {
        return new TileTemplate(kind, 0, 0, true, true, 0);
    }

    public static TileTemplate switchTile(int switchId) {
        return new TileTemplate(TileKind.SWITCH, switchId, 0, true, true, 0);
    }

    public static TileTemplate bridge(int controlledBySwitchId,
                                      boolean activatesWhenSwitchOn,
                                      boolean initiallyActive) {
        return new TileTemplate(TileKind.BRIDGE, 0, controlledBySwitchId,
                initiallyActive, activatesWhenSwitchOn, 0);
    }

    public static TileTemplate weakFloor(int initialSteps) {
        return new TileTemplate(TileKind.WEAK_FLOOR, 0, 0, true, true, initialSteps);
    }

    /** Copy of this template with {@code initialSteps} replaced. */
    public TileTemplate withInitialSteps(int steps) {
        return new TileTemplate(kind, switchId, controlledBySwitchId,
                bridgeInitiallyActive, activatesWhenSwitchOn, steps);
    }
}
