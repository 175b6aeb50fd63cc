package com.questrail.tilewalk.api;

import java.util.Locale;
import java.util.Optional;

/**
 * TileKind
 * -----------------------------------------------------------------------------
 * The variant of a board cell.
 *
 * <ul>
 *   <li>{@link #FLOOR}, {@link #START}, {@link #END} – plain walkable cells</li>
 *   <li>{@link #WALL} – never enterable; a move into it is blocked</li>
 *   <li>{@link #AIR} – nothing to stand on; entering it is a fall</li>
 *   <li>{@link #SWITCH} – toggles each time the player lands on it</li>
 *   <li>{@link #BRIDGE} – walkable only while its controlling switch puts it
 *       in the active state</li>
 *   <li>{@link #WEAK_FLOOR} – walkable, but collapses into {@link #AIR} after
 *       a fixed number of landings</li>
 * </ul>
 */
public enum TileKind
{
    FLOOR,
    WALL,
    AIR,
    START,
    END,
    SWITCH,
    BRIDGE,
    WEAK_FLOOR;

    /**
     * Parses a tile kind name as written in level files ({@code "Floor"},
     * {@code "WeakFloor"}, {@code "weak_floor"} ...). Case and underscores are
     * ignored.
     */
    public static Optional<TileKind> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().replace("_", "").toUpperCase(Locale.ROOT);
        for (TileKind kind : values()) {
            if (kind.name().replace("_", "").equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
