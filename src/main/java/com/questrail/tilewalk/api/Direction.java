package com.questrail.tilewalk.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Direction
 * -----------------------------------------------------------------------------
 * The four cardinal facings a player can take.
 *
 * <p>
 * Declaration order is clockwise starting at {@link #UP}. Turning is therefore
 * plain modular arithmetic on the ordinal: a right turn adds one, a left turn
 * adds three.
 * </p>
 */
public enum Direction
{
    UP(0, 1),
    RIGHT(1, 0),
    DOWN(0, -1),
    LEFT(-1, 0);

    private static final Direction[] CLOCKWISE = values();

    private final int dx;
    private final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int dx() {
        return dx;
    }

    public int dy() {
        return dy;
    }

    /** Facing after a 90° clockwise rotation. */
    public Direction turnRight() {
        return CLOCKWISE[(ordinal() + 1) % 4];
    }

    /** Facing after a 90° counter-clockwise rotation. */
    public Direction turnLeft() {
        return CLOCKWISE[(ordinal() + 3) % 4];
    }

    /**
     * Parses a direction name as written in level files.
     * <p>
     * Matching is case-insensitive and accepts the compass aliases
     * {@code NORTH}, {@code EAST}, {@code SOUTH} and {@code WEST}.
     *
     * @return the direction, or {@link Optional#empty()} if the text is
     *         {@code null}, blank or not a known name
     */
    public static Optional<Direction> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "UP":
            case "NORTH":
                return Optional.of(UP);
            case "RIGHT":
            case "EAST":
                return Optional.of(RIGHT);
            case "DOWN":
            case "SOUTH":
                return Optional.of(DOWN);
            case "LEFT":
            case "WEST":
                return Optional.of(LEFT);
            default:
                return Optional.empty();
        }
    }
}
