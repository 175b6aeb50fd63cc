package com.questrail.tilewalk.api;

/**
 * GridPosition
 * -----------------------------------------------------------------------------
 * Integer cell coordinate on a board. {@code (0, 0)} is the bottom-left cell;
 * {@code x} grows to the right and {@code y} grows upward.
 *
 * <p>
 * Positions are plain values. They carry no knowledge of board bounds, so a
 * position may well lie outside any particular board; bounds are the board's
 * concern.
 * </p>
 */
public record GridPosition(int x, int y)
{
    public static final GridPosition ORIGIN = new GridPosition(0, 0);

    public static GridPosition of(int x, int y) {
        return new GridPosition(x, y);
    }

    /**
     * Returns the neighbouring position one cell away in the given direction.
     */
    public GridPosition step(Direction direction) {
        return new GridPosition(x + direction.dx(), y + direction.dy());
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
