package com.questrail.tilewalk.board;

import com.questrail.tilewalk.api.GridPosition;
import com.questrail.tilewalk.api.MoveResult;
import com.questrail.tilewalk.api.TileKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Board
 * =============================================================================
 * The grid of tiles plus the rules for entering and landing on them.
 *
 * <h2>Ownership</h2>
 * A board owns every {@link Tile} on it. Tile state changes only through
 * {@link #onPlayerLanded(GridPosition)} and the switch synchronization it
 * triggers. Dimensions are fixed at construction. A level restart never
 * patches an existing board; it builds a new one.
 *
 * <h2>Switch / bridge binding</h2>
 * A bridge names its switch by id. Its active flag is always
 * {@code switch.isOn() == bridge.activatesWhenSwitchOn()}; it is recomputed
 * for every switch at construction (ascending position order) and again after
 * every toggle. A bridge whose switch id is not on the board keeps its
 * initial state.
 *
 * <h2>Failure semantics</h2>
 * None of the public operations throw for any position. Absence of a tile is a
 * value ({@link Optional#empty()}, {@link MoveResult#FALL}), never an error.
 *
 * <h2>Threading</h2>
 * Not synchronized. A board is driven by one interpreter at a time.
 */
public final class Board
{
    private final int width;
    private final int height;
    private final Tile[][] cells;
    private final GridPosition startPosition;

    private Board(int width, int height, Tile[][] cells, GridPosition startPosition) {
        this.width = width;
        this.height = height;
        this.cells = cells;
        this.startPosition = startPosition;
    }

    public static Builder builder(int width, int height) {
        return new Builder(width, height);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public GridPosition startPosition() {
        return startPosition;
    }

    public boolean contains(GridPosition position) {
        return position.x() >= 0 && position.x() < width
                && position.y() >= 0 && position.y() < height;
    }

    /**
     * Bounds-checked lookup.
     *
     * @return the tile at {@code position}, or empty for an unfilled cell or
     *         any coordinate outside {@code [0,width) x [0,height)}
     */
    public Optional<Tile> tileAt(GridPosition position) {
        Objects.requireNonNull(position, "position");
        if (!contains(position)) {
            return Optional.empty();
        }
        return Optional.ofNullable(cells[position.x()][position.y()]);
    }

    /**
     * Returns every tile on the board in ascending position order (by
     * {@code x}, then {@code y}).
     */
    public List<Tile> tiles() {
        List<Tile> tiles = new ArrayList<>();
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                if (cells[x][y] != null) {
                    tiles.add(cells[x][y]);
                }
            }
        }
        return Collections.unmodifiableList(tiles);
    }

    /**
     * Pure legality query for entering {@code target}. Never mutates anything.
     */
    public MoveResult checkMove(GridPosition target) {
        Optional<Tile> found = tileAt(target);
        if (found.isEmpty()) {
            return MoveResult.FALL;
        }
        Tile tile = found.get();
        switch (tile.kind()) {
            case WALL:
                return MoveResult.BLOCKED;
            case AIR:
                return MoveResult.FALL;
            case BRIDGE:
                return tile.isActive() ? MoveResult.SUCCESS : MoveResult.FALL;
            default:
                // Weak floors are always enterable; collapsing is a landing effect.
                return MoveResult.SUCCESS;
        }
    }

    /**
     * Applies the side effects of the player arriving at {@code position}.
     * Called once per successful move, after the player's position has been
     * updated.
     *
     * <ul>
     *   <li>Switch: toggles, then re-synchronizes its bridges.</li>
     *   <li>Weak floor: consumes one step; on the last one the tile becomes air
     *       and the outcome is {@link LandingOutcome#UNSAFE}.</li>
     *   <li>End: outcome is {@link LandingOutcome#LEVEL_COMPLETE}.</li>
     *   <li>Anything else, including an inactive bridge or an empty cell: no-op.</li>
     * </ul>
     */
    public LandingResult onPlayerLanded(GridPosition position) {
        Optional<Tile> found = tileAt(position);
        if (found.isEmpty()) {
            return LandingResult.NOTHING;
        }
        Tile tile = found.get();

        switch (tile.kind()) {
            case SWITCH: {
                tile.toggle();
                List<TileSnapshot> changed = new ArrayList<>();
                changed.add(tile.snapshot());
                changed.addAll(switchSync(tile));
                return new LandingResult(LandingOutcome.SAFE, changed);
            }
            case WEAK_FLOOR: {
                if (tile.stepsRemaining() <= 0) {
                    return LandingResult.NOTHING;
                }
                boolean collapsed = tile.consumeStep();
                return new LandingResult(
                        collapsed ? LandingOutcome.UNSAFE : LandingOutcome.SAFE,
                        List.of(tile.snapshot()));
            }
            case END:
                return new LandingResult(LandingOutcome.LEVEL_COMPLETE, List.of());
            default:
                return LandingResult.NOTHING;
        }
    }

    /**
     * Recomputes every bridge bound to {@code switchTile}'s id from the switch's
     * current state. Deterministic and idempotent: a second call with the switch
     * unchanged reports no changes.
     *
     * @return snapshots of the bridges whose active flag changed
     */
    List<TileSnapshot> switchSync(Tile switchTile) {
        List<TileSnapshot> changed = new ArrayList<>();
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                Tile candidate = cells[x][y];
                if (candidate != null
                        && candidate.is(TileKind.BRIDGE)
                        && candidate.controlledBySwitchId() == switchTile.switchId()) {
                    boolean shouldBeActive = switchTile.isOn() == candidate.activatesWhenSwitchOn();
                    if (candidate.setActive(shouldBeActive)) {
                        changed.add(candidate.snapshot());
                    }
                }
            }
        }
        return changed;
    }

    // =========================================================================
    // Builder
    // =========================================================================

    /**
     * Collects tile placements and produces a board in its load-time state.
     * <p>
     * {@link #build()} enforces the structural invariants (exactly one start,
     * one tile per cell, every tile inside the grid) and performs the initial
     * switch synchronization pass.
     */
    public static final class Builder
    {
        private final int width;
        private final int height;
        private final Tile[][] cells;
        private final boolean[][] placed;

        private Builder(int width, int height) {
            if (width < 0 || height < 0) {
                throw new IllegalArgumentException("Board dimensions must be >= 0");
            }
            this.width = width;
            this.height = height;
            this.cells = new Tile[width][height];
            this.placed = new boolean[width][height];
        }

        /**
         * Places a tile. Air templates are accepted and leave the cell empty:
         * for move resolution "no tile" and air are the same thing. An air
         * placement still claims its position.
         *
         * @throws IllegalArgumentException if the position is outside the grid
         *         or already occupied
         */
        public Builder place(GridPosition position, TileTemplate template) {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(template, "template");

            if (position.x() < 0 || position.x() >= width || position.y() < 0 || position.y() >= height) {
                throw new IllegalArgumentException(
                        "Tile position " + position + " outside " + width + "x" + height + " board");
            }
            if (placed[position.x()][position.y()]) {
                throw new IllegalArgumentException("Duplicate tile at " + position);
            }
            placed[position.x()][position.y()] = true;
            if (template.kind() == TileKind.AIR) {
                return this;
            }
            cells[position.x()][position.y()] = new Tile(position, template);
            return this;
        }

        /**
         * @throws IllegalStateException if the board does not hold exactly one
         *         start tile
         */
        public Board build() {
            GridPosition start = null;
            List<Tile> switches = new ArrayList<>();

            for (int x = 0; x < width; x++) {
                for (int y = 0; y < height; y++) {
                    Tile tile = cells[x][y];
                    if (tile == null) {
                        continue;
                    }
                    if (tile.is(TileKind.START)) {
                        if (start != null) {
                            throw new IllegalStateException(
                                    "More than one Start tile: " + start + " and " + tile.position());
                        }
                        start = tile.position();
                    } else if (tile.is(TileKind.SWITCH)) {
                        switches.add(tile);
                    }
                }
            }
            if (start == null) {
                throw new IllegalStateException("No Start tile on board");
            }

            Tile[][] owned = new Tile[width][];
            for (int x = 0; x < width; x++) {
                owned[x] = cells[x].clone();
            }
            Board board = new Board(width, height, owned, start);
            // Bridges start from their initial flag, then follow their switch.
            for (Tile sw : switches) {
                board.switchSync(sw);
            }
            return board;
        }
    }
}
