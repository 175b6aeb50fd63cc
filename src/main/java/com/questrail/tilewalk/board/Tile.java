package com.questrail.tilewalk.board;

import com.questrail.tilewalk.api.GridPosition;
import com.questrail.tilewalk.api.TileKind;

import java.util.Objects;

/**
 * Tile
 * -----------------------------------------------------------------------------
 * One addressable cell of a {@link Board}.
 *
 * <h2>Ownership</h2>
 * A tile belongs to exactly one board. Its runtime state (switch on/off,
 * bridge active/inactive, weak floor steps, and the weak floor's degradation
 * into air) can only be changed by that board: every mutator here is
 * package-private. Code outside this package sees a read-only tile.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code position} never changes</li>
 *   <li>{@code stepsRemaining} never increases and never drops below zero</li>
 *   <li>a bridge's {@code active} flag is written only by switch sync</li>
 * </ul>
 */
public final class Tile
{
    private final GridPosition position;
    private final int switchId;
    private final int controlledBySwitchId;
    private final boolean initiallyActive;
    private final boolean activatesWhenSwitchOn;
    private final int initialSteps;

    private TileKind kind;
    private boolean on;
    private boolean active;
    private int stepsRemaining;

    Tile(GridPosition position, TileTemplate template) {
        this.position = Objects.requireNonNull(position, "position");
        Objects.requireNonNull(template, "template");

        this.kind = template.kind();
        this.switchId = template.switchId();
        this.controlledBySwitchId = template.controlledBySwitchId();
        this.initiallyActive = template.bridgeInitiallyActive();
        this.activatesWhenSwitchOn = template.activatesWhenSwitchOn();
        this.initialSteps = kind == TileKind.WEAK_FLOOR
                ? Math.max(1, template.initialSteps())
                : template.initialSteps();

        // Load-time state. Bridges are re-synchronized by the board afterwards.
        this.on = false;
        this.active = initiallyActive;
        this.stepsRemaining = kind == TileKind.WEAK_FLOOR ? initialSteps : 0;
    }

    public GridPosition position() {
        return position;
    }

    public TileKind kind() {
        return kind;
    }

    public boolean is(TileKind candidate) {
        return kind == candidate;
    }

    public int switchId() {
        return switchId;
    }

    public boolean isOn() {
        return on;
    }

    public int controlledBySwitchId() {
        return controlledBySwitchId;
    }

    public boolean activatesWhenSwitchOn() {
        return activatesWhenSwitchOn;
    }

    public boolean initiallyActive() {
        return initiallyActive;
    }

    public boolean isActive() {
        return active;
    }

    public int initialSteps() {
        return initialSteps;
    }

    public int stepsRemaining() {
        return stepsRemaining;
    }

    public TileSnapshot snapshot() {
        return new TileSnapshot(position, kind, on, active, stepsRemaining);
    }

    // ---------------------------------------------------------------------
    // Board-only mutators
    // ---------------------------------------------------------------------

    void toggle() {
        on = !on;
    }

    /**
     * @return {@code true} if the flag actually changed
     */
    boolean setActive(boolean value) {
        if (active == value) {
            return false;
        }
        active = value;
        return true;
    }

    /**
     * Consumes one landing. When the last one is used up the tile becomes
     * {@link TileKind#AIR} in place.
     *
     * @return {@code true} if the tile collapsed on this landing
     */
    boolean consumeStep() {
        if (stepsRemaining <= 0) {
            return false;
        }
        stepsRemaining--;
        if (stepsRemaining == 0) {
            kind = TileKind.AIR;
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "Tile{" + kind + " at " + position + "}";
    }
}
