package com.questrail.tilewalk.board;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link Board#onPlayerLanded}: the outcome for the player plus every
 * tile whose visible state changed as a side effect, in the order the changes
 * happened.
 */
public record LandingResult(LandingOutcome outcome, List<TileSnapshot> changedTiles)
{
    static final LandingResult NOTHING = new LandingResult(LandingOutcome.SAFE, List.of());

    public LandingResult {
        Objects.requireNonNull(outcome, "outcome");
        changedTiles = List.copyOf(changedTiles);
    }

    public boolean isUnsafe() {
        return outcome == LandingOutcome.UNSAFE;
    }

    public boolean isLevelComplete() {
        return outcome == LandingOutcome.LEVEL_COMPLETE;
    }
}
