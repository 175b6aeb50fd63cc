package com.questrail.tilewalk.board;

/**
 * What landing on a cell means for the player who just arrived there.
 */
public enum LandingOutcome
{
    /** Nothing beyond the tile's own side effects; keep going. */
    SAFE,

    /** The floor gave way under the player; this is a fall. */
    UNSAFE,

    /** The player is standing on the goal. */
    LEVEL_COMPLETE
}
