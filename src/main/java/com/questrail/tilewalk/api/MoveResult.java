package com.questrail.tilewalk.api;

/**
 * MoveResult
 * -----------------------------------------------------------------------------
 * Three-way outcome of attempting to enter a cell.
 *
 * <p>
 * {@link #BLOCKED} is a normal negative answer, not an error: the player simply
 * stays put. {@link #FALL} ends the current run as a failure.
 * </p>
 */
public enum MoveResult
{
    /** The cell can be stood on. */
    SUCCESS,

    /** A wall is in the way; the player does not move. */
    BLOCKED,

    /** Off the board, air, or an inactive bridge. */
    FALL
}
