package com.questrail.tilewalk.api;

/**
 * Why a run ended in {@link RunState#FAILED}. All of these are ordinary game
 * outcomes that lead to a level restart.
 */
public enum FailureReason
{
    /** Walked off the board, into air, or onto an inactive bridge. */
    FELL,

    /** A weak floor gave way under the player. */
    FLOOR_COLLAPSED,

    /** The program ran out with the player anywhere but the end tile. */
    ENDED_OFF_TARGET
}
