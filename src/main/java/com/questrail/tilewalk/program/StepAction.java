package com.questrail.tilewalk.program;

/**
 * The atomic actions a player can be told to perform.
 */
public enum StepAction
{
    MOVE_FORWARD,
    TURN_LEFT,
    TURN_RIGHT
}
