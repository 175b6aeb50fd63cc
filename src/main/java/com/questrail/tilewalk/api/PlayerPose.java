package com.questrail.tilewalk.api;

import java.util.Objects;

/**
 * Where the player stands and which way it faces.
 *
 * <p>
 * Poses are immutable; the interpreter replaces its current pose on every
 * executed step.
 * </p>
 */
public record PlayerPose(GridPosition position, Direction facing)
{
    public PlayerPose {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(facing, "facing");
    }

    /** The cell directly in front of the player. */
    public GridPosition ahead() {
        return position.step(facing);
    }

    public PlayerPose movedTo(GridPosition target) {
        return new PlayerPose(target, facing);
    }

    public PlayerPose turnedLeft() {
        return new PlayerPose(position, facing.turnLeft());
    }

    public PlayerPose turnedRight() {
        return new PlayerPose(position, facing.turnRight());
    }
}
