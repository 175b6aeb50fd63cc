package com.questrail.tilewalk.interpreter;

import java.time.Duration;
import java.util.Objects;

/**
 * PacingPolicy
 * -----------------------------------------------------------------------------
 * Timing configuration for the interpreter.
 *
 * <p>There is exactly one knob: the pause after every atomic step, so a viewer
 * can follow the player. It is a fixed duration and is never derived from game
 * state. Loops themselves cost no time; only the steps inside them do.</p>
 *
 * @param stepDelay pause between the end of one step and the start of the next
 */
public record PacingPolicy(Duration stepDelay)
{
    public PacingPolicy {
        Objects.requireNonNull(stepDelay, "stepDelay");
        if (stepDelay.isNegative()) {
            throw new IllegalArgumentException("stepDelay must be non-negative");
        }
    }

    /**
     * Half a second between steps.
     */
    public static PacingPolicy defaults() {
        return new PacingPolicy(Duration.ofMillis(500));
    }

    public static PacingPolicy withStepDelay(Duration stepDelay) {
        return new PacingPolicy(stepDelay);
    }

    /**
     * No pause; the next step is still scheduled rather than run inline.
     */
    public static PacingPolicy immediate() {
        return new PacingPolicy(Duration.ZERO);
    }
}
