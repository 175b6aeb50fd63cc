package com.questrail.tilewalk.program;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Command
 * -----------------------------------------------------------------------------
 * A node of a player program: either an atomic {@link Step} or a bounded
 * {@link Loop} over child commands.
 *
 * <h2>Shape</h2>
 * Programs are trees. Loops may nest to any depth even though the authoring
 * UI only builds one level; the interpreter expands them depth first.
 *
 * <h2>Immutability</h2>
 * Commands are immutable values. A loop copies its children at construction,
 * so a program handed to an interpreter cannot change under it.
 */
public sealed interface Command permits Command.Step, Command.Loop
{
    /**
     * One atomic action.
     */
    record Step(StepAction action) implements Command {
        public Step {
            Objects.requireNonNull(action, "action");
        }
    }

    /**
     * Runs {@code children} in order, {@code repeatCount} times.
     * <p>
     * A repeat count below one is raised to one: a loop written with "no
     * repeats" still runs its body once instead of being silently skipped.
     */
    record Loop(int repeatCount, List<Command> children) implements Command {
        public Loop {
            repeatCount = Math.max(1, repeatCount);
            children = List.copyOf(children);
        }
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    static Command moveForward() {
        return new Step(StepAction.MOVE_FORWARD);
    }

    static Command turnLeft() {
        return new Step(StepAction.TURN_LEFT);
    }

    static Command turnRight() {
        return new Step(StepAction.TURN_RIGHT);
    }

    static Command loop(int repeatCount, Command... children) {
        return new Loop(repeatCount, Arrays.asList(children));
    }

    static Command loop(int repeatCount, List<Command> children) {
        return new Loop(repeatCount, children);
    }
}
