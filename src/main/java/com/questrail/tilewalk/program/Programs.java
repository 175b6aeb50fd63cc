package com.questrail.tilewalk.program;

import java.util.List;

/**
 * Static helpers for inspecting command programs.
 */
public final class Programs
{
    private Programs() {}

    /**
     * Number of atomic steps the program performs when nothing fails, with
     * every loop fully expanded.
     */
    public static long expandedStepCount(List<Command> program) {
        long total = 0;
        for (Command command : program) {
            if (command instanceof Command.Loop loop) {
                total += loop.repeatCount() * expandedStepCount(loop.children());
            } else {
                total++;
            }
        }
        return total;
    }

    /**
     * Deepest loop nesting in the program; zero for a flat list of steps.
     */
    public static int loopDepth(List<Command> program) {
        int deepest = 0;
        for (Command command : program) {
            if (command instanceof Command.Loop loop) {
                deepest = Math.max(deepest, 1 + loopDepth(loop.children()));
            }
        }
        return deepest;
    }
}
