package com.questrail.tilewalk.interpreter;

import com.questrail.tilewalk.program.Command;

import java.util.List;

/**
 * One level of the interpreter's explicit expansion stack: a command list, the
 * position within it, and how many passes over it are left.
 *
 * <p>
 * The top-level program is a single-pass frame; every loop pushes a frame with
 * {@code repeatCount} passes. Keeping the recursion on an explicit stack is
 * what lets a step suspend between commands and lets a halt or failure drop
 * every enclosing loop at once by clearing the stack.
 * </p>
 */
final class ExecutionFrame
{
    private final List<Command> commands;
    private int index;
    private int passesRemaining;

    private ExecutionFrame(List<Command> commands, int passes) {
        this.commands = commands;
        this.passesRemaining = passes;
        this.index = 0;
    }

    static ExecutionFrame program(List<Command> commands) {
        return new ExecutionFrame(List.copyOf(commands), 1);
    }

    static ExecutionFrame loop(Command.Loop loop) {
        return new ExecutionFrame(loop.children(), loop.repeatCount());
    }

    /**
     * @return the next command of this frame, or {@code null} once every pass
     *         is used up
     */
    Command next() {
        while (index >= commands.size()) {
            passesRemaining--;
            if (passesRemaining <= 0 || commands.isEmpty()) {
                return null;
            }
            index = 0;
        }
        return commands.get(index++);
    }
}
