package com.questrail.tilewalk.api;

/**
 * RunState
 * -----------------------------------------------------------------------------
 * Lifecycle of a command interpreter.
 *
 * <pre>
 *   IDLE ──run──▶ RUNNING ──▶ COMPLETED | FAILED
 *                    │
 *                    └──halt──▶ HALTED
 * </pre>
 *
 * Every state other than {@link #RUNNING} accepts a new run.
 */
public enum RunState
{
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED,
    HALTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == HALTED;
    }
}
