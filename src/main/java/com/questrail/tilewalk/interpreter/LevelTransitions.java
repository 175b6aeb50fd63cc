package com.questrail.tilewalk.interpreter;

/**
 * LevelTransitions
 * -----------------------------------------------------------------------------
 * Triggers the interpreter pulls when a run is over. Supplied by the embedding
 * application, which decides what a restart or a level change actually
 * involves (scene transition, reload, score keeping).
 *
 * <p>
 * Both methods are invoked after the interpreter has reached its terminal
 * state and released its internal lock, so an implementation may safely
 * build a new board and interpreter from inside the call.
 * </p>
 */
public interface LevelTransitions
{
    /** The run failed; the level should be reloaded from scratch. */
    void requestRestart();

    /**
     * The run finished on the end tile.
     *
     * @param stepsTaken steps taken on this board, across all runs on it
     */
    void requestNextLevel(int stepsTaken);

    /**
     * Transitions that do nothing, for standalone use of an interpreter.
     */
    LevelTransitions NONE = new LevelTransitions() {
        @Override
        public void requestRestart() {}

        @Override
        public void requestNextLevel(int stepsTaken) {}
    };
}
