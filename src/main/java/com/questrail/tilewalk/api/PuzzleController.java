package com.questrail.tilewalk.api;

import com.questrail.tilewalk.board.Tile;
import com.questrail.tilewalk.program.Command;

import java.util.List;
import java.util.Optional;

/**
 * PuzzleController
 * -----------------------------------------------------------------------------
 * The surface an embedding application (UI, renderer, test harness) drives a
 * puzzle through.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Run control: start a command program, halt it</li>
 *   <li>Queries for rendering: tiles, board size, player pose, run state</li>
 * </ul>
 *
 * Everything that happens during a run is reported through signals rather
 * than return values; see
 * {@link com.questrail.tilewalk.observability.PuzzleSignalSink}.
 *
 * <h2>Threading</h2>
 * Implementations are safe to call from any thread. Runs themselves proceed
 * on the scheduler the implementation was built with.
 */
public interface PuzzleController
{
    /**
     * Starts running {@code commands} against the current board.
     *
     * @return {@code false} if a run is already in progress; nothing happens
     */
    boolean run(List<Command> commands);

    /**
     * Stops the current run immediately. Does nothing when no run is active.
     */
    void halt();

    RunState runState();

    PlayerPose playerPose();

    Optional<Tile> tileAt(GridPosition position);

    int boardWidth();

    int boardHeight();
}
