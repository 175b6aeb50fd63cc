package com.questrail.tilewalk.observability;

import com.questrail.tilewalk.api.FailureReason;
import com.questrail.tilewalk.api.PlayerPose;
import com.questrail.tilewalk.board.TileSnapshot;

/**
 * PuzzleSignalSink
 * -----------------------------------------------------------------------------
 * Receiver of the fire-and-forget signals emitted by the board, the
 * interpreter and the session.
 *
 * <p>
 * UI, audio and animation layers implement this to follow a run. Signals are
 * delivered synchronously on the thread that caused them, in the order the
 * state changes happen. Implementations must return quickly and must not
 * throw.
 * </p>
 *
 * <p>
 * Several consumers are combined with {@link CompositeSignalSink}; there is no
 * global dispatch.
 * </p>
 */
public interface PuzzleSignalSink {

    /**
     * A fresh board for level {@code levelIndex} (zero-based) is in place and
     * the player stands on its start tile.
     */
    void onLevelLoaded(int levelIndex, PlayerPose startPose);

    /** A run has begun executing. */
    void onSequenceStarted();

    /**
     * An atomic step is about to be performed.
     *
     * @param stepCount number of steps taken on this board so far, including this one
     */
    void onStepTaken(int stepCount);

    /** The player moved or turned. */
    void onPoseChanged(PlayerPose pose);

    /** A move was refused by a wall; the player did not move. */
    void onMoveBlocked(PlayerPose pose);

    /** A tile's visible state changed. */
    void onTileChanged(TileSnapshot tile);

    /** The run finished with the player on the end tile. */
    void onSequenceCompleted(int stepCount);

    /** The run ended in failure; a restart follows. */
    void onSequenceFailed(FailureReason reason);

    /**
     * Level {@code levelIndex} (zero-based) was passed in {@code stepsTaken} steps.
     */
    void onLevelCompleted(int stepsTaken, int levelIndex);

    /** The last level of the catalog was passed. */
    void onAllLevelsCompleted();

    /** Something went wrong that the caller may want to surface. */
    void onError(PuzzleErrorEvent event);
}
