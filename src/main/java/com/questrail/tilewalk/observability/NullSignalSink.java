package com.questrail.tilewalk.observability;

import com.questrail.tilewalk.api.FailureReason;
import com.questrail.tilewalk.api.PlayerPose;
import com.questrail.tilewalk.board.TileSnapshot;

/**
 * No-op implementation of PuzzleSignalSink.
 */
public final class NullSignalSink implements PuzzleSignalSink {
    public static final NullSignalSink INSTANCE = new NullSignalSink();

    private NullSignalSink() {}

    @Override
    public void onLevelLoaded(int levelIndex, PlayerPose startPose) {}

    @Override
    public void onSequenceStarted() {}

    @Override
    public void onStepTaken(int stepCount) {}

    @Override
    public void onPoseChanged(PlayerPose pose) {}

    @Override
    public void onMoveBlocked(PlayerPose pose) {}

    @Override
    public void onTileChanged(TileSnapshot tile) {}

    @Override
    public void onSequenceCompleted(int stepCount) {}

    @Override
    public void onSequenceFailed(FailureReason reason) {}

    @Override
    public void onLevelCompleted(int stepsTaken, int levelIndex) {}

    @Override
    public void onAllLevelsCompleted() {}

    @Override
    public void onError(PuzzleErrorEvent event) {}
}
