package com.questrail.tilewalk.observability;

import com.questrail.tilewalk.api.Direction;
import com.questrail.tilewalk.api.FailureReason;
import com.questrail.tilewalk.api.GridPosition;
import com.questrail.tilewalk.api.PlayerPose;
import com.questrail.tilewalk.api.TileKind;
import com.questrail.tilewalk.board.TileSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompositeSignalSinkTest
{
    private static final PlayerPose POSE = new PlayerPose(GridPosition.ORIGIN, Direction.UP);

    @Test
    void everySinkReceivesEverySignalInOrder() {
        RecordingSignalSink first = new RecordingSignalSink();
        RecordingSignalSink second = new RecordingSignalSink();
        PuzzleSignalSink composite = CompositeSignalSink.of(first, new Slf4jSignalSink(), second);

        composite.onLevelLoaded(0, POSE);
        composite.onSequenceStarted();
        composite.onStepTaken(1);
        composite.onPoseChanged(POSE);
        composite.onMoveBlocked(POSE);
        composite.onTileChanged(new TileSnapshot(GridPosition.ORIGIN, TileKind.SWITCH, true, true, 0));
        composite.onSequenceCompleted(1);
        composite.onSequenceFailed(FailureReason.FELL);
        composite.onLevelCompleted(1, 0);
        composite.onAllLevelsCompleted();
        composite.onError(new PuzzleErrorEvent(Instant.EPOCH, "boom", null));

        List<String> expected = List.of(
                "levelLoaded", "sequenceStarted", "stepTaken", "poseChanged", "moveBlocked",
                "tileChanged", "sequenceCompleted", "sequenceFailed", "levelCompleted",
                "allLevelsCompleted", "error");
        assertEquals(expected, first.names());
        assertEquals(expected, second.names());
    }

    @Test
    void failingSinkDoesNotStopTheOthers() {
        PuzzleSignalSink throwing = new ThrowingOnStepSink();
        RecordingSignalSink recording = new RecordingSignalSink();
        PuzzleSignalSink composite = CompositeSignalSink.of(throwing, recording);

        composite.onStepTaken(4);

        assertEquals(List.of("error", "stepTaken"), recording.names());
        PuzzleErrorEvent error = recording.errors().get(0);
        assertTrue(error.message().contains("onStepTaken"));
        assertInstanceOf(IllegalStateException.class, error.cause());
    }

    @Test
    void nullSinkAcceptsEverything() {
        PuzzleSignalSink sink = NullSignalSink.INSTANCE;

        assertDoesNotThrow(() -> {
            sink.onSequenceStarted();
            sink.onSequenceFailed(FailureReason.ENDED_OFF_TARGET);
            sink.onError(new PuzzleErrorEvent(Instant.EPOCH, "ignored", null));
        });
    }

    /** Throws on steps, records nothing. */
    private static final class ThrowingOnStepSink implements PuzzleSignalSink {
        @Override public void onLevelLoaded(int levelIndex, PlayerPose startPose) { }
        @Override public void onSequenceStarted() { }
        @Override public void onStepTaken(int stepCount) { throw new IllegalStateException("step " + stepCount); }
        @Override public void onPoseChanged(PlayerPose pose) { }
        @Override public void onMoveBlocked(PlayerPose pose) { }
        @Override public void onTileChanged(TileSnapshot tile) { }
        @Override public void onSequenceCompleted(int stepCount) { }
        @Override public void onSequenceFailed(FailureReason reason) { }
        @Override public void onLevelCompleted(int stepsTaken, int levelIndex) { }
        @Override public void onAllLevelsCompleted() { }
        @Override public void onError(PuzzleErrorEvent event) { }
    }
}
