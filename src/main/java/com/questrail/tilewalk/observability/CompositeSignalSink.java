package com.questrail.tilewalk.observability;

import com.questrail.tilewalk.api.FailureReason;
import com.questrail.tilewalk.api.PlayerPose;
import com.questrail.tilewalk.board.TileSnapshot;
import com.questrail.tilewalk.internal.time.SystemWallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans every signal out to an ordered list of sinks.
 * <p>
 * Sinks are invoked synchronously in list order. A sink that throws does not
 * stop the others; the failure is reported through every sink's {@code onError}.
 */
public final class CompositeSignalSink implements PuzzleSignalSink {
    private static final Logger log = LoggerFactory.getLogger(CompositeSignalSink.class);

    private final List<PuzzleSignalSink> sinks;

    public CompositeSignalSink(List<PuzzleSignalSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public static PuzzleSignalSink of(PuzzleSignalSink... sinks) {
        return new CompositeSignalSink(List.of(sinks));
    }

    public List<PuzzleSignalSink> sinks() {
        return sinks;
    }

    @Override
    public void onLevelLoaded(int levelIndex, PlayerPose startPose) {
        fanOut("onLevelLoaded", s -> s.onLevelLoaded(levelIndex, startPose));
    }

    @Override
    public void onSequenceStarted() {
        fanOut("onSequenceStarted", PuzzleSignalSink::onSequenceStarted);
    }

    @Override
    public void onStepTaken(int stepCount) {
        fanOut("onStepTaken", s -> s.onStepTaken(stepCount));
    }

    @Override
    public void onPoseChanged(PlayerPose pose) {
        fanOut("onPoseChanged", s -> s.onPoseChanged(pose));
    }

    @Override
    public void onMoveBlocked(PlayerPose pose) {
        fanOut("onMoveBlocked", s -> s.onMoveBlocked(pose));
    }

    @Override
    public void onTileChanged(TileSnapshot tile) {
        fanOut("onTileChanged", s -> s.onTileChanged(tile));
    }

    @Override
    public void onSequenceCompleted(int stepCount) {
        fanOut("onSequenceCompleted", s -> s.onSequenceCompleted(stepCount));
    }

    @Override
    public void onSequenceFailed(FailureReason reason) {
        fanOut("onSequenceFailed", s -> s.onSequenceFailed(reason));
    }

    @Override
    public void onLevelCompleted(int stepsTaken, int levelIndex) {
        fanOut("onLevelCompleted", s -> s.onLevelCompleted(stepsTaken, levelIndex));
    }

    @Override
    public void onAllLevelsCompleted() {
        fanOut("onAllLevelsCompleted", PuzzleSignalSink::onAllLevelsCompleted);
    }

    @Override
    public void onError(PuzzleErrorEvent event) {
        for (PuzzleSignalSink sink : sinks) {
            try {
                sink.onError(event);
            } catch (RuntimeException e) {
                log.warn("Signal sink {} failed while reporting '{}'", sink, event.message(), e);
            }
        }
    }

    private void fanOut(String signal, Consumer<PuzzleSignalSink> delivery) {
        for (PuzzleSignalSink sink : sinks) {
            try {
                delivery.accept(sink);
            } catch (RuntimeException e) {
                onError(new PuzzleErrorEvent(SystemWallClock.INSTANCE.now(),
                        "Signal sink failed on " + signal, e));
            }
        }
    }
}
