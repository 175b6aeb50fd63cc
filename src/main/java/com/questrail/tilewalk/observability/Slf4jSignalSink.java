package com.questrail.tilewalk.observability;

import com.questrail.tilewalk.api.FailureReason;
import com.questrail.tilewalk.api.PlayerPose;
import com.questrail.tilewalk.board.TileSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of PuzzleSignalSink that emits logs via SLF4J.
 */
public final class Slf4jSignalSink implements PuzzleSignalSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSignalSink.class);

    @Override
    public void onLevelLoaded(int levelIndex, PlayerPose startPose) {
        log.info("Level {} loaded, player at {} facing {}",
            levelIndex + 1, startPose.position(), startPose.facing());
    }

    @Override
    public void onSequenceStarted() {
        log.info("--- SEQUENCE START ---");
    }

    @Override
    public void onStepTaken(int stepCount) {
        log.debug("Step {}", stepCount);
    }

    @Override
    public void onPoseChanged(PlayerPose pose) {
        log.debug("Player at {} facing {}", pose.position(), pose.facing());
    }

    @Override
    public void onMoveBlocked(PlayerPose pose) {
        log.debug("Move blocked by a wall ahead of {}", pose.position());
    }

    @Override
    public void onTileChanged(TileSnapshot tile) {
        switch (tile.kind()) {
            case SWITCH:
                log.info("Switch at {} turned {}", tile.position(), tile.on() ? "ON" : "OFF");
                break;
            case BRIDGE:
                log.info("Bridge at {} now {}", tile.position(), tile.active() ? "active" : "inactive");
                break;
            case WEAK_FLOOR:
                log.info("Weak floor at {}: {} steps remaining", tile.position(), tile.stepsRemaining());
                break;
            case AIR:
                log.info("Floor at {} broke", tile.position());
                break;
            default:
                log.debug("Tile changed: {}", tile);
        }
    }

    @Override
    public void onSequenceCompleted(int stepCount) {
        log.info("--- SEQUENCE COMPLETE after {} steps ---", stepCount);
    }

    @Override
    public void onSequenceFailed(FailureReason reason) {
        log.info("--- SEQUENCE FAILED ({}) ---", reason);
    }

    @Override
    public void onLevelCompleted(int stepsTaken, int levelIndex) {
        log.info("Level {} passed in {} steps", levelIndex + 1, stepsTaken);
    }

    @Override
    public void onAllLevelsCompleted() {
        log.info("All levels completed");
    }

    @Override
    public void onError(PuzzleErrorEvent event) {
        log.error("Puzzle error: {}", event.message(), event.cause());
    }
}
