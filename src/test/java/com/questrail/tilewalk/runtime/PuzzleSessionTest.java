package com.questrail.tilewalk.runtime;

import com.questrail.tilewalk.api.Direction;
import com.questrail.tilewalk.api.FailureReason;
import com.questrail.tilewalk.api.GridPosition;
import com.questrail.tilewalk.api.PlayerPose;
import com.questrail.tilewalk.api.RunState;
import com.questrail.tilewalk.board.TileSnapshot;
import com.questrail.tilewalk.board.TileTemplate;
import com.questrail.tilewalk.config.PuzzleRuntimeConfig;
import com.questrail.tilewalk.interpreter.PacingPolicy;
import com.questrail.tilewalk.level.LevelCatalog;
import com.questrail.tilewalk.level.LevelLoadException;
import com.questrail.tilewalk.level.LevelSource;
import com.questrail.tilewalk.level.TileDefinition;
import com.questrail.tilewalk.observability.CompositeSignalSink;
import com.questrail.tilewalk.observability.PuzzleErrorEvent;
import com.questrail.tilewalk.observability.PuzzleSignalSink;
import com.questrail.tilewalk.observability.RecordingSignalSink;
import com.questrail.tilewalk.program.Command;
import com.questrail.tilewalk.progress.InMemoryProgressStore;
import com.questrail.tilewalk.progress.ProgressStoreException;
import com.questrail.tilewalk.progress.SessionProgress;
import com.questrail.tilewalk.time.DeterministicScheduler;
import com.questrail.tilewalk.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PuzzleSessionTest
 * -----------------------------------------------------------------------------
 * Level lifecycle through the session: restarts after failure, advancing after
 * completion, progress bookkeeping and transition hand-off.
 */
class PuzzleSessionTest
{
    private static final long STEP_MILLIS = 50;

    private static final LevelSource ONE_STEP = compact("Right", "SE");
    private static final LevelSource TWO_STEPS = compact("Right", "S.E");

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingSignalSink signals;
    private InMemoryProgressStore progress;
    private final List<Runnable> deferredTransitions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        signals = new RecordingSignalSink();
        progress = new InMemoryProgressStore();
        deferredTransitions.clear();
    }

    private static LevelSource compact(String direction, String... rows) {
        return new LevelSource.CompactLevel(List.of(rows), List.of(), direction);
    }

    private PuzzleRuntimeConfig config(LevelSource... levels) {
        return PuzzleRuntimeConfig.builder()
                .withLevels(LevelCatalog.of(levels))
                .withPacing(PacingPolicy.withStepDelay(Duration.ofMillis(STEP_MILLIS)))
                .withProgressStore(progress)
                .withPlayerName("Ada")
                .build();
    }

    private PuzzleSession session(LevelSource... levels) {
        return PuzzleSession.builder()
                .withConfig(config(levels))
                .withSignalSink(signals)
                .withScheduler(clock, scheduler)
                .build();
    }

    private PuzzleSession deferredSession(LevelSource... levels) {
        return PuzzleSession.builder()
                .withConfig(config(levels))
                .withSignalSink(signals)
                .withScheduler(clock, scheduler)
                .withTransitionRunner(deferredTransitions::add)
                .build();
    }

    private void finish() {
        scheduler.runUntilIdle(STEP_MILLIS, 1_000);
    }

    // ---------------------------------------------------------------------
    // Start
    // ---------------------------------------------------------------------

    @Test
    void startBeginsASessionAndLoadsTheFirstLevel() {
        PuzzleSession session = session(TWO_STEPS, ONE_STEP);

        session.start();

        assertEquals("Ada", progress.current().orElseThrow().playerName());
        assertEquals(0, session.currentLevelIndex());
        assertEquals(2, session.levelCount());
        assertEquals(List.of(0), signals.levelsLoaded());
        assertEquals(RunState.IDLE, session.runState());
        assertEquals(new PlayerPose(GridPosition.ORIGIN, Direction.RIGHT), session.playerPose());
        assertEquals(3, session.boardWidth());
        assertEquals(1, session.boardHeight());
        assertTrue(session.tileAt(GridPosition.of(1, 0)).isPresent());
    }

    // ---------------------------------------------------------------------
    // Completion
    // ---------------------------------------------------------------------

    @Test
    void completingALevelRecordsProgressAndLoadsTheNext() {
        PuzzleSession session = session(TWO_STEPS, ONE_STEP);
        session.start();

        session.run(List.of(Command.moveForward(), Command.moveForward()));
        finish();

        assertEquals(1, signals.levelsCompleted().size());
        assertArrayEquals(new int[]{2, 0}, signals.levelsCompleted().get(0));
        SessionProgress ada = progress.current().orElseThrow();
        assertEquals(1, ada.levelsPassed());
        assertEquals(2, ada.totalSteps());

        assertEquals(1, session.currentLevelIndex());
        assertEquals(List.of(0, 1), signals.levelsLoaded());
        assertEquals(RunState.IDLE, session.runState());
        assertEquals(0, session.stepCount());
    }

    @Test
    void completingTheLastLevelReportsAllLevelsCompleted() {
        PuzzleSession session = session(TWO_STEPS, ONE_STEP);
        session.start();

        session.run(List.of(Command.moveForward(), Command.moveForward()));
        finish();
        session.run(List.of(Command.moveForward()));
        finish();

        assertEquals(1, signals.count("allLevelsCompleted"));
        assertEquals(1, session.currentLevelIndex(), "the last board stays in place");
        assertEquals(RunState.COMPLETED, session.runState());

        SessionProgress ada = progress.current().orElseThrow();
        assertEquals(2, ada.levelsPassed());
        assertEquals(3, ada.totalSteps());

        List<String> tail = signals.namesWithout("stepTaken", "poseChanged");
        assertEquals(List.of("sequenceCompleted", "levelCompleted", "allLevelsCompleted"),
                tail.subList(tail.size() - 3, tail.size()));
    }

    @Test
    void stepsFromEarlierRunsOnTheSameBoardCount() {
        PuzzleSession session = session(compact("Right", "S..E"));
        session.start();

        session.run(List.of(Command.moveForward(), Command.moveForward(), Command.moveForward()));
        session.halt();
        assertEquals(RunState.HALTED, session.runState());

        session.run(List.of(Command.moveForward(), Command.moveForward()));
        finish();

        assertEquals(3, progress.current().orElseThrow().totalSteps());
    }

    // ---------------------------------------------------------------------
    // Failure
    // ---------------------------------------------------------------------

    @Test
    void failureReloadsTheSameLevelFromScratch() {
        PuzzleSession session = session(TWO_STEPS, ONE_STEP);
        session.start();
        assertTrue(session.loadWarnings().isEmpty());

        session.run(List.of(Command.moveForward()));
        finish();

        assertEquals(List.of(FailureReason.ENDED_OFF_TARGET), signals.failures());
        assertEquals(List.of(0, 0), signals.levelsLoaded());
        assertEquals(0, session.currentLevelIndex());
        assertEquals(RunState.IDLE, session.runState());
        assertEquals(0, session.stepCount());
        assertEquals(GridPosition.ORIGIN, session.playerPose().position());
    }

    @Test
    void restartLevelResetsTileState() {
        LevelSource switchLevel = new LevelSource.CompactLevel(List.of("SW1B1E"), List.of(
                new TileDefinition("W1", TileTemplate.switchTile(1)),
                new TileDefinition("B1", TileTemplate.bridge(1, true, false))), "Right");
        PuzzleSession session = session(switchLevel);
        session.start();

        session.run(List.of(Command.moveForward(), Command.moveForward()));
        session.halt();
        assertTrue(session.tileAt(GridPosition.of(1, 0)).orElseThrow().isOn());
        assertTrue(session.tileAt(GridPosition.of(2, 0)).orElseThrow().isActive());

        session.restartLevel();

        assertFalse(session.tileAt(GridPosition.of(1, 0)).orElseThrow().isOn());
        assertFalse(session.tileAt(GridPosition.of(2, 0)).orElseThrow().isActive());
        assertEquals(GridPosition.ORIGIN, session.playerPose().position());
        assertFalse(scheduler.hasPendingTasks(), "the old run is gone");
    }

    @Test
    void reloadHaltsARunInProgress() {
        PuzzleSession session = session(compact("Right", "S...E"));
        session.start();

        session.run(List.of(Command.loop(4, Command.moveForward())));
        session.loadLevel(0);
        finish();

        assertEquals(List.of(0, 0), signals.levelsLoaded());
        assertEquals(GridPosition.ORIGIN, session.playerPose().position());
        assertEquals(0, signals.count("levelCompleted"));
        assertTrue(signals.failures().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    @Test
    void reloadWaitsForTheTransitionRunner() {
        PuzzleSession session = deferredSession(compact("Left", "S.E"));
        session.start();

        session.run(List.of(Command.moveForward()));

        assertEquals(List.of(FailureReason.FELL), signals.failures());
        assertEquals(RunState.FAILED, session.runState(), "failed board is still shown");
        assertEquals(1, deferredTransitions.size());

        deferredTransitions.get(0).run();

        assertEquals(List.of(0, 0), signals.levelsLoaded());
        assertEquals(RunState.IDLE, session.runState());
    }

    @Test
    void staleTransitionIsIgnored() {
        PuzzleSession session = deferredSession(compact("Left", "S.E"), ONE_STEP);
        session.start();
        session.run(List.of(Command.moveForward()));

        session.loadLevel(1);
        deferredTransitions.get(0).run();

        assertEquals(List.of(0, 1), signals.levelsLoaded());
        assertEquals(1, session.currentLevelIndex());
    }

    @Test
    void levelCompletedIsReportedBeforeTheTransition() {
        PuzzleSession session = deferredSession(ONE_STEP, TWO_STEPS);
        session.start();

        session.run(List.of(Command.moveForward()));
        finish();

        assertEquals(1, signals.count("levelCompleted"));
        assertEquals(1, progress.current().orElseThrow().levelsPassed());
        assertEquals(0, session.currentLevelIndex());

        deferredTransitions.get(0).run();
        assertEquals(1, session.currentLevelIndex());
    }

    // ---------------------------------------------------------------------
    // Errors
    // ---------------------------------------------------------------------

    @Test
    void invalidLevelIsReportedAndLeavesNoBoard() {
        PuzzleSession session = session(ONE_STEP, compact("Up", "..E"));
        session.start();

        assertThrows(LevelLoadException.class, () -> session.loadLevel(1));

        assertFalse(session.hasActiveLevel());
        assertEquals(1, signals.errors().size());
        assertInstanceOf(LevelLoadException.class, signals.errors().get(0).cause());
        assertThrows(IllegalStateException.class, session::runState);
        assertDoesNotThrow(session::halt);
    }

    @Test
    void levelIndexOutsideTheCatalogIsRejected() {
        PuzzleSession session = session(ONE_STEP);

        assertThrows(IndexOutOfBoundsException.class, () -> session.loadLevel(1));
        assertThrows(IndexOutOfBoundsException.class, () -> session.loadLevel(-1));
    }

    @Test
    void progressFailureIsReportedAndPlayGoesOn() {
        progress = new InMemoryProgressStore() {
            @Override
            public synchronized SessionProgress recordLevelPassed(int levelNumber, int steps) {
                throw new ProgressStoreException("disk full", null);
            }
        };
        PuzzleSession session = session(ONE_STEP, TWO_STEPS);
        session.start();

        session.run(List.of(Command.moveForward()));
        finish();

        assertEquals(1, signals.errors().size());
        assertEquals(1, session.currentLevelIndex());
    }

    @Test
    void runWhileRunningIsRejectedThroughTheSession() {
        PuzzleSession session = session(compact("Right", "S..E"));
        session.start();

        assertTrue(session.run(List.of(Command.moveForward(), Command.moveForward(), Command.moveForward())));
        assertFalse(session.run(List.of(Command.turnLeft())));
        assertEquals(RunState.RUNNING, session.runState());
    }

    // ---------------------------------------------------------------------
    // Real scheduler
    // ---------------------------------------------------------------------

    @Test
    void ownedSchedulerPlaysThroughEveryLevel() throws InterruptedException {
        AllLevelsLatch done = new AllLevelsLatch();
        PuzzleSession session = PuzzleSession.builder()
                .withConfig(PuzzleRuntimeConfig.builder()
                        .withLevels(LevelCatalog.of(ONE_STEP, ONE_STEP))
                        .withPacing(PacingPolicy.withStepDelay(Duration.ofMillis(5)))
                        .withProgressStore(progress)
                        .build())
                .withSignalSink(CompositeSignalSink.of(signals, done))
                .build();
        try {
            session.start();
            session.run(List.of(Command.moveForward()));
            awaitLevel(session, 1);
            session.run(List.of(Command.moveForward()));

            assertTrue(done.latch.await(5, TimeUnit.SECONDS), "all levels should complete");
            assertEquals(2, progress.current().orElseThrow().levelsPassed());
            assertEquals("Player", progress.current().orElseThrow().playerName());
        } finally {
            session.stop();
        }
    }

    private static void awaitLevel(PuzzleSession session, int index) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (session.hasActiveLevel()
                    && session.currentLevelIndex() == index
                    && session.runState() == RunState.IDLE) {
                return;
            }
            Thread.sleep(5);
        }
        fail("level " + index + " was not loaded in time");
    }

    /** Releases once the last level is passed. */
    private static final class AllLevelsLatch implements PuzzleSignalSink {
        final CountDownLatch latch = new CountDownLatch(1);

        @Override public void onLevelLoaded(int levelIndex, PlayerPose startPose) { }
        @Override public void onSequenceStarted() { }
        @Override public void onStepTaken(int stepCount) { }
        @Override public void onPoseChanged(PlayerPose pose) { }
        @Override public void onMoveBlocked(PlayerPose pose) { }
        @Override public void onTileChanged(TileSnapshot tile) { }
        @Override public void onSequenceCompleted(int stepCount) { }
        @Override public void onSequenceFailed(FailureReason reason) { }
        @Override public void onLevelCompleted(int stepsTaken, int levelIndex) { }
        @Override public void onAllLevelsCompleted() { latch.countDown(); }
        @Override public void onError(PuzzleErrorEvent event) { }
    }
}
