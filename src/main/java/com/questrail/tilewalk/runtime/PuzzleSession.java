package com.questrail.tilewalk.runtime;

import com.questrail.tilewalk.api.GridPosition;
import com.questrail.tilewalk.api.PlayerPose;
import com.questrail.tilewalk.api.PuzzleController;
import com.questrail.tilewalk.api.RunState;
import com.questrail.tilewalk.board.Board;
import com.questrail.tilewalk.board.Tile;
import com.questrail.tilewalk.config.PuzzleRuntimeConfig;
import com.questrail.tilewalk.interpreter.CommandInterpreter;
import com.questrail.tilewalk.interpreter.LevelTransitions;
import com.questrail.tilewalk.internal.time.MonotonicClock;
import com.questrail.tilewalk.internal.time.MonotonicScheduler;
import com.questrail.tilewalk.internal.time.ScheduledExecutorScheduler;
import com.questrail.tilewalk.internal.time.SystemMonotonicClock;
import com.questrail.tilewalk.internal.time.WallClock;
import com.questrail.tilewalk.internal.time.SystemWallClock;
import com.questrail.tilewalk.level.LevelLoadException;
import com.questrail.tilewalk.level.LevelLoader;
import com.questrail.tilewalk.level.LoadedLevel;
import com.questrail.tilewalk.observability.NullSignalSink;
import com.questrail.tilewalk.observability.PuzzleErrorEvent;
import com.questrail.tilewalk.observability.PuzzleSignalSink;
import com.questrail.tilewalk.progress.ProgressStoreException;
import com.questrail.tilewalk.program.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * PuzzleSession
 * =============================================================================
 * Composition root and lifecycle owner for a game: the level catalog, the
 * board of the current level and the interpreter running on it.
 *
 * <h2>Level lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} begins a progress session and loads the first level.</li>
 *   <li>Every load builds a brand-new board and interpreter. Restarting a level
 *       is a full reload; nothing of the previous attempt survives, including
 *       the step counter.</li>
 *   <li>A failed run reloads the current level. A completed run reports
 *       level-completed, records progress and loads the next level, or reports
 *       all-levels-completed after the last one.</li>
 * </ul>
 *
 * <h2>Transitions</h2>
 * Reloads triggered by a run's outcome are handed to the transition runner
 * supplied at build time, which may play a scene transition and invoke the
 * reload when it sees fit. The default runs the reload at once.
 *
 * <h2>Threading</h2>
 * Level loads are serialized on an internal monitor. Run control delegates to
 * the current interpreter without holding that monitor, so a reload triggered
 * from the scheduler thread can never deadlock against a caller.
 */
public final class PuzzleSession implements PuzzleController {
    private static final Logger log = LoggerFactory.getLogger(PuzzleSession.class);

    private final PuzzleRuntimeConfig config;
    private final PuzzleSignalSink signals;
    private final LevelLoader loader;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final ScheduledExecutorService ownedExecutor;
    private final WallClock wallClock;
    private final Consumer<Runnable> transitionRunner;

    private final Object lifecycleLock = new Object();
    private volatile ActiveLevel active;

    private PuzzleSession(Builder builder, MonotonicClock clock, MonotonicScheduler scheduler,
                          ScheduledExecutorService ownedExecutor) {
        this.config = builder.config;
        this.signals = builder.signals;
        this.loader = builder.loader;
        this.wallClock = builder.wallClock;
        this.transitionRunner = builder.transitionRunner;
        this.clock = clock;
        this.scheduler = scheduler;
        this.ownedExecutor = ownedExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Begins a progress session for the configured player and loads level 0.
     *
     * @throws LevelLoadException if the first level is invalid
     */
    public void start() {
        config.progressStore().beginSession(config.playerName());
        loadLevel(0);
    }

    /**
     * Halts any run in progress and replaces the board with a fresh load of
     * level {@code index}.
     *
     * @throws IndexOutOfBoundsException if the catalog has no such level
     * @throws LevelLoadException        if the level is invalid; no level is
     *                                   active afterwards
     */
    public void loadLevel(int index) {
        if (index < 0 || index >= config.levels().size()) {
            throw new IndexOutOfBoundsException("No level " + index + " in a catalog of " + config.levels().size());
        }

        synchronized (lifecycleLock) {
            ActiveLevel previous = active;
            if (previous != null) {
                previous.interpreter.halt();
            }

            log.debug("Loading level {}...", index + 1);
            final LoadedLevel level;
            try {
                level = loader.load(config.levels().level(index));
            } catch (LevelLoadException e) {
                active = null;
                signals.onError(new PuzzleErrorEvent(wallClock.now(),
                        "Level " + (index + 1) + " failed to load: " + e.getMessage(), e));
                throw e;
            }

            // The halted board stays queryable until the new one replaces it.
            active = new ActiveLevel(index, level);
            signals.onLevelLoaded(index, level.startPose());
        }
    }

    /**
     * Reloads the current level from scratch.
     *
     * @throws IllegalStateException if no level is active
     */
    public void restartLevel() {
        loadLevel(requireActive().index);
    }

    /**
     * Halts the current run and releases the scheduler thread if this session
     * created it. The session cannot run programs afterwards.
     */
    public void stop() {
        ActiveLevel current = active;
        if (current != null) {
            current.interpreter.halt();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    // ---------------------------------------------------------------------
    // PuzzleController
    // ---------------------------------------------------------------------

    @Override
    public boolean run(List<Command> commands) {
        return requireActive().interpreter.run(commands);
    }

    @Override
    public void halt() {
        ActiveLevel current = active;
        if (current != null) {
            current.interpreter.halt();
        }
    }

    @Override
    public RunState runState() {
        return requireActive().interpreter.state();
    }

    @Override
    public PlayerPose playerPose() {
        return requireActive().interpreter.pose();
    }

    @Override
    public Optional<Tile> tileAt(GridPosition position) {
        return requireActive().level.board().tileAt(position);
    }

    @Override
    public int boardWidth() {
        return requireActive().level.board().width();
    }

    @Override
    public int boardHeight() {
        return requireActive().level.board().height();
    }

    // ---------------------------------------------------------------------
    // Further queries
    // ---------------------------------------------------------------------

    public boolean hasActiveLevel() {
        return active != null;
    }

    /**
     * Zero-based index of the level on the board.
     */
    public int currentLevelIndex() {
        return requireActive().index;
    }

    public int levelCount() {
        return config.levels().size();
    }

    public Board board() {
        return requireActive().level.board();
    }

    /**
     * Steps taken on the current board, across every run on it.
     */
    public int stepCount() {
        return requireActive().interpreter.stepCount();
    }

    /**
     * Non-fatal problems found while loading the current level.
     */
    public List<String> loadWarnings() {
        return requireActive().level.warnings();
    }

    public PuzzleRuntimeConfig config() {
        return config;
    }

    private ActiveLevel requireActive() {
        ActiveLevel current = active;
        if (current == null) {
            throw new IllegalStateException("No level is loaded");
        }
        return current;
    }

    // ---------------------------------------------------------------------
    // Run outcomes
    // ---------------------------------------------------------------------

    private void onRestartRequested(ActiveLevel origin) {
        transitionRunner.accept(() -> {
            if (active != origin) {
                log.debug("Ignoring restart of level {}: it is no longer active", origin.index + 1);
                return;
            }
            log.info("Restarting level {}...", origin.index + 1);
            loadLevel(origin.index);
        });
    }

    private void onNextLevelRequested(ActiveLevel origin, int stepsTaken) {
        int index = origin.index;
        signals.onLevelCompleted(stepsTaken, index);

        try {
            config.progressStore().recordLevelPassed(index + 1, stepsTaken);
        } catch (ProgressStoreException e) {
            signals.onError(new PuzzleErrorEvent(wallClock.now(), "Failed to record progress", e));
        }

        if (config.levels().isLast(index)) {
            signals.onAllLevelsCompleted();
            return;
        }

        transitionRunner.accept(() -> {
            if (active != origin) {
                log.debug("Ignoring advance from level {}: it is no longer active", index + 1);
                return;
            }
            loadLevel(index + 1);
        });
    }

    /**
     * The board, interpreter and index of the level currently in play.
     */
    private final class ActiveLevel implements LevelTransitions {
        private final int index;
        private final LoadedLevel level;
        private final CommandInterpreter interpreter;

        private ActiveLevel(int index, LoadedLevel level) {
            this.index = index;
            this.level = level;
            this.interpreter = new CommandInterpreter(
                    level.board(),
                    level.startPose(),
                    clock,
                    scheduler,
                    config.pacing(),
                    signals,
                    this);
        }

        @Override
        public void requestRestart() {
            onRestartRequested(this);
        }

        @Override
        public void requestNextLevel(int stepsTaken) {
            onNextLevelRequested(this, stepsTaken);
        }
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private PuzzleRuntimeConfig config;
        private PuzzleSignalSink signals = NullSignalSink.INSTANCE;
        private LevelLoader loader = new LevelLoader();
        private MonotonicClock clock;
        private MonotonicScheduler scheduler;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Consumer<Runnable> transitionRunner = Runnable::run;

        public Builder withConfig(PuzzleRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSignalSink(PuzzleSignalSink signals) {
            this.signals = signals;
            return this;
        }

        public Builder withLevelLoader(LevelLoader loader) {
            this.loader = loader;
            return this;
        }

        /**
         * Drive pacing from an external clock and scheduler (a game loop, or a
         * deterministic scheduler in tests). When omitted the session creates
         * and owns a single-threaded scheduled executor.
         */
        public Builder withScheduler(MonotonicClock clock, MonotonicScheduler scheduler) {
            this.clock = clock;
            this.scheduler = scheduler;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * How reloads after a run are carried out. The runner receives the
         * reload and must invoke it exactly once, immediately or after a scene
         * transition.
         */
        public Builder withTransitionRunner(Consumer<Runnable> transitionRunner) {
            this.transitionRunner = transitionRunner;
            return this;
        }

        public PuzzleSession build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(signals, "signals");
            Objects.requireNonNull(loader, "loader");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(transitionRunner, "transitionRunner");

            if (scheduler != null) {
                return new PuzzleSession(this, Objects.requireNonNull(clock, "clock"), scheduler, null);
            }

            MonotonicClock systemClock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "tilewalk-interpreter");
                thread.setDaemon(true);
                return thread;
            });
            return new PuzzleSession(this, systemClock,
                    new ScheduledExecutorScheduler(executor, systemClock), executor);
        }
    }
}
