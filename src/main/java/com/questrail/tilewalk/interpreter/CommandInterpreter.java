package com.questrail.tilewalk.interpreter;

import com.questrail.tilewalk.api.FailureReason;
import com.questrail.tilewalk.api.GridPosition;
import com.questrail.tilewalk.api.MoveResult;
import com.questrail.tilewalk.api.PlayerPose;
import com.questrail.tilewalk.api.RunState;
import com.questrail.tilewalk.api.TileKind;
import com.questrail.tilewalk.board.Board;
import com.questrail.tilewalk.board.LandingResult;
import com.questrail.tilewalk.internal.time.Cancellable;
import com.questrail.tilewalk.internal.time.MonotonicClock;
import com.questrail.tilewalk.internal.time.MonotonicScheduler;
import com.questrail.tilewalk.observability.NullSignalSink;
import com.questrail.tilewalk.observability.PuzzleSignalSink;
import com.questrail.tilewalk.program.Command;
import com.questrail.tilewalk.program.Programs;
import com.questrail.tilewalk.program.StepAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * CommandInterpreter
 * =============================================================================
 * Runs a command program against a {@link Board}, one paced step at a time.
 *
 * <h2>State machine</h2>
 * <pre>
 *   IDLE ──run──▶ RUNNING ──▶ COMPLETED | FAILED
 *                    └──halt──▶ HALTED
 * </pre>
 * A run may be started from any state except {@link RunState#RUNNING}; a
 * second {@link #run(List)} while running is rejected and logged.
 *
 * <h2>Execution model</h2>
 * <ul>
 *   <li>Loops are expanded depth first on an explicit frame stack.</li>
 *   <li>After every atomic step the continuation is handed to the
 *       {@link MonotonicScheduler} with the policy's step delay. That pause is
 *       the only suspend point.</li>
 *   <li>Every continuation carries the run generation it was scheduled for.
 *       Halting, failing or finishing bumps the generation, so a continuation
 *       that was already queued finds itself stale and does nothing.</li>
 * </ul>
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>Blocked move: not a failure, the run goes on.</li>
 *   <li>Fall, or a weak floor breaking underfoot: the whole expansion is
 *       dropped at once, the run fails and a restart is requested.</li>
 *   <li>Program exhausted on the end tile: completed, next level requested.</li>
 *   <li>Program exhausted anywhere else: failed, restart requested.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * All state transitions happen under one monitor. Signals are delivered while
 * it is held; {@link LevelTransitions} are invoked after it is released.
 * An exception thrown by a sink aborts the run: the state becomes
 * {@link RunState#FAILED} and the exception is rethrown to the caller, or to
 * the scheduler when it surfaced in a paced step.
 */
public final class CommandInterpreter
{
    private static final Logger log = LoggerFactory.getLogger(CommandInterpreter.class);

    private final Board board;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final PacingPolicy pacing;
    private final PuzzleSignalSink signals;
    private final LevelTransitions transitions;

    private final Object lock = new Object();
    private final Deque<ExecutionFrame> frames = new ArrayDeque<>();

    private RunState state = RunState.IDLE;
    private PlayerPose pose;
    private int stepCount;
    private long generation;
    private Cancellable pendingStep;
    private boolean passedEndTile;

    public CommandInterpreter(Board board,
                              PlayerPose startPose,
                              MonotonicClock clock,
                              MonotonicScheduler scheduler,
                              PacingPolicy pacing,
                              PuzzleSignalSink signals,
                              LevelTransitions transitions)
    {
        this.board = Objects.requireNonNull(board, "board");
        this.pose = Objects.requireNonNull(startPose, "startPose");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.pacing = Objects.requireNonNull(pacing, "pacing");
        this.signals = Objects.requireNonNullElse(signals, NullSignalSink.INSTANCE);
        this.transitions = Objects.requireNonNullElse(transitions, LevelTransitions.NONE);
    }

    // ---------------------------------------------------------------------
    // Run control
    // ---------------------------------------------------------------------

    /**
     * Starts executing {@code commands}. The first command runs on the calling
     * thread; later ones run on the scheduler once their pacing delay elapses.
     *
     * @return {@code false} if a run is already in progress (nothing happens)
     */
    public boolean run(List<Command> commands) {
        Objects.requireNonNull(commands, "commands");

        Runnable followUp;
        synchronized (lock) {
            if (state == RunState.RUNNING) {
                log.warn("Run rejected: a sequence is already running");
                return false;
            }

            state = RunState.RUNNING;
            long runGeneration = ++generation;
            frames.clear();
            frames.push(ExecutionFrame.program(commands));
            passedEndTile = false;

            log.debug("Starting sequence: {} top-level commands, {} steps if nothing fails, loop depth {}",
                    commands.size(), Programs.expandedStepCount(commands), Programs.loopDepth(commands));
            try {
                signals.onSequenceStarted();
                followUp = continueRun(runGeneration);
            } catch (RuntimeException e) {
                throw abort(e);
            }
        }
        runOutsideLock(followUp);
        return true;
    }

    /**
     * Stops the current run immediately, however deep in nested loops it is,
     * and cancels the pending continuation. Emits no signal and requests no
     * transition. Idempotent.
     *
     * @return {@code true} if a run was actually stopped
     */
    public boolean halt() {
        synchronized (lock) {
            if (state != RunState.RUNNING) {
                return false;
            }
            state = RunState.HALTED;
            abandonExpansion();
            log.debug("Sequence halted after {} steps", stepCount);
            return true;
        }
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public RunState state() {
        synchronized (lock) {
            return state;
        }
    }

    public PlayerPose pose() {
        synchronized (lock) {
            return pose;
        }
    }

    /**
     * Steps taken on this board so far, across all runs.
     */
    public int stepCount() {
        synchronized (lock) {
            return stepCount;
        }
    }

    public Board board() {
        return board;
    }

    // ---------------------------------------------------------------------
    // Expansion
    // ---------------------------------------------------------------------

    private void resume(long runGeneration) {
        Runnable followUp;
        synchronized (lock) {
            try {
                followUp = continueRun(runGeneration);
            } catch (RuntimeException e) {
                throw abort(e);
            }
        }
        runOutsideLock(followUp);
    }

    /**
     * A step threw part way through, usually from a signal sink. The run is
     * marked failed without further signals or transitions so that the next
     * {@link #run(List)} is accepted. Must be called with {@link #lock} held.
     */
    private RuntimeException abort(RuntimeException cause) {
        if (state == RunState.RUNNING) {
            state = RunState.FAILED;
            abandonExpansion();
        }
        log.error("Sequence aborted after {} steps", stepCount, cause);
        return cause;
    }

    /**
     * Walks the frame stack up to and including the next atomic step, then
     * schedules the continuation. Must be called with {@link #lock} held.
     *
     * @return a transition to trigger once the lock is released, or {@code null}
     */
    private Runnable continueRun(long runGeneration) {
        if (runGeneration != generation || state != RunState.RUNNING) {
            return null;
        }
        pendingStep = null;

        while (true) {
            ExecutionFrame frame = frames.peek();
            if (frame == null) {
                return finishRun();
            }

            Command next = frame.next();
            if (next == null) {
                frames.pop();
                continue;
            }

            if (next instanceof Command.Loop loop) {
                log.debug("Entering loop (x{})", loop.repeatCount());
                frames.push(ExecutionFrame.loop(loop));
                continue;
            }

            Runnable followUp = executeStep(((Command.Step) next).action());
            if (state != RunState.RUNNING) {
                return followUp;
            }

            pendingStep = scheduler.scheduleAfter(pacing.stepDelay(), clock, () -> resume(runGeneration));
            return null;
        }
    }

    private Runnable executeStep(StepAction action) {
        stepCount++;
        signals.onStepTaken(stepCount);

        switch (action) {
            case TURN_LEFT:
                pose = pose.turnedLeft();
                signals.onPoseChanged(pose);
                return null;
            case TURN_RIGHT:
                pose = pose.turnedRight();
                signals.onPoseChanged(pose);
                return null;
            case MOVE_FORWARD:
                return moveForward();
            default:
                throw new IllegalStateException("Unhandled action: " + action);
        }
    }

    private Runnable moveForward() {
        GridPosition target = pose.ahead();
        MoveResult result = board.checkMove(target);

        switch (result) {
            case BLOCKED:
                log.debug("Move to {} blocked by a wall", target);
                signals.onMoveBlocked(pose);
                return null;

            case FALL:
                log.debug("Fell moving to {}", target);
                return fail(FailureReason.FELL);

            case SUCCESS:
                pose = pose.movedTo(target);
                signals.onPoseChanged(pose);

                LandingResult landing = board.onPlayerLanded(target);
                landing.changedTiles().forEach(signals::onTileChanged);

                if (landing.isUnsafe()) {
                    log.debug("Floor at {} collapsed", target);
                    return fail(FailureReason.FLOOR_COLLAPSED);
                }
                if (landing.isLevelComplete()) {
                    passedEndTile = true;
                }
                return null;

            default:
                throw new IllegalStateException("Unhandled move result: " + result);
        }
    }

    private Runnable finishRun() {
        boolean onEnd = board.tileAt(pose.position())
                .map(tile -> tile.is(TileKind.END))
                .orElse(false);

        if (!onEnd) {
            if (passedEndTile) {
                log.debug("Reached the end tile but did not stop there");
            }
            return fail(FailureReason.ENDED_OFF_TARGET);
        }

        state = RunState.COMPLETED;
        abandonExpansion();
        signals.onSequenceCompleted(stepCount);

        int steps = stepCount;
        return () -> transitions.requestNextLevel(steps);
    }

    private Runnable fail(FailureReason reason) {
        state = RunState.FAILED;
        abandonExpansion();
        signals.onSequenceFailed(reason);
        return transitions::requestRestart;
    }

    private void abandonExpansion() {
        generation++;
        frames.clear();
        Cancellable pending = pendingStep;
        if (pending != null) {
            pending.cancel();
            pendingStep = null;
        }
    }

    private static void runOutsideLock(Runnable followUp) {
        if (followUp != null) {
            followUp.run();
        }
    }
}
