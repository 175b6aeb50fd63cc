package com.questrail.tilewalk.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Runs paced interpreter steps on a {@link ScheduledExecutorService}.
 *
 * <h2>Step pacing</h2>
 * <p>The interpreter asks for its continuation one step delay after the step it
 * just took. The deadline is turned into a relative delay against the supplied
 * {@link MonotonicClock} at the moment of scheduling, so the pause between two
 * steps is measured from when the first one finished, never from when the run
 * started. A deadline already in the past runs the next step at once.</p>
 *
 * <h2>Failing steps</h2>
 * <p>An executor keeps a task's exception inside its future, where nobody is
 * waiting. A step that throws is therefore logged here, with the step's
 * scheduled lateness, before the exception is handed back to the executor.</p>
 *
 * <h2>Executor ownership</h2>
 * <p>The executor is not shut down here. A session that created its own
 * executor stops it in {@code PuzzleSession.stop()}. Back this with a single
 * thread: continuations of one run must never overlap.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {
    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorScheduler.class);

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(
                () -> runStep(deadlineNanos, task), delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    private void runStep(long deadlineNanos, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            long lateMillis = TimeUnit.NANOSECONDS.toMillis(Math.max(0, clock.nowNanos() - deadlineNanos));
            log.error("Paced step failed ({} ms after its deadline)", lateMillis, e);
            throw e;
        }
    }
}
