package com.questrail.tilewalk.internal.time;

/**
 * The clock step delays are measured on when a session paces itself: the one
 * {@code PuzzleSession} pairs with its own executor when no scheduler is
 * supplied. Backed by {@link System#nanoTime()}, so a wall-clock change during
 * a run neither stalls nor rushes the next step. Tests use
 * {@code ManualMonotonicClock}.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
