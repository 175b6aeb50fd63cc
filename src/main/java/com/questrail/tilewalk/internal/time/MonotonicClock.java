package com.questrail.tilewalk.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for step pacing.
 *
 * <p>
 * Pacing deadlines are computed from monotonic ticks only, so a wall-clock
 * adjustment in the middle of a run can neither stall the player nor make it
 * skip ahead.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful relative to each other.
     */
    long nowNanos();
}
