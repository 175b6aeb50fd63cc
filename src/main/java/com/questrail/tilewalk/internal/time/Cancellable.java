package com.questrail.tilewalk.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a pending scheduled continuation.
 *
 * <p>
 * The interpreter holds exactly one of these between steps: the continuation
 * that will run the next command once the pacing delay has elapsed. Halting a
 * run cancels it, which is how a halt during the inter-step pause keeps the
 * next command from ever starting.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
