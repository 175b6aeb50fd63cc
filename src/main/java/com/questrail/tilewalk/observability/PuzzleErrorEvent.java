package com.questrail.tilewalk.observability;

import java.time.Instant;

/**
 * Record describing an error or anomaly noticed by the puzzle core, such as a
 * level that failed to load.
 */
public record PuzzleErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
