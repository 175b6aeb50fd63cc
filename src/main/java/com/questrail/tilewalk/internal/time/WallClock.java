package com.questrail.tilewalk.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used only to timestamp diagnostics. Never used for pacing.
 */
public interface WallClock
{
    Instant now();
}
