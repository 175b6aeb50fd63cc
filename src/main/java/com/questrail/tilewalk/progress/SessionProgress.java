package com.questrail.tilewalk.progress;

import java.util.Objects;

/**
 * Progress of one play session: who played, how far they got and how many
 * steps it took them in total.
 *
 * @param playerName   display name, unique case-insensitively across sessions
 * @param levelsPassed highest level number passed (one-based; zero for none)
 * @param totalSteps   steps summed over every passed level
 */
public record SessionProgress(String playerName, int levelsPassed, int totalSteps)
{
    public SessionProgress {
        Objects.requireNonNull(playerName, "playerName");
        if (levelsPassed < 0) {
            throw new IllegalArgumentException("levelsPassed must be >= 0");
        }
        if (totalSteps < 0) {
            throw new IllegalArgumentException("totalSteps must be >= 0");
        }
    }

    public static SessionProgress fresh(String playerName) {
        return new SessionProgress(playerName, 0, 0);
    }

    /**
     * Progress after passing level {@code levelNumber} in {@code steps} steps.
     * Replaying an earlier level never lowers {@code levelsPassed}; the steps
     * always count.
     */
    public SessionProgress withLevelPassed(int levelNumber, int steps) {
        return new SessionProgress(playerName, Math.max(levelsPassed, levelNumber), totalSteps + steps);
    }

    public SessionProgress withPlayerName(String newName) {
        return new SessionProgress(newName, levelsPassed, totalSteps);
    }
}
