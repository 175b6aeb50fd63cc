package com.questrail.tilewalk.progress;

import java.util.List;
import java.util.Optional;

/**
 * ProgressStore
 * -----------------------------------------------------------------------------
 * Keeps the progress of every play session, the current one included.
 *
 * <p>
 * The session runtime only ever calls {@link #recordLevelPassed(int, int)};
 * the rest serves menus and score tables outside the puzzle core.
 * </p>
 */
public interface ProgressStore
{
    /**
     * Starts a new session for {@code playerName} and makes it current.
     */
    SessionProgress beginSession(String playerName);

    /**
     * @return the current session, or empty if none was begun
     */
    Optional<SessionProgress> current();

    /**
     * Adds a passed level to the current session, beginning an anonymous
     * session first if there is none.
     *
     * @param levelNumber one-based number of the level passed
     * @param steps       steps taken on it
     * @return the updated current session
     */
    SessionProgress recordLevelPassed(int levelNumber, int steps);

    /**
     * Renames the player of the current session.
     *
     * @throws IllegalStateException if no session was begun
     */
    SessionProgress renameCurrent(String newName);

    /**
     * Every session in the order they were begun.
     */
    List<SessionProgress> allSessions();

    /**
     * Whether any session uses {@code name}, ignoring case.
     */
    default boolean nameExists(String name) {
        return allSessions().stream().anyMatch(s -> s.playerName().equalsIgnoreCase(name));
    }
}
