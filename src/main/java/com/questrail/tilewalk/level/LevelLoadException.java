package com.questrail.tilewalk.level;

/**
 * Indicates that a level description could not be turned into a playable
 * board.
 *
 * This typically reflects:
 * <ul>
 *   <li>No start tile, or more than one</li>
 *   <li>An empty layout</li>
 *   <li>An unknown tile kind name</li>
 *   <li>Duplicate or empty definition keys</li>
 *   <li>Malformed level JSON</li>
 * </ul>
 *
 * A level that fails to load must not be played; no player is spawned on it.
 */
public final class LevelLoadException extends RuntimeException
{
    public LevelLoadException(String message) {
        super(message);
    }

    public LevelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
