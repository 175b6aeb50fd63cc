package com.questrail.tilewalk.progress;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ProgressStore} that lives only as long as the process. Also the base
 * for stores that persist the same list elsewhere.
 */
public class InMemoryProgressStore implements ProgressStore
{
    static final String DEFAULT_PLAYER_NAME = "Player";

    private final List<SessionProgress> sessions = new ArrayList<>();
    private int currentIndex = -1;

    public InMemoryProgressStore() {
    }

    protected InMemoryProgressStore(List<SessionProgress> existing) {
        sessions.addAll(existing);
    }

    @Override
    public synchronized SessionProgress beginSession(String playerName) {
        SessionProgress session = SessionProgress.fresh(Objects.requireNonNull(playerName, "playerName"));
        sessions.add(session);
        currentIndex = sessions.size() - 1;
        changed();
        return session;
    }

    @Override
    public synchronized Optional<SessionProgress> current() {
        return currentIndex < 0 ? Optional.empty() : Optional.of(sessions.get(currentIndex));
    }

    @Override
    public synchronized SessionProgress recordLevelPassed(int levelNumber, int steps) {
        if (currentIndex < 0) {
            beginSession(DEFAULT_PLAYER_NAME);
        }
        return replaceCurrent(sessions.get(currentIndex).withLevelPassed(levelNumber, steps));
    }

    @Override
    public synchronized SessionProgress renameCurrent(String newName) {
        Objects.requireNonNull(newName, "newName");
        if (currentIndex < 0) {
            throw new IllegalStateException("No session has been begun");
        }
        return replaceCurrent(sessions.get(currentIndex).withPlayerName(newName));
    }

    @Override
    public synchronized List<SessionProgress> allSessions() {
        return List.copyOf(sessions);
    }

    /**
     * Called with the store's monitor held after every change.
     */
    protected void changed() {
    }

    private SessionProgress replaceCurrent(SessionProgress updated) {
        sessions.set(currentIndex, updated);
        changed();
        return updated;
    }
}
