package com.questrail.tilewalk.config;

import com.questrail.tilewalk.interpreter.PacingPolicy;
import com.questrail.tilewalk.level.LevelCatalog;
import com.questrail.tilewalk.progress.InMemoryProgressStore;
import com.questrail.tilewalk.progress.ProgressStore;

import java.util.Objects;

/**
 * Aggregated configuration for a puzzle session.
 */
public record PuzzleRuntimeConfig(
    LevelCatalog levels,
    PacingPolicy pacing,
    ProgressStore progressStore,
    String playerName
) {
    public PuzzleRuntimeConfig {
        Objects.requireNonNull(levels, "levels");
        Objects.requireNonNull(pacing, "pacing");
        Objects.requireNonNull(progressStore, "progressStore");
        Objects.requireNonNull(playerName, "playerName");
        if (playerName.isBlank()) {
            throw new IllegalArgumentException("playerName must not be blank");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LevelCatalog levels;
        private PacingPolicy pacing = PacingPolicy.defaults();
        private ProgressStore progressStore;
        private String playerName = "Player";

        public Builder withLevels(LevelCatalog levels) {
            this.levels = levels;
            return this;
        }

        public Builder withPacing(PacingPolicy pacing) {
            this.pacing = pacing;
            return this;
        }

        public Builder withProgressStore(ProgressStore progressStore) {
            this.progressStore = progressStore;
            return this;
        }

        public Builder withPlayerName(String playerName) {
            this.playerName = playerName;
            return this;
        }

        public PuzzleRuntimeConfig build() {
            ProgressStore store = progressStore != null ? progressStore : new InMemoryProgressStore();
            return new PuzzleRuntimeConfig(levels, pacing, store, playerName);
        }
    }
}
