package com.questrail.tilewalk.level;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The ordered levels of a game. Level indices are zero-based; players see
 * them as {@code index + 1}.
 */
public final class LevelCatalog
{
    private final List<LevelSource> levels;

    private LevelCatalog(List<LevelSource> levels) {
        if (levels.isEmpty()) {
            throw new IllegalArgumentException("A level catalog needs at least one level");
        }
        this.levels = List.copyOf(levels);
    }

    public static LevelCatalog of(List<LevelSource> levels) {
        return new LevelCatalog(Objects.requireNonNull(levels, "levels"));
    }

    public static LevelCatalog of(LevelSource... levels) {
        return new LevelCatalog(List.of(levels));
    }

    /**
     * Reads every resource with {@link LevelJsonReader}, in the order given.
     *
     * @throws LevelLoadException if any resource is missing or malformed
     */
    public static LevelCatalog fromResources(List<String> resourcePaths) {
        LevelJsonReader reader = new LevelJsonReader();
        List<LevelSource> levels = new ArrayList<>();
        for (String path : resourcePaths) {
            levels.add(reader.readResource(path));
        }
        return new LevelCatalog(levels);
    }

    public int size() {
        return levels.size();
    }

    /**
     * @throws IndexOutOfBoundsException for an index outside the catalog
     */
    public LevelSource level(int index) {
        return levels.get(index);
    }

    public boolean isLast(int index) {
        return index == levels.size() - 1;
    }
}
