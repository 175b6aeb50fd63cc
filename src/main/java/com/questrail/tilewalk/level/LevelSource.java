package com.questrail.tilewalk.level;

import java.util.List;
import java.util.Objects;

/**
 * LevelSource
 * -----------------------------------------------------------------------------
 * A level description in one of two interchangeable shapes.
 *
 * <ul>
 *   <li>{@link CompactLevel} – rows of symbols plus multi-character keys
 *       defined per level; the format level files are written in.</li>
 *   <li>{@link LiteralLevel} – explicit dimensions and a list of positioned
 *       tiles.</li>
 * </ul>
 *
 * Both carry the start direction as written ({@code null} when absent); the
 * loader resolves it and falls back to up.
 */
public sealed interface LevelSource permits LevelSource.CompactLevel, LevelSource.LiteralLevel
{
    String startDirection();

    /**
     * @param layout         rows, top row first
     * @param definitions    multi-character keys usable in the rows
     * @param startDirection initial facing as written, may be {@code null}
     */
    record CompactLevel(List<String> layout,
                        List<TileDefinition> definitions,
                        String startDirection) implements LevelSource {
        public CompactLevel {
            layout = layout == null ? List.of() : List.copyOf(layout);
            definitions = definitions == null ? List.of() : List.copyOf(definitions);
        }
    }

    /**
     * @param width          grid width
     * @param height         grid height
     * @param tiles          positioned tiles; cells not listed hold no tile
     * @param startDirection initial facing as written, may be {@code null}
     */
    record LiteralLevel(int width,
                        int height,
                        List<TileRecord> tiles,
                        String startDirection) implements LevelSource {
        public LiteralLevel {
            tiles = List.copyOf(Objects.requireNonNull(tiles, "tiles"));
        }
    }
}
