package com.questrail.tilewalk.level;

import com.questrail.tilewalk.api.GridPosition;
import com.questrail.tilewalk.api.TileKind;
import com.questrail.tilewalk.board.TileTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * CompactLayoutParser
 * ============================================================================
 * Scans the rows of a {@link LevelSource.CompactLevel} into positioned tiles.
 *
 * <h2>Row order</h2>
 * Rows are written top to bottom, the way they read on screen. They are
 * consumed in reverse so that grid {@code y = 0} is the bottom row.
 *
 * <h2>Scanning</h2>
 * Each row keeps two cursors: the grid column and the string index. They
 * advance independently because a multi-character key fills one cell but
 * consumes several characters. At every string index:
 * <ol>
 *   <li>the longest defined key that prefixes the rest of the row wins; its
 *       template fills the cell, the column moves by one and the index by
 *       the key length;</li>
 *   <li>otherwise the single character is looked up in the fixed symbol
 *       table ({@code .} floor, {@code #} wall, {@code S} start, {@code E} end,
 *       space for no tile) and both cursors move by one;</li>
 *   <li>an unknown character leaves the cell empty and is reported as a
 *       warning.</li>
 * </ol>
 * The width is the furthest column reached by any row; shorter rows leave
 * their trailing cells empty.
 *
 * <h2>Key validation</h2>
 * Two distinct keys of the same length can never both prefix the same text,
 * so the only way a scan position could be ambiguous is a key defined twice.
 * Duplicate keys, like empty keys, are rejected before scanning.
 */
public final class CompactLayoutParser
{
    /**
     * Parses the layout of {@code level}.
     *
     * @throws LevelLoadException for duplicate or empty definition keys
     */
    public ParsedLayout parse(LevelSource.CompactLevel level) {
        Objects.requireNonNull(level, "level");

        List<TileDefinition> keys = keysLongestFirst(level.definitions());
        List<String> layout = level.layout();
        List<TileRecord> tiles = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        int height = layout.size();
        int width = 0;

        for (int y = 0; y < height; y++) {
            String row = layout.get(height - 1 - y);
            int gridX = 0;
            int stringX = 0;

            while (stringX < row.length()) {
                TileDefinition match = longestKeyAt(keys, row, stringX);

                if (match != null) {
                    tiles.add(new TileRecord(new GridPosition(gridX, y), match.template()));
                    stringX += match.key().length();
                } else {
                    char symbol = row.charAt(stringX);
                    TileKind kind = symbolKind(symbol);
                    if (kind == null) {
                        warnings.add("Unrecognized symbol '" + symbol + "' at string index " + stringX
                                + " for grid pos (" + gridX + "," + y + ")");
                    } else if (kind != TileKind.AIR) {
                        tiles.add(new TileRecord(new GridPosition(gridX, y), TileTemplate.of(kind)));
                    }
                    stringX++;
                }
                gridX++;
            }
            width = Math.max(width, gridX);
        }

        return new ParsedLayout(width, height, tiles, warnings);
    }

    /**
     * Single-character symbols understood without a definition.
     *
     * @return the kind, {@link TileKind#AIR} for a blank cell, or {@code null}
     *         for an unknown symbol
     */
    static TileKind symbolKind(char symbol) {
        switch (symbol) {
            case '.':
                return TileKind.FLOOR;
            case '#':
                return TileKind.WALL;
            case 'S':
                return TileKind.START;
            case 'E':
                return TileKind.END;
            case ' ':
                return TileKind.AIR;
            default:
                return null;
        }
    }

    private static TileDefinition longestKeyAt(List<TileDefinition> keysLongestFirst, String row, int index) {
        for (TileDefinition definition : keysLongestFirst) {
            if (row.startsWith(definition.key(), index)) {
                return definition;
            }
        }
        return null;
    }

    private static List<TileDefinition> keysLongestFirst(List<TileDefinition> definitions) {
        Set<String> seen = new HashSet<>();
        for (TileDefinition definition : definitions) {
            if (definition.key().isEmpty()) {
                throw new LevelLoadException("Tile definition with an empty key");
            }
            if (!seen.add(definition.key())) {
                throw new LevelLoadException("Ambiguous layout: key '" + definition.key() + "' is defined more than once");
            }
        }
        List<TileDefinition> sorted = new ArrayList<>(definitions);
        sorted.sort(Comparator.comparingInt((TileDefinition d) -> d.key().length()).reversed());
        return sorted;
    }
}
