package com.questrail.tilewalk.level;

import java.util.List;

/**
 * Output of {@link CompactLayoutParser}: grid dimensions, the tiles placed and
 * any non-fatal warnings met while scanning.
 */
public record ParsedLayout(int width, int height, List<TileRecord> tiles, List<String> warnings)
{
    public ParsedLayout {
        tiles = List.copyOf(tiles);
        warnings = List.copyOf(warnings);
    }
}
