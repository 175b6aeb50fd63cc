package com.questrail.tilewalk.level;

import com.questrail.tilewalk.board.TileTemplate;

import java.util.Objects;

/**
 * Binds a layout key (one or more characters, e.g. {@code "W3"}) to the tile
 * it stands for in a compact layout.
 */
public record TileDefinition(String key, TileTemplate template)
{
    public TileDefinition {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(template, "template");
    }
}
