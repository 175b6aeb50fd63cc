package com.questrail.tilewalk.level;

import com.questrail.tilewalk.api.GridPosition;
import com.questrail.tilewalk.board.TileTemplate;

import java.util.Objects;

/**
 * One explicitly positioned tile of a literal level.
 */
public record TileRecord(GridPosition position, TileTemplate template)
{
    public TileRecord {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(template, "template");
    }
}
