package com.questrail.tilewalk.level;

import com.questrail.tilewalk.api.PlayerPose;
import com.questrail.tilewalk.board.Board;

import java.util.List;
import java.util.Objects;

/**
 * A freshly built board, the pose the player starts in, and the non-fatal
 * warnings collected while loading.
 */
public record LoadedLevel(Board board, PlayerPose startPose, List<String> warnings)
{
    public LoadedLevel {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(startPose, "startPose");
        warnings = List.copyOf(warnings);
    }
}
