package com.questrail.tilewalk.level;

import com.questrail.tilewalk.api.Direction;
import com.questrail.tilewalk.api.PlayerPose;
import com.questrail.tilewalk.api.TileKind;
import com.questrail.tilewalk.board.Board;
import com.questrail.tilewalk.board.TileTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * LevelLoader
 * ============================================================================
 * Turns a {@link LevelSource} into a {@link LoadedLevel}: a brand-new board in
 * its load-time state and the player's start pose.
 *
 * <h2>Load-time state</h2>
 * <ul>
 *   <li>every switch is off;</li>
 *   <li>every bridge starts from its initial flag and is then synchronized
 *       with its switch;</li>
 *   <li>every weak floor has its full step budget. A budget of zero or less
 *       is raised to one and reported as a warning.</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * Structural problems throw {@link LevelLoadException}: an empty layout, no
 * start tile or several, tiles outside the grid or on the same cell, and
 * (from the parser) bad definition keys. Unknown layout symbols and an
 * unknown start direction are warnings only.
 */
public final class LevelLoader
{
    private static final Logger log = LoggerFactory.getLogger(LevelLoader.class);

    private final CompactLayoutParser parser;

    public LevelLoader() {
        this(new CompactLayoutParser());
    }

    public LevelLoader(CompactLayoutParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * @throws LevelLoadException if the level is structurally invalid
     */
    public LoadedLevel load(LevelSource source) {
        Objects.requireNonNull(source, "source");

        List<String> warnings = new ArrayList<>();
        int width;
        int height;
        List<TileRecord> tiles;

        if (source instanceof LevelSource.CompactLevel compact) {
            ParsedLayout parsed = parser.parse(compact);
            warnings.addAll(parsed.warnings());
            width = parsed.width();
            height = parsed.height();
            tiles = parsed.tiles();
        } else {
            LevelSource.LiteralLevel literal = (LevelSource.LiteralLevel) source;
            width = literal.width();
            height = literal.height();
            tiles = literal.tiles();
        }

        if (width <= 0 || height <= 0) {
            throw new LevelLoadException("Level layout is empty (" + width + "x" + height + ")");
        }

        Board board = buildBoard(width, height, tiles, warnings);
        Direction facing = resolveStartDirection(source.startDirection(), warnings);

        for (String warning : warnings) {
            log.warn(warning);
        }
        log.debug("Loaded {}x{} board, start at {} facing {}", width, height, board.startPosition(), facing);

        return new LoadedLevel(board, new PlayerPose(board.startPosition(), facing), warnings);
    }

    private static Board buildBoard(int width, int height, List<TileRecord> tiles, List<String> warnings) {
        Board.Builder builder = Board.builder(width, height);
        try {
            for (TileRecord tile : tiles) {
                builder.place(tile.position(), checkedTemplate(tile, warnings));
            }
            return builder.build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new LevelLoadException("Invalid level: " + e.getMessage(), e);
        }
    }

    private static TileTemplate checkedTemplate(TileRecord tile, List<String> warnings) {
        TileTemplate template = tile.template();
        if (template.kind() == TileKind.WEAK_FLOOR && template.initialSteps() <= 0) {
            warnings.add("Weak floor at " + tile.position() + " has initialSteps "
                    + template.initialSteps() + "; using 1");
            return template.withInitialSteps(1);
        }
        return template;
    }

    private static Direction resolveStartDirection(String text, List<String> warnings) {
        if (text == null || text.isBlank()) {
            return Direction.UP;
        }
        Optional<Direction> parsed = Direction.parse(text);
        if (parsed.isEmpty()) {
            warnings.add("Unknown startDirection '" + text + "'. Defaulting to UP.");
            return Direction.UP;
        }
        return parsed.get();
    }
}
