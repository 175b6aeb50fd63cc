package com.questrail.tilewalk.level;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.questrail.tilewalk.api.GridPosition;
import com.questrail.tilewalk.api.TileKind;
import com.questrail.tilewalk.board.TileTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads level files (JSON) into {@link LevelSource}s.
 *
 * <p>An object with a {@code layout} array is a compact level:</p>
 * <pre>
 * {
 *   "layout": ["#####", "#S.E#", "#####"],
 *   "definitions": [ { "key": "W3", "type": "WeakFloor", "initialSteps": 3 } ],
 *   "startDirection": "Right"
 * }
 * </pre>
 * <p>An object with a {@code tiles} array is a literal level:</p>
 * <pre>
 * {
 *   "width": 3, "height": 1,
 *   "tiles": [ { "type": "Start", "position": { "x": 0, "y": 0 } }, ... ]
 * }
 * </pre>
 *
 * <p>Tile kind names are matched case-insensitively. Omitted parameters take
 * the level-file defaults: bridges initially active and activated by an ON
 * switch, ids and steps zero.</p>
 */
public final class LevelJsonReader {
    private static final Gson GSON = new GsonBuilder()
        .setLenient()
        .create();

    /**
     * @throws LevelLoadException if the text is not a level
     */
    public LevelSource read(String json) {
        Objects.requireNonNull(json, "json");
        return read(new StringReader(json), "<string>");
    }

    /**
     * @throws LevelLoadException if the file cannot be read or is not a level
     */
    public LevelSource readFile(Path file) {
        Objects.requireNonNull(file, "file");
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        } catch (IOException e) {
            throw new LevelLoadException("Failed to read level file '" + file + "'", e);
        }
    }

    /**
     * Reads a level from the class path, e.g. {@code "levels/level-01.json"}.
     *
     * @throws LevelLoadException if the resource is missing or is not a level
     */
    public LevelSource readResource(String resourcePath) {
        Objects.requireNonNull(resourcePath, "resourcePath");
        ClassLoader loader = LevelJsonReader.class.getClassLoader();
        try (InputStream is = loader.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new LevelLoadException("Level resource not found: " + resourcePath);
            }
            return read(new InputStreamReader(is, StandardCharsets.UTF_8), resourcePath);
        } catch (IOException e) {
            throw new LevelLoadException("Failed to read level resource '" + resourcePath + "'", e);
        }
    }

    private LevelSource read(Reader reader, String origin) {
        final JsonLevel level;
        try {
            level = GSON.fromJson(reader, JsonLevel.class);
        } catch (JsonParseException e) {
            throw new LevelLoadException("Invalid JSON in '" + origin + "': " + e.getMessage(), e);
        }
        if (level == null) {
            throw new LevelLoadException("Level '" + origin + "' is empty");
        }

        if (level.layout != null) {
            requireNoNullEntries(level.layout, "layout", origin);
            List<TileDefinition> definitions = new ArrayList<>();
            if (level.definitions != null) {
                requireNoNullEntries(level.definitions, "definitions", origin);
                for (JsonTileDefinition def : level.definitions) {
                    definitions.add(new TileDefinition(
                            Objects.requireNonNullElse(def.key, ""),
                            def.toTemplate(origin)));
                }
            }
            return new LevelSource.CompactLevel(level.layout, definitions, level.startDirection);
        }

        if (level.tiles != null) {
            requireNoNullEntries(level.tiles, "tiles", origin);
            List<TileRecord> tiles = new ArrayList<>();
            for (JsonTile tile : level.tiles) {
                if (tile.position == null) {
                    throw new LevelLoadException("Tile of type '" + tile.type + "' in '" + origin + "' has no position");
                }
                tiles.add(new TileRecord(
                        new GridPosition(tile.position.x, tile.position.y),
                        tile.toTemplate(origin)));
            }
            return new LevelSource.LiteralLevel(level.width, level.height, tiles, level.startDirection);
        }

        throw new LevelLoadException("Level '" + origin + "' has neither a layout nor a tile list");
    }

    private static void requireNoNullEntries(List<?> entries, String field, String origin) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) == null) {
                throw new LevelLoadException("'" + field + "' has a null entry at index " + i + " in '" + origin + "'");
            }
        }
    }

    private static TileKind parseKind(String type, String origin) {
        return TileKind.parse(type).orElseThrow(() ->
                new LevelLoadException("Unknown tile type '" + type + "' in '" + origin + "'"));
    }

    // ========================================================================
    // JSON shapes (field names as written in level files)
    // ========================================================================

    private static final class JsonLevel {
        List<String> layout;
        List<JsonTileDefinition> definitions;
        String startDirection;
        int width;
        int height;
        List<JsonTile> tiles;
    }

    private static class JsonTileParameters {
        String type;
        int switchId = 0;
        int controlledBySwitchId = 0;
        boolean isBridgeInitiallyActive = true;
        boolean activateOnSwitchOn = true;
        int initialSteps = 0;

        TileTemplate toTemplate(String origin) {
            return new TileTemplate(
                    parseKind(type, origin),
                    switchId,
                    controlledBySwitchId,
                    isBridgeInitiallyActive,
                    activateOnSwitchOn,
                    initialSteps);
        }
    }

    private static final class JsonTileDefinition extends JsonTileParameters {
        String key;
    }

    private static final class JsonTile extends JsonTileParameters {
        JsonPosition position;
    }

    private static final class JsonPosition {
        int x;
        int y;
    }
}
