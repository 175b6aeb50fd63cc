package com.questrail.tilewalk.progress;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link ProgressStore} kept in a JSON file.
 *
 * <p>The whole file is rewritten after every change:</p>
 * <pre>
 * { "allSessions": [ { "playerName": "Ada", "levelsPassed": 3, "totalSteps": 41 } ] }
 * </pre>
 * <p>A missing file is an empty store; the file and its parent directories
 * are created on the first save.</p>
 */
public final class JsonFileProgressStore extends InMemoryProgressStore
{
    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    private final Path file;

    private JsonFileProgressStore(Path file, List<SessionProgress> existing) {
        super(existing);
        this.file = file;
    }

    /**
     * Opens the store at {@code file}, reading any sessions already saved there.
     *
     * @throws ProgressStoreException if the file exists but cannot be read
     */
    public static JsonFileProgressStore open(Path file) {
        Objects.requireNonNull(file, "file");
        return new JsonFileProgressStore(file, readSessions(file));
    }

    public Path file() {
        return file;
    }

    @Override
    protected void changed() {
        SaveFile save = new SaveFile();
        for (SessionProgress session : allSessions()) {
            SaveEntry entry = new SaveEntry();
            entry.playerName = session.playerName();
            entry.levelsPassed = session.levelsPassed();
            entry.totalSteps = session.totalSteps();
            save.allSessions.add(entry);
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                GSON.toJson(save, writer);
            }
        } catch (IOException e) {
            throw new ProgressStoreException("Failed to save progress to '" + file + "'", e);
        }
    }

    private static List<SessionProgress> readSessions(Path file) {
        if (!Files.exists(file)) {
            return List.of();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            SaveFile save = GSON.fromJson(reader, SaveFile.class);
            List<SessionProgress> sessions = new ArrayList<>();
            if (save != null && save.allSessions != null) {
                for (SaveEntry entry : save.allSessions) {
                    sessions.add(new SessionProgress(
                            Objects.requireNonNullElse(entry.playerName, DEFAULT_PLAYER_NAME),
                            entry.levelsPassed,
                            entry.totalSteps));
                }
            }
            return sessions;
        } catch (IOException | JsonParseException | IllegalArgumentException e) {
            throw new ProgressStoreException("Failed to read progress from '" + file + "'", e);
        }
    }

    private static final class SaveFile {
        List<SaveEntry> allSessions = new ArrayList<>();
    }

    private static final class SaveEntry {
        String playerName;
        int levelsPassed;
        int totalSteps;
    }
}
