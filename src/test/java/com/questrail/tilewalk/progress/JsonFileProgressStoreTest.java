package com.questrail.tilewalk.progress;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileProgressStoreTest
{
    @Test
    void missingFileIsAnEmptyStore(@TempDir Path dir) {
        JsonFileProgressStore store = JsonFileProgressStore.open(dir.resolve("progress.json"));

        assertTrue(store.allSessions().isEmpty());
        assertFalse(Files.exists(store.file()), "nothing is written until something changes");
    }

    @Test
    void sessionsSurviveReopening(@TempDir Path dir) {
        Path file = dir.resolve("saves").resolve("progress.json");

        JsonFileProgressStore first = JsonFileProgressStore.open(file);
        first.beginSession("Ada");
        first.recordLevelPassed(1, 4);
        first.recordLevelPassed(2, 6);
        first.beginSession("Grace");

        assertTrue(Files.exists(file), "parent directories are created");

        JsonFileProgressStore reopened = JsonFileProgressStore.open(file);
        assertEquals(2, reopened.allSessions().size());
        SessionProgress ada = reopened.allSessions().get(0);
        assertEquals("Ada", ada.playerName());
        assertEquals(2, ada.levelsPassed());
        assertEquals(10, ada.totalSteps());
        assertTrue(reopened.nameExists("grace"));
        assertTrue(reopened.current().isEmpty(), "a reopened store has no current session");
    }

    @Test
    void fileUsesTheAllSessionsShape(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("progress.json");
        JsonFileProgressStore store = JsonFileProgressStore.open(file);
        store.beginSession("Ada");

        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"allSessions\""));
        assertTrue(json.contains("\"playerName\": \"Ada\""));
        assertTrue(json.contains("\"levelsPassed\": 0"));
    }

    @Test
    void existingFileIsRead(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("progress.json");
        Files.writeString(file,
                "{ \"allSessions\": [ { \"playerName\": \"Ada\", \"levelsPassed\": 3, \"totalSteps\": 41 } ] }",
                StandardCharsets.UTF_8);

        JsonFileProgressStore store = JsonFileProgressStore.open(file);

        assertEquals(1, store.allSessions().size());
        assertEquals(41, store.allSessions().get(0).totalSteps());
    }

    @Test
    void corruptFileIsReported(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("progress.json");
        Files.writeString(file, "{ \"allSessions\": [ { \"levelsPassed\": \"many\" } ] }", StandardCharsets.UTF_8);

        assertThrows(ProgressStoreException.class, () -> JsonFileProgressStore.open(file));
    }

    @Test
    void negativeValuesInTheFileAreReported(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("progress.json");
        Files.writeString(file, "{ \"allSessions\": [ { \"playerName\": \"Ada\", \"levelsPassed\": -2 } ] }",
                StandardCharsets.UTF_8);

        assertThrows(ProgressStoreException.class, () -> JsonFileProgressStore.open(file));
    }
}
