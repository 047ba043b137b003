package org.iscc.omero.tracker;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iscc.omero.domain.Cursor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileCursorStoreTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private Path stateDir;

    @BeforeEach
    void setup() throws IOException {
        stateDir = Files.createTempDirectory("test-state-");
    }

    @AfterEach
    void cleanup() throws IOException {
        if (stateDir != null && Files.exists(stateDir)) {
            deleteRecursively(stateDir);
        }
    }

    private void deleteRecursively(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            try (var stream = Files.list(path)) {
                stream.forEach(p -> {
                    try {
                        deleteRecursively(p);
                    } catch (IOException e) {
                        throw new RuntimeException(e);
                    }
                });
            }
        }
        Files.deleteIfExists(path);
    }

    @Test
    void shouldStartEmptyWithoutCheckpoint() {
        FileCursorStore store = new FileCursorStore(stateDir.resolve("cursor.json"), mapper);

        assertTrue(store.load().isEmpty());
    }

    @Test
    void shouldRestoreSavedCursor() throws IOException {
        Path file = stateDir.resolve("nested/cursor.json");
        Cursor cursor = new Cursor(Instant.parse("2024-04-01T10:00:05.123Z"), "images/plate-7.tif");

        new FileCursorStore(file, mapper).save(cursor);
        Optional<Cursor> loaded = new FileCursorStore(file, mapper).load();

        assertEquals(Optional.of(cursor), loaded);
        assertTrue(Files.readString(file).contains("\"last_seen_id\""));
        assertFalse(Files.exists(stateDir.resolve("nested/cursor.json.tmp")));
    }

    @Test
    void shouldIgnoreCorruptCheckpoint() throws IOException {
        Path file = stateDir.resolve("cursor.json");
        Files.writeString(file, "{not json");

        assertTrue(new FileCursorStore(file, mapper).load().isEmpty());

        Files.writeString(file, "{\"last_seen_timestamp\":\"soon\",\"last_seen_id\":\"a\"}");
        assertTrue(new FileCursorStore(file, mapper).load().isEmpty());

        Files.writeString(file, "{\"last_seen_id\":\"a\"}");
        assertTrue(new FileCursorStore(file, mapper).load().isEmpty());
    }

    @Test
    void shouldSurviveFailedSave() throws IOException {
        Path blocker = stateDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        FileCursorStore store = new FileCursorStore(blocker.resolve("cursor.json"), mapper);

        assertDoesNotThrow(() -> store.save(Cursor.initial()));
        assertTrue(store.load().isEmpty());
    }
}
