package org.iscc.omero.tracker;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iscc.omero.domain.Cursor;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * JSON checkpoint file, replaced atomically on every save.
 */
public class FileCursorStore implements CursorStore {

    private static final Logger LOG = Logger.getLogger(FileCursorStore.class);

    private final Path stateFile;
    private final ObjectMapper mapper;

    public FileCursorStore(Path stateFile, ObjectMapper mapper) {
        this.stateFile = stateFile;
        this.mapper = mapper;
    }

    @Override
    public Optional<Cursor> load() {
        if (!Files.exists(stateFile)) {
            LOG.infof("No checkpoint at %s, starting from the beginning", stateFile);
            return Optional.empty();
        }

        try {
            Checkpoint checkpoint = mapper.readValue(stateFile.toFile(), Checkpoint.class);
            if (checkpoint.lastSeenTimestamp() == null) {
                LOG.warnf("Ignoring checkpoint %s without last_seen_timestamp", stateFile);
                return Optional.empty();
            }
            Cursor cursor = new Cursor(Instant.parse(checkpoint.lastSeenTimestamp()), checkpoint.lastSeenId());
            LOG.infof("Loaded checkpoint from %s: %s", stateFile, cursor);
            return Optional.of(cursor);
        } catch (IOException | DateTimeParseException | IllegalArgumentException e) {
            LOG.warnf("Ignoring unreadable checkpoint %s: %s", stateFile, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(Cursor cursor) {
        Path temp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");

        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(temp.toFile(),
                    new Checkpoint(cursor.lastSeenTimestamp().toString(), cursor.lastSeenId()));
            Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOG.debugf("Saved checkpoint %s", cursor);
        } catch (IOException e) {
            LOG.warnf(e, "Failed to save checkpoint to %s, continuing with in-memory cursor", stateFile);
        }
    }

    record Checkpoint(
            @JsonProperty("last_seen_timestamp") String lastSeenTimestamp,
            @JsonProperty("last_seen_id") String lastSeenId
    ) {
    }
}
