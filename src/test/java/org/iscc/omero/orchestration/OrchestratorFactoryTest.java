package org.iscc.omero.orchestration;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.iscc.omero.config.ServiceConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class OrchestratorFactoryTest {

    @Inject
    OrchestratorFactory factory;

    private Path repoDir;
    private Path stateDir;

    @BeforeEach
    void setup() throws IOException {
        repoDir = Files.createTempDirectory("test-repository-");
        stateDir = Files.createTempDirectory("test-state-");
    }

    @AfterEach
    void cleanup() throws IOException {
        deleteRecursively(repoDir);
        deleteRecursively(stateDir);
    }

    private void deleteRecursively(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return;
        }
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
    void shouldFingerprintDirectoryAndCheckpointCursor() throws IOException {
        Files.writeString(repoDir.resolve("plate-1.tif"), "first plate");
        Files.createDirectories(repoDir.resolve("screens"));
        Files.writeString(repoDir.resolve("screens/plate-2.tif"), "second plate");
        Path stateFile = stateDir.resolve("cursor.json");

        ServiceConfig config = ServiceConfig.builder()
                .repositoryRoot(repoDir.toString())
                .stateFile(stateFile.toString())
                .build();

        RunSummary summary = factory.create(config, new StopToken()).run(true);

        assertEquals(RunSummary.Outcome.COMPLETED, summary.outcome());
        assertEquals(2, summary.status().committed());
        assertTrue(Files.exists(stateFile), "Checkpoint written");
        try (Stream<Path> sidecars = Files.walk(repoDir.resolve(".iscc"))) {
            assertEquals(2, sidecars.filter(p -> p.toString().endsWith(".json")).count());
        }

        // Second run resumes from the checkpoint and finds nothing new
        RunSummary again = factory.create(config, new StopToken()).run(true);
        assertEquals(0, again.status().committed());
        assertEquals(0, again.status().alreadyProcessed());
        assertEquals(summary.status().cursor(), again.status().cursor());
    }
}
