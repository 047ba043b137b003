package org.iscc.omero.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.Cursor;
import org.iscc.omero.domain.FileLocator;
import org.iscc.omero.domain.FingerprintRecord;
import org.iscc.omero.exception.RepositoryUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FilesystemRepositoryClientTest {

    private static final String NAMESPACE = "org.iscc.omero.sum";
    private static final Instant T1 = Instant.parse("2024-04-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-04-01T10:00:05Z");
    private static final Instant T3 = Instant.parse("2024-04-01T10:00:09Z");

    private final ObjectMapper mapper = new ObjectMapper();

    private Path repoDir;
    private FilesystemRepositoryClient client;
    private RepositorySession session;

    @BeforeEach
    void setup() throws IOException {
        repoDir = Files.createTempDirectory("test-repository-");
        client = new FilesystemRepositoryClient(repoDir, mapper);
        session = client.connect("localhost", 4064, Credentials.anonymous());
    }

    @AfterEach
    void cleanup() throws IOException {
        if (repoDir != null && Files.exists(repoDir)) {
            deleteRecursively(repoDir);
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

    private Path createAsset(String relative, String content, Instant modified) throws IOException {
        Path file = repoDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, FileTime.from(modified));
        return file;
    }

    private static List<String> ids(List<AssetReference> assets) {
        return assets.stream().map(AssetReference::id).collect(Collectors.toList());
    }

    private static FingerprintRecord record(String code) {
        return FingerprintRecord.of(code, "ISCC-INSTANCE-V0-64", "plate.tif", T3, "worker-1", NAMESPACE);
    }

    @Test
    void shouldListFilesInImportOrder() throws IOException {
        createAsset("plates/b.tif", "b", T2);
        createAsset("a.tif", "a", T1);
        createAsset("plates/c.tif", "c", T3);

        List<AssetReference> assets = client.queryNewAssets(session, Instant.EPOCH, "", 10);

        assertEquals(List.of("a.tif", "plates/b.tif", "plates/c.tif"), ids(assets));
        AssetReference b = assets.get(1);
        assertEquals("b.tif", b.name());
        assertEquals(T2, b.importTimestamp());
        assertEquals(1, b.rawFileLocators().size());
        assertEquals(1, b.rawFileLocators().get(0).sizeBytes());
    }

    @Test
    void shouldSkipHiddenAndTemporaryFiles() throws IOException {
        createAsset("visible.tif", "v", T1);
        createAsset(".hidden.tif", "h", T1);
        createAsset(".cache/inner.tif", "h", T1);
        createAsset("upload.tif.tmp", "t", T1);

        List<AssetReference> assets = client.queryNewAssets(session, Instant.EPOCH, "", 10);

        assertEquals(List.of("visible.tif"), ids(assets));
    }

    @Test
    void shouldQueryAfterPositionAndRespectLimit() throws IOException {
        createAsset("a.tif", "a", T1);
        createAsset("b.tif", "b", T1);
        createAsset("c.tif", "c", T2);
        createAsset("d.tif", "d", T3);

        List<AssetReference> assets = client.queryNewAssets(session, T1, "a.tif", 2);

        assertEquals(List.of("b.tif", "c.tif"), ids(assets));
    }

    @Test
    void shouldStreamRawBytes() throws IOException {
        createAsset("plates/a.tif", "pixel data", T1);
        AssetReference asset = client.queryNewAssets(session, Instant.EPOCH, "", 10).get(0);

        try (InputStream in = client.openRawStream(session, asset.rawFileLocators().get(0))) {
            assertEquals("pixel data", new String(in.readAllBytes()));
        }
    }

    @Test
    void shouldStoreRecordAsSidecar() throws IOException {
        createAsset("plates/a.tif", "a", T1);

        assertFalse(client.recordExists(session, "plates/a.tif", NAMESPACE));
        client.writeRecord(session, "plates/a.tif", record("ISCC:IAA26E2JXH27TING"));

        assertTrue(client.recordExists(session, "plates/a.tif", NAMESPACE));
        assertFalse(client.recordExists(session, "plates/a.tif", "org.example.other"));

        FingerprintRecord stored = client.readRecord(session, "plates/a.tif", NAMESPACE).orElseThrow();
        assertEquals("ISCC:IAA26E2JXH27TING", stored.code());
        assertEquals(T3, stored.computedAt());

        Path sidecar = client.recordPath("plates/a.tif", NAMESPACE);
        assertTrue(sidecar.startsWith(repoDir.toAbsolutePath().normalize().resolve(".iscc")));
        Map<?, ?> json = mapper.readValue(sidecar.toFile(), Map.class);
        assertEquals("plates/a.tif", json.get("asset_id"));

        List<AssetReference> assets = client.queryNewAssets(session, Instant.EPOCH, "", 10);
        assertEquals(List.of("plates/a.tif"), ids(assets), "Sidecars are not assets");
    }

    @Test
    void shouldTreatCorruptSidecarAsMissingRecord() throws IOException {
        Path sidecar = client.recordPath("a.tif", NAMESPACE);
        Files.createDirectories(sidecar.getParent());
        Files.writeString(sidecar, "{\"asset_id\":\"a.tif\",\"values\":{\"code\":\"x\"}}");

        assertTrue(client.readRecord(session, "a.tif", NAMESPACE).isEmpty());
    }

    @Test
    void shouldRejectLocatorOutsideRoot() {
        assertThrows(IOException.class, () -> client.openRawStream(session,
                new FileLocator("../outside.tif", "outside.tif", 1)));
    }

    @Test
    void shouldFailConnectWhenRootIsMissing() {
        FilesystemRepositoryClient missing = new FilesystemRepositoryClient(repoDir.resolve("absent"), mapper);

        assertThrows(RepositoryUnavailableException.class,
                () -> missing.connect("localhost", 4064, Credentials.anonymous()));
    }

    @Test
    void shouldRejectClosedSession() {
        client.close(session);

        assertThrows(RepositoryUnavailableException.class,
                () -> client.queryNewAssets(session, Instant.EPOCH, "", 10));
    }

    @Test
    void shouldUseStableRecordKeys() {
        assertEquals(client.recordPath("a.tif", NAMESPACE), client.recordPath("a.tif", NAMESPACE));
        assertNotEquals(FilesystemRepositoryClient.recordKey("a.tif"), FilesystemRepositoryClient.recordKey("b.tif"));
        assertEquals(64, FilesystemRepositoryClient.recordKey("a.tif").length());
    }

    @Test
    void shouldKeepNamespacesWithSimilarNamesApart() throws IOException {
        createAsset("a.tif", "a", T1);
        client.writeRecord(session, "a.tif",
                FingerprintRecord.of("ISCC:IAA26E2JXH27TING", "ISCC-INSTANCE-V0-64", "a.tif", T3, "worker-1", "org/iscc"));

        assertTrue(client.recordExists(session, "a.tif", "org/iscc"));
        assertFalse(client.recordExists(session, "a.tif", "org_iscc"));
        assertNotEquals(FilesystemRepositoryClient.namespaceDirectory("org/iscc"),
                FilesystemRepositoryClient.namespaceDirectory("org_iscc"));
    }

    @Test
    void shouldKeepDotNamespaceInsideRecordDirectory() throws IOException {
        createAsset("a.tif", "a", T1);
        client.writeRecord(session, "a.tif",
                FingerprintRecord.of("ISCC:IAA26E2JXH27TING", "ISCC-INSTANCE-V0-64", "a.tif", T3, "worker-1", ".."));

        Path recordDir = repoDir.toAbsolutePath().normalize().resolve(".iscc");
        Path sidecar = client.recordPath("a.tif", "..");
        assertTrue(sidecar.normalize().startsWith(recordDir), sidecar.toString());
        assertTrue(Files.exists(sidecar));

        List<AssetReference> assets = client.queryNewAssets(session, Instant.EPOCH, "", 10);
        assertEquals(List.of("a.tif"), ids(assets), "Sidecars are not assets");
    }

    @Test
    void shouldSkipEntriesThatCannotBeRead() throws IOException {
        Path root = repoDir.toAbsolutePath().normalize();
        FilesystemRepositoryClient.AssetCollector collector =
                new FilesystemRepositoryClient.AssetCollector(root, Cursor.initial());

        assertEquals(FileVisitResult.CONTINUE,
                collector.visitFileFailed(root.resolve("locked"), new AccessDeniedException("locked")));
        assertThrows(AccessDeniedException.class,
                () -> collector.visitFileFailed(root, new AccessDeniedException(root.toString())));
    }

    @Test
    void shouldListReadableAssetsBesideLockedDirectory() throws IOException {
        createAsset("a.tif", "a", T1);
        createAsset("locked/b.tif", "b", T2);
        Path locked = repoDir.resolve("locked");
        try {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        } catch (UnsupportedOperationException e) {
            return;
        }
        try {
            List<AssetReference> assets = client.queryNewAssets(session, Instant.EPOCH, "", 10);

            assertTrue(ids(assets).contains("a.tif"), ids(assets).toString());
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }
}
