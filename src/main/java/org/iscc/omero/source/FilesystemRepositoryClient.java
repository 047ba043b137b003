package org.iscc.omero.source;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.Cursor;
import org.iscc.omero.domain.FileLocator;
import org.iscc.omero.domain.FingerprintRecord;
import org.iscc.omero.exception.RecordWriteException;
import org.iscc.omero.exception.RepositoryUnavailableException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Repository backed by a directory tree.
 * Every regular, non-hidden file is an asset identified by its path relative to the root;
 * its import time is the last-modified time. Fingerprint records are JSON sidecars under
 * {@code <root>/.iscc/<namespace directory>/}, where the directory name is the readable part of
 * the namespace followed by a hash of the full namespace.
 * Subdirectories that cannot be read are skipped with a warning.
 */
public class FilesystemRepositoryClient implements RepositoryClient {

    private static final Logger LOG = Logger.getLogger(FilesystemRepositoryClient.class);

    static final String RECORD_DIR = ".iscc";

    private final Path root;
    private final ObjectMapper mapper;
    private final Map<String, RepositorySession> openSessions = new ConcurrentHashMap<>();

    public FilesystemRepositoryClient(Path root, ObjectMapper mapper) {
        this.root = root.toAbsolutePath().normalize();
        this.mapper = mapper;
    }

    @Override
    public RepositorySession connect(String host, int port, Credentials credentials) {
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new RepositoryUnavailableException("connect",
                    "Repository root is not a readable directory: " + root);
        }

        RepositorySession session = new RepositorySession(
                UUID.randomUUID().toString(),
                host,
                port,
                credentials.username(),
                Instant.now()
        );
        openSessions.put(session.id(), session);

        LOG.debugf("Opened session %s on %s (root: %s)", session.id(), session.endpoint(), root);
        return session;
    }

    @Override
    public List<AssetReference> queryNewAssets(RepositorySession session, Instant sinceTimestamp,
                                               String sinceId, int limit) {
        requireOpen(session, "query_new_assets");
        AssetCollector collector = new AssetCollector(root, new Cursor(sinceTimestamp, sinceId));

        try {
            Files.walkFileTree(root, collector);
        } catch (IOException e) {
            throw new RepositoryUnavailableException("query_new_assets",
                    "Failed to list repository root " + root, e);
        }

        return collector.assets().stream()
                .sorted(Comparator.comparing(AssetReference::importTimestamp)
                        .thenComparing(AssetReference::id))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public InputStream openRawStream(RepositorySession session, FileLocator locator) throws IOException {
        requireOpen(session, "open_raw_stream");
        Path path = resolveInsideRoot(locator.id());
        return Files.newInputStream(path);
    }

    @Override
    public boolean recordExists(RepositorySession session, String assetId, String namespace) {
        requireOpen(session, "record_exists");
        return Files.exists(recordPath(assetId, namespace));
    }

    @Override
    public Optional<FingerprintRecord> readRecord(RepositorySession session, String assetId, String namespace) {
        requireOpen(session, "read_record");
        Path path = recordPath(assetId, namespace);

        if (!Files.exists(path)) {
            return Optional.empty();
        }

        try {
            StoredRecord stored = mapper.readValue(path.toFile(), StoredRecord.class);
            return Optional.of(FingerprintRecord.fromKeyValues(namespace, stored.values()));
        } catch (IOException | IllegalArgumentException e) {
            LOG.warnf(e, "Unreadable fingerprint record %s for asset %s", path, assetId);
            return Optional.empty();
        }
    }

    @Override
    public void writeRecord(RepositorySession session, String assetId, FingerprintRecord record) {
        requireOpen(session, "write_record");
        Path target = recordPath(assetId, record.namespace());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        try {
            Files.createDirectories(target.getParent());
            mapper.writeValue(temp.toFile(), new StoredRecord(assetId, record.namespace(), record.toKeyValues()));
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new RecordWriteException(assetId, record.namespace(), e.getMessage(), e);
        }

        LOG.debugf("Stored fingerprint record for asset %s at %s", assetId, target);
    }

    @Override
    public void close(RepositorySession session) {
        if (openSessions.remove(session.id()) != null) {
            LOG.debugf("Closed session %s", session.id());
        }
    }

    Path recordPath(String assetId, String namespace) {
        return root.resolve(RECORD_DIR)
                .resolve(namespaceDirectory(namespace))
                .resolve(recordKey(assetId) + ".json");
    }

    private void requireOpen(RepositorySession session, String operation) {
        if (session == null || !openSessions.containsKey(session.id())) {
            throw RepositoryUnavailableException.sessionClosed(operation, session == null ? "none" : session.id());
        }
        if (!Files.isDirectory(root)) {
            openSessions.remove(session.id());
            throw new RepositoryUnavailableException(operation, "Repository root disappeared: " + root);
        }
    }

    private Path resolveInsideRoot(String relativeId) throws IOException {
        Path path = root.resolve(relativeId).normalize();
        if (!path.startsWith(root)) {
            throw new IOException("Locator escapes repository root: " + relativeId);
        }
        return path;
    }

    /**
     * Directory for a namespace's records. The hash keeps namespaces that sanitize to the same
     * text apart, and the suffix keeps {@code .} and {@code ..} from resolving outside the record directory.
     */
    static String namespaceDirectory(String namespace) {
        String readable = namespace.replaceAll("[^A-Za-z0-9._-]", "_");
        return readable + "-" + sha256Hex(namespace).substring(0, 16);
    }

    /**
     * Stable file name for an asset's record: SHA-256 of the asset id.
     */
    static String recordKey(String assetId) {
        return sha256Hex(assetId);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Collects assets after a cursor while walking the tree. Hidden entries and {@code *.tmp}
     * files are ignored; an unreadable entry below the root is logged and skipped.
     */
    static final class AssetCollector extends SimpleFileVisitor<Path> {

        private final Path root;
        private final Cursor since;
        private final List<AssetReference> assets = new ArrayList<>();

        AssetCollector(Path root, Cursor since) {
            this.root = root;
            this.since = since;
        }

        List<AssetReference> assets() {
            return assets;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(root) && isHidden(dir)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            String name = file.getFileName().toString();
            if (!attrs.isRegularFile() || isHidden(file) || name.endsWith(".tmp")) {
                return FileVisitResult.CONTINUE;
            }

            String id = root.relativize(file).toString().replace('\\', '/');
            Instant imported = Instant.ofEpochMilli(attrs.lastModifiedTime().toMillis());
            AssetReference asset = new AssetReference(id, name, imported,
                    List.of(new FileLocator(id, name, attrs.size())));

            if (since.precedes(asset)) {
                assets.add(asset);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(root)) {
                throw exc;
            }
            LOG.warnf(exc, "Skipping unreadable repository entry %s", file);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                LOG.warnf(exc, "Listing of %s ended early", dir);
            }
            return FileVisitResult.CONTINUE;
        }

        private boolean isHidden(Path path) {
            return path.getFileName().toString().startsWith(".");
        }
    }

    record StoredRecord(
            @JsonProperty("asset_id") String assetId,
            @JsonProperty("namespace") String namespace,
            @JsonProperty("values") Map<String, String> values
    ) {
    }
}
