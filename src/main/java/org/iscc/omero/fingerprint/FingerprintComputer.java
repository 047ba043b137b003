package org.iscc.omero.fingerprint;

import org.iscc.omero.exception.SourceUnreadableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Streams raw asset bytes through a {@link StreamingHasher} in fixed-size chunks.
 * Sources are read in order and hashed as one concatenated stream.
 */
@ApplicationScoped
public class FingerprintComputer {

    private static final Logger LOG = Logger.getLogger(FingerprintComputer.class);

    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;

    private static final long PROGRESS_THRESHOLD_BYTES = 10L * 1024 * 1024;

    private final HasherFactory hasherFactory;

    @Inject
    public FingerprintComputer(HasherFactory hasherFactory) {
        this.hasherFactory = hasherFactory;
    }

    /**
     * Fingerprint a single stream. The caller owns and closes the stream.
     */
    public Fingerprint compute(InputStream stream, int chunkSize) {
        StreamingHasher hasher = hasherFactory.create();
        byte[] buffer = new byte[requirePositive(chunkSize)];
        long total = feed(hasher, stream, buffer, "stream", -1);
        String code = hasher.finish();
        return new Fingerprint(code, hasher.version(), total, hasher.units());
    }

    /**
     * Fingerprint the concatenation of the given sources.
     *
     * @throws SourceUnreadableException if there are no sources, a source cannot be opened,
     *                                   or a read fails mid-stream
     */
    public Fingerprint compute(List<RawSource> sources, int chunkSize) {
        if (sources.isEmpty()) {
            throw new SourceUnreadableException("compute", "asset", "No raw files to read");
        }

        StreamingHasher hasher = hasherFactory.create();
        byte[] buffer = new byte[requirePositive(chunkSize)];
        long total = 0;

        for (RawSource source : sources) {
            try (InputStream in = source.open()) {
                total += feed(hasher, in, buffer, source.name(), source.sizeBytes());
            } catch (IOException e) {
                throw new SourceUnreadableException("compute", source.name(), e.getMessage(), e);
            }
        }

        String code = hasher.finish();
        return new Fingerprint(code, hasher.version(), total, hasher.units());
    }

    private long feed(StreamingHasher hasher, InputStream in, byte[] buffer, String name, long expectedSize) {
        long processed = 0;
        int lastReported = 0;
        boolean reportProgress = expectedSize > PROGRESS_THRESHOLD_BYTES;

        try {
            int read;
            while ((read = in.readNBytes(buffer, 0, buffer.length)) > 0) {
                hasher.update(buffer, 0, read);
                processed += read;

                if (reportProgress) {
                    int percent = (int) (processed * 100 / expectedSize);
                    if (percent >= lastReported + 20) {
                        lastReported = percent - percent % 20;
                        LOG.debugf("Fingerprinting %s: %d%%", name, lastReported);
                    }
                }
            }
        } catch (IOException e) {
            throw new SourceUnreadableException("compute", name,
                    "Read failed after " + processed + " bytes: " + e.getMessage(), e);
        }

        return processed;
    }

    private static int requirePositive(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        return chunkSize;
    }
}
