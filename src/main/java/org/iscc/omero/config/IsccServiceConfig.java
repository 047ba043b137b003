package org.iscc.omero.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Defaults and environment layer of the service configuration.
 * All keys are namespaced under {@code omero-iscc.*}, so environment variables
 * read as {@code OMERO_ISCC_*}.
 */
@ConfigMapping(prefix = "omero-iscc")
public interface IsccServiceConfig {

    @WithDefault("localhost")
    String host();

    @WithDefault("4064")
    int port();

    Optional<String> username();

    Optional<String> password();

    /**
     * Seconds between polls when nothing new was found.
     */
    @WithName("poll-interval")
    @WithDefault("60")
    int pollIntervalSeconds();

    /**
     * Maximum assets per poll.
     */
    @WithDefault("100")
    int batchSize();

    /**
     * Read size used while streaming raw files into the hasher.
     */
    @WithName("chunk-size")
    @WithDefault("1048576")
    int chunkSizeBytes();

    @WithDefault("org.iscc.omero.sum")
    String namespace();

    Optional<String> webhookUrl();

    /**
     * Identity written to the {@code processor} key of every record.
     */
    @WithDefault("omero-iscc-service")
    String processor();

    @WithDefault("/data/repository")
    String repositoryRoot();

    /**
     * Cursor checkpoint file. Without it the cursor lives in memory only.
     */
    Optional<String> stateFile();

    /**
     * Connection attempts before giving up at startup; 0 retries forever.
     */
    @WithDefault("30")
    int startupConnectAttempts();

    /**
     * Level of the service's own log categories: debug, info, warning, error or critical.
     */
    Optional<String> logLevel();

    /**
     * How long a shutdown waits for the in-flight asset.
     */
    @WithDefault("PT60S")
    Duration shutdownTimeout();

    Retry retry();

    interface Retry {
        @WithDefault("PT2S")
        Duration initialDelay();

        @WithDefault("1.5")
        double multiplier();

        @WithDefault("PT30S")
        Duration maxDelay();

        @WithDefault("0.1")
        double jitter();
    }
}
