package org.iscc.omero.config;

import org.iscc.omero.exception.ConfigException;
import org.iscc.omero.orchestration.BackoffPolicy;
import org.iscc.omero.source.Credentials;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Effective, validated service configuration. Read-only once loaded.
 */
public record ServiceConfig(
        String host,
        int port,
        Credentials credentials,
        int pollIntervalSeconds,
        int batchSize,
        int chunkSizeBytes,
        String namespace,
        Optional<URI> webhookUrl,
        String processor,
        Path repositoryRoot,
        Optional<Path> stateFile,
        BackoffPolicy retry,
        int startupConnectAttempts,
        Optional<Level> logLevel
) {
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder seeded from the defaults/environment layer.
     */
    public static Builder builder(IsccServiceConfig mapping) {
        IsccServiceConfig.Retry retry = mapping.retry();
        return new Builder()
                .host(mapping.host())
                .port(mapping.port())
                .username(mapping.username().orElse(null))
                .password(mapping.password().orElse(null))
                .pollIntervalSeconds(mapping.pollIntervalSeconds())
                .batchSize(mapping.batchSize())
                .chunkSizeBytes(mapping.chunkSizeBytes())
                .namespace(mapping.namespace())
                .webhookUrl(mapping.webhookUrl().orElse(null))
                .processor(mapping.processor())
                .repositoryRoot(mapping.repositoryRoot())
                .stateFile(mapping.stateFile().orElse(null))
                .startupConnectAttempts(mapping.startupConnectAttempts())
                .logLevel(mapping.logLevel().orElse(null))
                .retry(retry.initialDelay(), retry.multiplier(), retry.maxDelay(), retry.jitter());
    }

    public static final class Builder {

        private String host = "localhost";
        private int port = 4064;
        private String username;
        private String password;
        private int pollIntervalSeconds = 60;
        private int batchSize = 100;
        private int chunkSizeBytes = 1024 * 1024;
        private String namespace = "org.iscc.omero.sum";
        private String webhookUrl;
        private String processor = "omero-iscc-service";
        private String repositoryRoot = "/data/repository";
        private String stateFile;
        private int startupConnectAttempts = 30;
        private String logLevel;
        private Duration retryInitialDelay = Duration.ofSeconds(2);
        private double retryMultiplier = 1.5;
        private Duration retryMaxDelay = Duration.ofSeconds(30);
        private double retryJitter = 0.1;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder pollIntervalSeconds(int pollIntervalSeconds) {
            this.pollIntervalSeconds = pollIntervalSeconds;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder chunkSizeBytes(int chunkSizeBytes) {
            this.chunkSizeBytes = chunkSizeBytes;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public Builder processor(String processor) {
            this.processor = processor;
            return this;
        }

        public Builder repositoryRoot(String repositoryRoot) {
            this.repositoryRoot = repositoryRoot;
            return this;
        }

        public Builder stateFile(String stateFile) {
            this.stateFile = stateFile;
            return this;
        }

        public Builder startupConnectAttempts(int startupConnectAttempts) {
            this.startupConnectAttempts = startupConnectAttempts;
            return this;
        }

        public Builder logLevel(String logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder retry(Duration initialDelay, double multiplier, Duration maxDelay, double jitter) {
            this.retryInitialDelay = initialDelay;
            this.retryMultiplier = multiplier;
            this.retryMaxDelay = maxDelay;
            this.retryJitter = jitter;
            return this;
        }

        /**
         * Validate and freeze.
         *
         * @throws ConfigException listing every invalid setting
         */
        public ServiceConfig build() {
            List<String> problems = new ArrayList<>();

            if (host == null || host.isBlank()) {
                problems.add("host must not be blank");
            }
            if (port < 1 || port > 65535) {
                problems.add("port must be between 1 and 65535, got " + port);
            }
            if (pollIntervalSeconds < 1) {
                problems.add("poll_interval must be at least 1 second, got " + pollIntervalSeconds);
            }
            if (batchSize < 1) {
                problems.add("batch_size must be positive, got " + batchSize);
            }
            if (chunkSizeBytes < 1) {
                problems.add("chunk_size must be positive, got " + chunkSizeBytes);
            }
            if (namespace == null || namespace.isBlank()) {
                problems.add("namespace must not be blank");
            } else if (namespace.equals(".") || namespace.equals("..")) {
                problems.add("namespace must not be '.' or '..'");
            }
            if (processor == null || processor.isBlank()) {
                problems.add("processor must not be blank");
            }
            if (startupConnectAttempts < 0) {
                problems.add("startup_connect_attempts must not be negative, got " + startupConnectAttempts);
            }

            Optional<Level> level = Optional.empty();
            if (logLevel != null && !logLevel.isBlank()) {
                level = LogLevels.parse(logLevel);
                if (level.isEmpty()) {
                    problems.add("log_level must be one of debug, info, warning, error, critical, got " + logLevel);
                }
            }

            Optional<URI> webhook = parseWebhook(problems);
            Path root = parsePath("repository_root", repositoryRoot, problems);
            Path state = stateFile == null || stateFile.isBlank() ? null : parsePath("state_file", stateFile, problems);

            BackoffPolicy retry = null;
            try {
                retry = new BackoffPolicy(retryInitialDelay, retryMultiplier, retryMaxDelay, retryJitter);
            } catch (IllegalArgumentException e) {
                problems.add("retry: " + e.getMessage());
            }

            if (!problems.isEmpty()) {
                throw new ConfigException("load_config", problems);
            }

            return new ServiceConfig(
                    host,
                    port,
                    new Credentials(username, password),
                    pollIntervalSeconds,
                    batchSize,
                    chunkSizeBytes,
                    namespace,
                    webhook,
                    processor,
                    root,
                    Optional.ofNullable(state),
                    retry,
                    startupConnectAttempts,
                    level
            );
        }

        private Optional<URI> parseWebhook(List<String> problems) {
            if (webhookUrl == null || webhookUrl.isBlank()) {
                return Optional.empty();
            }
            try {
                URI uri = new URI(webhookUrl);
                String scheme = uri.getScheme();
                if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                    problems.add("webhook_url must be an absolute http(s) URL, got " + webhookUrl);
                    return Optional.empty();
                }
                return Optional.of(uri);
            } catch (URISyntaxException e) {
                problems.add("webhook_url is malformed: " + e.getMessage());
                return Optional.empty();
            }
        }

        private static Path parsePath(String name, String value, List<String> problems) {
            if (value == null || value.isBlank()) {
                problems.add(name + " must not be blank");
                return null;
            }
            try {
                return Path.of(value);
            } catch (InvalidPathException e) {
                problems.add(name + " is not a valid path: " + e.getMessage());
                return null;
            }
        }
    }
}
