package org.iscc.omero.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON configuration file. {@code log_file} and the legacy retry keys are accepted but have no
 * effect; the loader warns when {@code log_file} is set.
 */
@JsonIgnoreProperties({"secure", "max_retries", "retry_delay"})
public record ConfigFile(
        @JsonProperty("host") String host,
        @JsonProperty("port") Integer port,
        @JsonProperty("username") String username,
        @JsonProperty("password") String password,
        @JsonProperty("poll_interval") Integer pollInterval,
        @JsonProperty("batch_size") Integer batchSize,
        @JsonProperty("chunk_size") Integer chunkSize,
        @JsonProperty("namespace") String namespace,
        @JsonProperty("webhook_url") String webhookUrl,
        @JsonProperty("processor") String processor,
        @JsonProperty("repository_root") String repositoryRoot,
        @JsonProperty("state_file") String stateFile,
        @JsonProperty("startup_connect_attempts") Integer startupConnectAttempts,
        @JsonProperty("log_level") String logLevel,
        @JsonProperty("log_file") String logFile
) {
    public ConfigOverrides toOverrides() {
        return new ConfigOverrides(host, port, username, password, pollInterval, batchSize, chunkSize,
                namespace, webhookUrl, processor, repositoryRoot, stateFile, startupConnectAttempts, logLevel);
    }
}
