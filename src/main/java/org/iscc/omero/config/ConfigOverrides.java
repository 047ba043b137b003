package org.iscc.omero.config;

/**
 * Partial configuration layer: every non-null value replaces the one below it.
 */
public record ConfigOverrides(
        String host,
        Integer port,
        String username,
        String password,
        Integer pollIntervalSeconds,
        Integer batchSize,
        Integer chunkSizeBytes,
        String namespace,
        String webhookUrl,
        String processor,
        String repositoryRoot,
        String stateFile,
        Integer startupConnectAttempts,
        String logLevel
) {
    public static ConfigOverrides none() {
        return new ConfigOverrides(null, null, null, null, null, null, null,
                null, null, null, null, null, null, null);
    }

    public ServiceConfig.Builder applyTo(ServiceConfig.Builder builder) {
        if (host != null) {
            builder.host(host);
        }
        if (port != null) {
            builder.port(port);
        }
        if (username != null) {
            builder.username(username);
        }
        if (password != null) {
            builder.password(password);
        }
        if (pollIntervalSeconds != null) {
            builder.pollIntervalSeconds(pollIntervalSeconds);
        }
        if (batchSize != null) {
            builder.batchSize(batchSize);
        }
        if (chunkSizeBytes != null) {
            builder.chunkSizeBytes(chunkSizeBytes);
        }
        if (namespace != null) {
            builder.namespace(namespace);
        }
        if (webhookUrl != null) {
            builder.webhookUrl(webhookUrl);
        }
        if (processor != null) {
            builder.processor(processor);
        }
        if (repositoryRoot != null) {
            builder.repositoryRoot(repositoryRoot);
        }
        if (stateFile != null) {
            builder.stateFile(stateFile);
        }
        if (startupConnectAttempts != null) {
            builder.startupConnectAttempts(startupConnectAttempts);
        }
        if (logLevel != null) {
            builder.logLevel(logLevel);
        }
        return builder;
    }
}
