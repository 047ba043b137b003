package org.iscc.omero.cli;

import org.iscc.omero.config.ConfigOverrides;
import org.iscc.omero.config.IsccServiceConfig;
import org.iscc.omero.config.LogLevels;
import org.iscc.omero.config.ServiceConfig;
import org.iscc.omero.config.ServiceConfigLoader;
import org.iscc.omero.exception.ConfigException;
import org.iscc.omero.orchestration.IngestionOrchestrator;
import org.iscc.omero.orchestration.OrchestratorFactory;
import org.iscc.omero.orchestration.RunSummary;
import org.iscc.omero.orchestration.ShutdownCoordinator;
import org.iscc.omero.orchestration.StopToken;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Entry point: watches the repository and records ISCC fingerprints for new assets.
 */
@TopCommand
@Command(
        name = "omero-iscc",
        version = "omero-iscc-service 0.1.0",
        description = "Watch a media repository and record ISCC fingerprints for newly imported assets",
        mixinStandardHelpOptions = true
)
public class IsccServiceCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(IsccServiceCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG_ERROR = 2;
    public static final int EXIT_REPOSITORY_UNREACHABLE = 3;

    @Inject
    IsccServiceConfig environment;

    @Inject
    ServiceConfigLoader loader;

    @Inject
    OrchestratorFactory factory;

    @Inject
    ShutdownCoordinator shutdown;

    @Option(names = "--config", description = "JSON configuration file")
    Path configFile;

    @Option(names = "--once", description = "Process one poll cycle and exit")
    boolean once;

    @Option(names = "--host", description = "Repository host")
    String host;

    @Option(names = "--port", description = "Repository port")
    Integer port;

    @Option(names = "--username", description = "Repository username")
    String username;

    @Option(names = "--password", description = "Repository password")
    String password;

    @Option(names = "--poll-interval", description = "Seconds between polls")
    Integer pollInterval;

    @Option(names = "--batch-size", description = "Maximum assets per poll")
    Integer batchSize;

    @Option(names = "--chunk-size", description = "Read size in bytes while fingerprinting")
    Integer chunkSize;

    @Option(names = "--namespace", description = "Namespace of the fingerprint records")
    String namespace;

    @Option(names = "--webhook-url", description = "URL notified after every recorded fingerprint")
    String webhookUrl;

    @Option(names = "--repository-root", description = "Directory holding the repository's files")
    String repositoryRoot;

    @Option(names = "--state-file", description = "Cursor checkpoint file")
    String stateFile;

    @Option(names = "--log-level", description = "debug, info, warning, error or critical")
    String logLevel;

    @Override
    public Integer call() {
        ServiceConfig config;
        try {
            config = loader.load(ServiceConfig.builder(environment), configFile, overrides());
        } catch (ConfigException e) {
            LOG.errorf("Invalid configuration: %s", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        config.logLevel().ifPresent(LogLevels::apply);

        LOG.infof("Starting OMERO ISCC service against %s:%d (repository root: %s)",
                config.host(), config.port(), config.repositoryRoot());

        StopToken stop = shutdown.begin();
        try {
            IngestionOrchestrator orchestrator = factory.create(config, stop);
            RunSummary summary = orchestrator.run(once);

            if (summary.outcome() == RunSummary.Outcome.CONNECT_FAILED) {
                return EXIT_REPOSITORY_UNREACHABLE;
            }
            return EXIT_OK;
        } finally {
            shutdown.finish();
        }
    }

    ConfigOverrides overrides() {
        return new ConfigOverrides(host, port, username, password, pollInterval, batchSize, chunkSize,
                namespace, webhookUrl, null, repositoryRoot, stateFile, null, logLevel);
    }
}
