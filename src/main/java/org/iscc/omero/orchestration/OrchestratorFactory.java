package org.iscc.omero.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iscc.omero.config.ServiceConfig;
import org.iscc.omero.fingerprint.FingerprintComputer;
import org.iscc.omero.monitor.AssetMonitor;
import org.iscc.omero.sink.NoOpNotificationSink;
import org.iscc.omero.sink.NotificationSink;
import org.iscc.omero.sink.WebhookNotificationSink;
import org.iscc.omero.source.FilesystemRepositoryClient;
import org.iscc.omero.source.RepositoryClient;
import org.iscc.omero.tracker.CursorStore;
import org.iscc.omero.tracker.DeduplicationFilter;
import org.iscc.omero.tracker.FileCursorStore;
import org.iscc.omero.tracker.InMemoryCursorStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Wires an orchestrator for a loaded configuration.
 */
@ApplicationScoped
public class OrchestratorFactory {

    private static final Logger LOG = Logger.getLogger(OrchestratorFactory.class);

    @Inject
    FingerprintComputer computer;

    @Inject
    ObjectMapper mapper;

    public IngestionOrchestrator create(ServiceConfig config, StopToken stop) {
        RepositoryClient client = new FilesystemRepositoryClient(config.repositoryRoot(), mapper);

        CursorStore cursorStore = config.stateFile()
                .<CursorStore>map(path -> new FileCursorStore(path, mapper))
                .orElseGet(InMemoryCursorStore::new);

        NotificationSink notifier = config.webhookUrl()
                .<NotificationSink>map(url -> new WebhookNotificationSink(url, mapper))
                .orElse(NoOpNotificationSink.INSTANCE);

        LOG.infof("Repository root %s, checkpoint %s, webhook %s",
                config.repositoryRoot(),
                config.stateFile().map(Object::toString).orElse("in memory"),
                config.webhookUrl().map(Object::toString).orElse("none"));

        return new IngestionOrchestrator(
                config,
                client,
                new AssetMonitor(client),
                new DeduplicationFilter(client),
                computer,
                notifier,
                cursorStore,
                stop,
                Sleeper.interruptible(),
                Clock.systemUTC()
        );
    }
}
