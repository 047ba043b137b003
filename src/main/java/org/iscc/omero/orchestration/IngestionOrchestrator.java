package org.iscc.omero.orchestration;

import org.iscc.omero.config.ServiceConfig;
import org.iscc.omero.domain.AssetOutcome;
import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.Batch;
import org.iscc.omero.domain.Cursor;
import org.iscc.omero.domain.FileLocator;
import org.iscc.omero.domain.FingerprintRecord;
import org.iscc.omero.exception.IsccServiceException;
import org.iscc.omero.exception.RecordWriteException;
import org.iscc.omero.exception.RepositoryUnavailableException;
import org.iscc.omero.exception.SourceUnreadableException;
import org.iscc.omero.fingerprint.Fingerprint;
import org.iscc.omero.fingerprint.FingerprintCache;
import org.iscc.omero.fingerprint.FingerprintComputer;
import org.iscc.omero.fingerprint.RawSource;
import org.iscc.omero.monitor.AssetMonitor;
import org.iscc.omero.sink.NotificationSink;
import org.iscc.omero.source.RepositoryClient;
import org.iscc.omero.source.RepositorySession;
import org.iscc.omero.tracker.CursorStore;
import org.iscc.omero.tracker.DeduplicationFilter;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Drives the ingestion loop: connect → poll → dedupe → fingerprint → write record → advance cursor.
 * <p>
 * Runs on a single thread. Assets of a batch are handled strictly in order and the cursor only
 * moves past an asset once its record is committed or the asset is explicitly skipped, so a
 * connection fault mid-batch resumes at the failed asset. A stop request is honoured between
 * assets; the in-flight asset always finishes.
 */
public class IngestionOrchestrator {

    private static final Logger LOG = Logger.getLogger(IngestionOrchestrator.class);

    private enum CycleResult {
        EMPTY,
        PROCESSED,
        FAULT
    }

    private final ServiceConfig config;
    private final RepositoryClient client;
    private final AssetMonitor monitor;
    private final DeduplicationFilter filter;
    private final FingerprintComputer computer;
    private final NotificationSink notifier;
    private final CursorStore cursorStore;
    private final StopToken stop;
    private final Sleeper sleeper;
    private final Clock clock;
    private final FingerprintCache fingerprints = new FingerprintCache(FingerprintCache.DEFAULT_CAPACITY);

    private final AtomicLong committed = new AtomicLong();
    private final AtomicLong alreadyProcessed = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong cycles = new AtomicLong();

    private volatile OrchestratorState state = OrchestratorState.DISCONNECTED;
    private volatile Cursor cursor = Cursor.initial();
    private volatile RepositorySession session;
    private volatile Instant lastPollAt;

    private boolean everConnected;
    private int consecutiveFaults;
    private Consumer<OrchestratorState> transitionListener = s -> {
    };

    public IngestionOrchestrator(ServiceConfig config,
                                 RepositoryClient client,
                                 AssetMonitor monitor,
                                 DeduplicationFilter filter,
                                 FingerprintComputer computer,
                                 NotificationSink notifier,
                                 CursorStore cursorStore,
                                 StopToken stop,
                                 Sleeper sleeper,
                                 Clock clock) {
        this.config = config;
        this.client = client;
        this.monitor = monitor;
        this.filter = filter;
        this.computer = computer;
        this.notifier = notifier;
        this.cursorStore = cursorStore;
        this.stop = stop;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Observe state transitions. Called on the orchestrator thread.
     */
    public void onTransition(Consumer<OrchestratorState> listener) {
        this.transitionListener = listener;
    }

    /**
     * Run until stopped, or for exactly one poll cycle when {@code once} is set.
     */
    public RunSummary run(boolean once) {
        cursor = cursorStore.load().orElse(Cursor.initial());
        LOG.infof("Starting ingestion from %s (namespace: %s, batch size: %d, poll interval: %ds)",
                cursor, config.namespace(), config.batchSize(), config.pollIntervalSeconds());

        RunSummary.Outcome outcome = RunSummary.Outcome.STOPPED;
        try {
            while (!stop.isStopRequested()) {
                if (session == null && !connect()) {
                    if (!stop.isStopRequested()) {
                        outcome = RunSummary.Outcome.CONNECT_FAILED;
                    }
                    break;
                }

                CycleResult result = pollCycle();
                if (result == CycleResult.FAULT) {
                    disconnect();
                    continue;
                }

                consecutiveFaults = 0;
                cycles.incrementAndGet();

                if (once) {
                    outcome = RunSummary.Outcome.COMPLETED;
                    break;
                }
                if (result == CycleResult.EMPTY && !stop.isStopRequested()) {
                    sleeper.sleep(Duration.ofSeconds(config.pollIntervalSeconds()), stop);
                }
            }
        } finally {
            shutdown();
        }

        return new RunSummary(outcome, status());
    }

    public OrchestratorStatus status() {
        return new OrchestratorStatus(
                state,
                session != null,
                cursor,
                committed.get(),
                alreadyProcessed.get(),
                skipped.get(),
                cycles.get(),
                lastPollAt
        );
    }

    public OrchestratorState state() {
        return state;
    }

    public Cursor cursor() {
        return cursor;
    }

    private boolean connect() {
        transition(OrchestratorState.CONNECTING);

        if (consecutiveFaults > 0) {
            Duration pause = config.retry().delayFor(consecutiveFaults);
            LOG.infof("Reconnecting in %s after connection fault", pause);
            sleeper.sleep(pause, stop);
        }

        int attempt = 0;
        while (!stop.isStopRequested()) {
            attempt++;
            try {
                session = client.connect(config.host(), config.port(), config.credentials());
                everConnected = true;
                LOG.infof("Connected to repository at %s", session.endpoint());
                return true;
            } catch (RepositoryUnavailableException e) {
                int limit = config.startupConnectAttempts();
                if (!everConnected && limit > 0 && attempt >= limit) {
                    LOG.errorf("Repository at %s:%d unreachable after %d attempts: %s",
                            config.host(), config.port(), attempt, e.getMessage());
                    return false;
                }

                Duration delay = config.retry().delayFor(attempt);
                LOG.warnf("Connection attempt %d to %s:%d failed (%s), retrying in %s",
                        attempt, config.host(), config.port(), e.getMessage(), delay);
                sleeper.sleep(delay, stop);
            }
        }
        return false;
    }

    private CycleResult pollCycle() {
        transition(OrchestratorState.POLLING);

        Batch batch;
        try {
            batch = monitor.poll(session, cursor, config.batchSize());
            lastPollAt = clock.instant();
        } catch (RepositoryUnavailableException e) {
            LOG.warnf("Poll failed: %s", e.getMessage());
            return CycleResult.FAULT;
        }

        if (batch.isEmpty()) {
            LOG.debugf("No new assets after %s", cursor);
            return CycleResult.EMPTY;
        }

        transition(OrchestratorState.PROCESSING);
        LOG.infof("Processing batch of %d assets", batch.size());

        for (AssetReference asset : batch.assets()) {
            if (stop.isStopRequested()) {
                LOG.infof("Stop requested, leaving asset %s and later ones for the next run", asset.id());
                return CycleResult.PROCESSED;
            }

            AssetOutcome outcome = processAsset(asset);
            if (!outcome.handled()) {
                LOG.warnf("Connection fault on asset %s: %s", asset.id(), outcome.message());
                return CycleResult.FAULT;
            }
            advanceCursor(asset);
        }

        return CycleResult.PROCESSED;
    }

    AssetOutcome processAsset(AssetReference asset) {
        String namespace = config.namespace();

        try {
            if (filter.isProcessed(session, asset, namespace)) {
                LOG.debugf("Asset %s already has a record in %s, skipping", asset.id(), namespace);
                if (LOG.isDebugEnabled()) {
                    filter.existingRecord(session, asset, namespace);
                }
                alreadyProcessed.incrementAndGet();
                return AssetOutcome.alreadyProcessed(asset.id());
            }
        } catch (RepositoryUnavailableException e) {
            return AssetOutcome.connectionFault(asset.id(), e.getMessage());
        }

        Fingerprint fingerprint;
        Optional<Fingerprint> cached = fingerprints.get(asset);
        if (cached.isPresent()) {
            fingerprint = cached.get();
            LOG.infof("Using cached fingerprint %s for asset %s", fingerprint.code(), asset.id());
        } else {
            try {
                if (asset.rawFileLocators().isEmpty()) {
                    throw SourceUnreadableException.noRawFiles(asset.id());
                }
                fingerprint = computer.compute(rawSources(asset), config.chunkSizeBytes());
            } catch (SourceUnreadableException e) {
                LOG.warnf(e, "Skipping unreadable asset %s (%s)", asset.id(), asset.name());
                skipped.incrementAndGet();
                return AssetOutcome.unreadable(asset.id(), e.getMessage());
            } catch (RepositoryUnavailableException e) {
                return AssetOutcome.connectionFault(asset.id(), e.getMessage());
            }
            fingerprints.put(asset, fingerprint);
        }

        FingerprintRecord record = new FingerprintRecord(
                fingerprint.code(),
                fingerprint.algorithmVersion(),
                asset.primaryFileName(),
                clock.instant(),
                config.processor(),
                namespace,
                fingerprint.units()
        );

        IsccServiceException writeFailure = writeWithRetry(asset, record);
        if (writeFailure != null) {
            return AssetOutcome.connectionFault(asset.id(), writeFailure.getMessage());
        }

        committed.incrementAndGet();
        LOG.infof("Fingerprinted asset %s (%s, %d bytes): %s",
                asset.id(), asset.name(), fingerprint.bytesProcessed(), fingerprint.code());

        notifyQuietly(asset, record);
        return AssetOutcome.committed(asset.id(), fingerprint.code());
    }

    private IsccServiceException writeWithRetry(AssetReference asset, FingerprintRecord record) {
        try {
            client.writeRecord(session, asset.id(), record);
            return null;
        } catch (RecordWriteException | RepositoryUnavailableException first) {
            LOG.warnf(first, "Writing record for asset %s failed, retrying once", asset.id());
        }

        try {
            client.writeRecord(session, asset.id(), record);
            return null;
        } catch (RecordWriteException | RepositoryUnavailableException second) {
            LOG.errorf(second, "Writing record for asset %s failed again", asset.id());
            return second;
        }
    }

    private void notifyQuietly(AssetReference asset, FingerprintRecord record) {
        try {
            notifier.notifyCommitted(asset, record);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Notification for asset %s failed", asset.id());
        }
    }

    private List<RawSource> rawSources(AssetReference asset) {
        RepositorySession current = session;
        List<RawSource> sources = new ArrayList<>();
        for (FileLocator locator : asset.rawFileLocators()) {
            sources.add(new RawSource(locator.name(), locator.sizeBytes(),
                    () -> client.openRawStream(current, locator)));
        }
        return sources;
    }

    private void advanceCursor(AssetReference asset) {
        Cursor next = cursor.advance(asset);
        if (!next.equals(cursor)) {
            cursor = next;
            cursorStore.save(next);
        }
    }

    private void disconnect() {
        consecutiveFaults++;
        closeSession();
        transition(OrchestratorState.DISCONNECTED);
    }

    private void shutdown() {
        transition(OrchestratorState.STOPPING);
        cursorStore.save(cursor);
        closeSession();
        transition(OrchestratorState.STOPPED);
        LOG.infof("Ingestion stopped: %s", status());
    }

    private void closeSession() {
        RepositorySession current = session;
        session = null;
        if (current == null) {
            return;
        }
        try {
            client.close(current);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to close session %s", current.id());
        }
    }

    private void transition(OrchestratorState next) {
        if (state != next) {
            LOG.debugf("State %s -> %s", state, next);
        }
        state = next;
        transitionListener.accept(next);
    }
}
