package org.iscc.omero.monitor;

import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.Batch;
import org.iscc.omero.domain.Cursor;
import org.iscc.omero.source.Credentials;
import org.iscc.omero.source.InMemoryRepositoryClient;
import org.iscc.omero.source.RepositorySession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AssetMonitorTest {

    private static final Instant T1 = Instant.parse("2024-04-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-04-01T10:00:05Z");

    private InMemoryRepositoryClient client;
    private AssetMonitor monitor;
    private RepositorySession session;

    @BeforeEach
    void setup() {
        client = new InMemoryRepositoryClient();
        monitor = new AssetMonitor(client);
        session = client.connect("localhost", 4064, Credentials.anonymous());
    }

    private static List<String> ids(Batch batch) {
        return batch.assets().stream().map(AssetReference::id).collect(Collectors.toList());
    }

    @Test
    void shouldReturnAssetsInImportOrder() {
        client.addAsset("later", T2, "x");
        client.addAsset("b", T1, "x");
        client.addAsset("a", T1, "x");

        Batch batch = monitor.poll(session, Cursor.initial(), 10);

        assertEquals(List.of("a", "b", "later"), ids(batch));
    }

    @Test
    void shouldBoundBatchSize() {
        for (int i = 0; i < 5; i++) {
            client.addAsset("asset-" + i, T1.plusSeconds(i), "x");
        }

        Batch batch = monitor.poll(session, Cursor.initial(), 2);

        assertEquals(2, batch.size());
        assertEquals(List.of("asset-0", "asset-1"), ids(batch));
        assertEquals(List.of(2), client.queriedBatchSizes());
    }

    @Test
    void shouldOnlyReturnAssetsAfterCursor() {
        AssetReference a = client.addAsset("a", T1, "x");
        client.addAsset("b", T1, "x");
        client.addAsset("c", T2, "x");

        Batch batch = monitor.poll(session, Cursor.at(a), 10);

        assertEquals(List.of("b", "c"), ids(batch));
    }

    @Test
    void shouldReturnEmptyBatchWhenNothingIsNew() {
        AssetReference only = client.addAsset("a", T1, "x");

        Batch batch = monitor.poll(session, Cursor.at(only), 10);

        assertTrue(batch.isEmpty());
    }

    @Test
    void shouldRejectNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> monitor.poll(session, Cursor.initial(), 0));
    }
}
