package org.iscc.omero.sink;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.FingerprintRecord;
import org.iscc.omero.exception.NotificationException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts an {@code iscc_generated} JSON event to a webhook for every committed record.
 */
public class WebhookNotificationSink implements NotificationSink {

    private static final Logger LOG = Logger.getLogger(WebhookNotificationSink.class);

    public static final String EVENT = "iscc_generated";
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final URI url;
    private final HttpClient http;
    private final ObjectMapper json;

    public WebhookNotificationSink(URI url, ObjectMapper json) {
        this(url, HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), json);
    }

    WebhookNotificationSink(URI url, HttpClient http, ObjectMapper json) {
        this.url = url;
        this.http = http;
        this.json = json;
    }

    @Override
    public void notifyCommitted(AssetReference asset, FingerprintRecord record) {
        String body;
        try {
            body = json.writeValueAsString(new Event(
                    EVENT,
                    asset.id(),
                    asset.name(),
                    record.code(),
                    record.namespace(),
                    record.sourceFileName(),
                    record.computedAt().toString()
            ));
        } catch (JsonProcessingException e) {
            throw new NotificationException(url.toString(), "Failed to encode event", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(url)
                .header("Content-Type", "application/json")
                .timeout(REQUEST_TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NotificationException(url.toString(), e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException(url.toString(), "Interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new NotificationException(url.toString(), "Webhook returned status " + response.statusCode());
        }

        LOG.debugf("Webhook notification sent for asset %s", asset.id());
    }

    record Event(
            @JsonProperty("event") String event,
            @JsonProperty("asset_id") String assetId,
            @JsonProperty("asset_name") String assetName,
            @JsonProperty("iscc_code") String isccCode,
            @JsonProperty("namespace") String namespace,
            @JsonProperty("source_file") String sourceFile,
            @JsonProperty("timestamp") String timestamp
    ) {
    }
}
