package org.iscc.omero.domain;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fingerprint metadata attached to an asset under a namespace.
 * Serialized as a flat key/value map; the required keys are fixed, anything else
 * travels in {@link #extensions()}.
 */
public record FingerprintRecord(
        String code,
        String algorithmVersion,
        String sourceFileName,
        Instant computedAt,
        String processorIdentity,
        String namespace,
        Map<String, String> extensions
) {
    public static final String KEY_CODE = "code";
    public static final String KEY_VERSION = "version";
    public static final String KEY_SOURCE_FILE = "source_file";
    public static final String KEY_TIMESTAMP = "timestamp";
    public static final String KEY_PROCESSOR = "processor";

    public static final List<String> REQUIRED_KEYS =
            List.of(KEY_CODE, KEY_VERSION, KEY_SOURCE_FILE, KEY_TIMESTAMP, KEY_PROCESSOR);

    public FingerprintRecord {
        requireText(code, "code");
        requireText(algorithmVersion, "algorithmVersion");
        requireText(sourceFileName, "sourceFileName");
        requireText(processorIdentity, "processorIdentity");
        requireText(namespace, "namespace");
        if (computedAt == null) {
            throw new IllegalArgumentException("computedAt cannot be null");
        }
        extensions = extensions != null ? Map.copyOf(extensions) : Map.of();
        for (String key : extensions.keySet()) {
            if (REQUIRED_KEYS.contains(key)) {
                throw new IllegalArgumentException("Extension key shadows required key: " + key);
            }
        }
    }

    public static FingerprintRecord of(String code, String algorithmVersion, String sourceFileName,
                                       Instant computedAt, String processorIdentity, String namespace) {
        return new FingerprintRecord(code, algorithmVersion, sourceFileName, computedAt,
                processorIdentity, namespace, Map.of());
    }

    /**
     * Key/value form persisted on the repository. Required keys come first, in a fixed order.
     */
    public Map<String, String> toKeyValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(KEY_CODE, code);
        values.put(KEY_VERSION, algorithmVersion);
        values.put(KEY_SOURCE_FILE, sourceFileName);
        values.put(KEY_TIMESTAMP, computedAt.toString());
        values.put(KEY_PROCESSOR, processorIdentity);
        extensions.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> values.put(e.getKey(), e.getValue()));
        return values;
    }

    /**
     * Rebuild a record from its persisted key/value form.
     *
     * @throws IllegalArgumentException if a required key is missing or the timestamp is malformed
     */
    public static FingerprintRecord fromKeyValues(String namespace, Map<String, String> values) {
        for (String key : REQUIRED_KEYS) {
            if (!values.containsKey(key)) {
                throw new IllegalArgumentException("Record is missing key: " + key);
            }
        }

        Instant computedAt;
        try {
            computedAt = Instant.parse(values.get(KEY_TIMESTAMP));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed record timestamp: " + values.get(KEY_TIMESTAMP), e);
        }

        Map<String, String> extensions = new LinkedHashMap<>(values);
        REQUIRED_KEYS.forEach(extensions::remove);

        return new FingerprintRecord(
                values.get(KEY_CODE),
                values.get(KEY_VERSION),
                values.get(KEY_SOURCE_FILE),
                computedAt,
                values.get(KEY_PROCESSOR),
                namespace,
                extensions
        );
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be blank");
        }
    }
}
