package org.schemaforge.render;

import java.util.Locale;

/**
 * File format of a bulk-load source, derived from its extension.
 */
public enum DataFormat {
    CSV,
    JSON,
    PARQUET,
    AVRO;

    public static DataFormat fromReference(String dataReference) {
        String lower = dataReference.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json") || lower.endsWith(".jsonl") || lower.endsWith(".ndjson")) {
            return JSON;
        }
        if (lower.endsWith(".parquet")) {
            return PARQUET;
        }
        if (lower.endsWith(".avro")) {
            return AVRO;
        }
        return CSV;
    }
}
