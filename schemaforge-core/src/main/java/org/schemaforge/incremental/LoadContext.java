package org.schemaforge.incremental;

import org.schemaforge.model.CanonicalSchema;

import java.util.List;

/**
 * Resolved inputs of one generation call.
 *
 * @param target      fully qualified target table reference
 * @param staging     fully qualified staging table reference
 * @param dataColumns columns copied from staging to target, in schema order
 */
public record LoadContext(CanonicalSchema schema,
                          IncrementalConfig config,
                          String tableName,
                          String stagingName,
                          String target,
                          String staging,
                          List<String> dataColumns) {

    public List<String> keys() {
        return config.getPrimaryKeys();
    }

    public boolean isKey(String column) {
        return keys().stream().anyMatch(column::equalsIgnoreCase);
    }
}
