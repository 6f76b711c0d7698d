package org.schemaforge.incremental;

import lombok.Builder;
import lombok.Value;
import org.schemaforge.error.ConfigurationException;
import org.schemaforge.model.CanonicalSchema;

import java.util.List;

/**
 * Everything a load pattern needs beyond the schema. Field requirements depend on the pattern,
 * see {@link #validate(CanonicalSchema)}.
 */
@Value
@Builder(toBuilder = true)
public class IncrementalConfig {

    public static final String PRIMARY_KEYS = "primary_keys";
    public static final String UPDATE_COLUMNS = "update_columns";
    public static final String INCREMENTAL_COLUMN = "incremental_column";
    public static final String HASH_COLUMNS = "hash_columns";
    public static final String EFFECTIVE_DATE_COLUMN = "effective_date_column";
    public static final String EXPIRATION_DATE_COLUMN = "expiration_date_column";
    public static final String IS_CURRENT_COLUMN = "is_current_column";
    public static final String OPERATION_COLUMN = "operation_column";
    public static final String SEQUENCE_COLUMN = "sequence_column";
    public static final String SOFT_DELETE_COLUMN = "soft_delete_column";
    public static final String LOAD_PATTERN = "load_pattern";

    public static final String DEFAULT_FAR_FUTURE_DATE = "9999-12-31";
    public static final String DEFAULT_STAGING_SUFFIX = "_staging";

    LoadPattern loadPattern;
    List<String> primaryKeys;
    MergeStrategy mergeStrategy;
    List<String> updateColumns;
    String incrementalColumn;
    LookbackWindow lookbackWindow;
    String effectiveDateColumn;
    String expirationDateColumn;
    String isCurrentColumn;
    List<String> hashColumns;
    String operationColumn;
    String sequenceColumn;
    DeleteStrategy deleteStrategy;
    String softDeleteColumn;
    String updatedAtColumn;
    String snapshotColumn;
    String stagingTable;
    String stagingSuffix;
    String farFutureDate;
    boolean useTransaction;

    public static IncrementalConfig of(LoadPattern pattern) {
        return builder().loadPattern(pattern).build();
    }

    public static class IncrementalConfigBuilder {
        private List<String> primaryKeys = List.of();
        private MergeStrategy mergeStrategy = MergeStrategy.UPDATE_ALL;
        private List<String> updateColumns = List.of();
        private String effectiveDateColumn = "effective_from";
        private String expirationDateColumn = "effective_to";
        private String isCurrentColumn = "is_current";
        private List<String> hashColumns = List.of();
        private DeleteStrategy deleteStrategy = DeleteStrategy.IGNORE;
        private String snapshotColumn = "snapshot_at";
        private String stagingSuffix = DEFAULT_STAGING_SUFFIX;
        private String farFutureDate = DEFAULT_FAR_FUTURE_DATE;
        private boolean useTransaction = true;
    }

    public String resolveStagingTable(String targetTable) {
        return stagingTable != null && !stagingTable.isBlank() ? stagingTable : targetTable + stagingSuffix;
    }

    /**
     * Checks the pattern's required fields and that every source column it reads exists.
     *
     * @throws ConfigurationException naming the first offending field
     */
    public void validate(CanonicalSchema schema) {
        if (loadPattern == null) {
            throw new ConfigurationException(LOAD_PATTERN, "load_pattern is required");
        }
        for (String field : loadPattern.requiredFields()) {
            requirePresent(field);
        }

        if (loadPattern == LoadPattern.UPSERT && mergeStrategy == MergeStrategy.UPDATE_SELECTIVE
                && isEmpty(updateColumns)) {
            throw new ConfigurationException(UPDATE_COLUMNS, "update_columns required for UPDATE_SELECTIVE merge strategy");
        }
        if (loadPattern == LoadPattern.CDC_MERGE && deleteStrategy == DeleteStrategy.SOFT_DELETE
                && isBlank(softDeleteColumn)) {
            throw new ConfigurationException(SOFT_DELETE_COLUMN, "soft_delete_column required for SOFT_DELETE delete strategy");
        }
        if (loadPattern == LoadPattern.SCD_TYPE2 && isBlank(farFutureDate)) {
            throw new ConfigurationException("far_future_date", "far_future_date required for scd_type2");
        }

        requireColumns(schema, PRIMARY_KEYS, primaryKeys);
        if (loadPattern == LoadPattern.UPSERT && mergeStrategy == MergeStrategy.UPDATE_SELECTIVE) {
            requireColumns(schema, UPDATE_COLUMNS, updateColumns);
            for (String column : updateColumns) {
                if (primaryKeys.stream().anyMatch(column::equalsIgnoreCase)) {
                    throw new ConfigurationException(UPDATE_COLUMNS, "primary key column '" + column + "' cannot be updated");
                }
            }
        }
        if (loadPattern == LoadPattern.INCREMENTAL_TIMESTAMP) {
            requireColumn(schema, INCREMENTAL_COLUMN, incrementalColumn);
        }
        if (loadPattern == LoadPattern.SCD_TYPE2) {
            requireColumns(schema, HASH_COLUMNS, hashColumns);
        }
        if (loadPattern == LoadPattern.CDC_MERGE) {
            requireColumn(schema, OPERATION_COLUMN, operationColumn);
            if (!isBlank(sequenceColumn)) {
                requireColumn(schema, SEQUENCE_COLUMN, sequenceColumn);
            }
        }
        // soft_delete_column and updated_at_column live only on the target table
    }

    private void requirePresent(String field) {
        boolean missing = switch (field) {
            case PRIMARY_KEYS -> isEmpty(primaryKeys);
            case HASH_COLUMNS -> isEmpty(hashColumns);
            case INCREMENTAL_COLUMN -> isBlank(incrementalColumn);
            case EFFECTIVE_DATE_COLUMN -> isBlank(effectiveDateColumn);
            case EXPIRATION_DATE_COLUMN -> isBlank(expirationDateColumn);
            case IS_CURRENT_COLUMN -> isBlank(isCurrentColumn);
            case OPERATION_COLUMN -> isBlank(operationColumn);
            default -> throw new IllegalStateException("Unknown required field: " + field);
        };
        if (missing) {
            String message = PRIMARY_KEYS.equals(field)
                    ? "primary_keys cannot be empty for " + loadPattern.token()
                    : field + " required for " + loadPattern.token();
            throw new ConfigurationException(field, message);
        }
    }

    private static void requireColumns(CanonicalSchema schema, String field, List<String> columns) {
        if (columns == null) {
            return;
        }
        for (String column : columns) {
            requireColumn(schema, field, column);
        }
    }

    private static void requireColumn(CanonicalSchema schema, String field, String column) {
        if (!schema.hasColumn(column)) {
            throw new ConfigurationException(field, "column '" + column + "' not found in schema '"
                    + schema.getTableName() + "'");
        }
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
