package org.schemaforge.render;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.error.ValidationException;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.OptimizationHints;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared validation and DDL assembly. Subclasses add platform checks and client-tool templates.
 */
@Slf4j
public abstract class AbstractRenderer implements Renderer {

    protected final CanonicalSchema schema;
    protected final DdlDialect dialect;

    protected AbstractRenderer(CanonicalSchema schema, DdlDialect dialect) {
        this.schema = schema;
        this.dialect = dialect;

        List<String> problems = new ArrayList<>(schema.validate());
        if (dialect.capabilities().requiresDataset()
                && (schema.getDatasetName() == null || schema.getDatasetName().isBlank())) {
            problems.add("dataset_name is required for " + platform().token());
        }
        if (!problems.isEmpty()) {
            throw new ValidationException("table '" + schema.getTableName() + "' on " + platform().token(), problems);
        }
    }

    @Override
    public Platform platform() {
        return dialect.platform();
    }

    @Override
    public CanonicalSchema schema() {
        return schema;
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        DialectCapabilities caps = dialect.capabilities();
        OptimizationHints hints = schema.getOptimization();
        String name = platform().displayName();

        if (!hints.getPartitionColumns().isEmpty() && !caps.partitioning()) {
            errors.add(name + " does not support partitioning (partition_columns: " + hints.getPartitionColumns() + ")");
        }
        if (!caps.partitionOptions()) {
            if (hints.getPartitionExpirationDays() != null) {
                errors.add(name + " does not support partition_expiration_days");
            }
            if (hints.isRequirePartitionFilter()) {
                errors.add(name + " does not support require_partition_filter");
            }
        } else if (hints.getPartitionColumns().isEmpty()
                && (hints.getPartitionExpirationDays() != null || hints.isRequirePartitionFilter())) {
            errors.add("partition_expiration_days and require_partition_filter need a partition column");
        }

        int clusterCount = hints.getClusterColumns().size();
        if (clusterCount > 0 && !caps.clustering()) {
            errors.add(name + " does not support clustering (cluster_columns: " + hints.getClusterColumns() + ")"
                    + (caps.sortKeys() ? "; use sort_columns instead" : ""));
        } else if (clusterCount > caps.maxClusterColumns()) {
            errors.add(name + " supports max " + caps.maxClusterColumns() + " cluster columns, got " + clusterCount);
        }
        if (!hints.getSortColumns().isEmpty() && !caps.sortKeys()) {
            errors.add(name + " does not support sort keys (sort_columns: " + hints.getSortColumns() + ")");
        }
        if (hints.getDistributionColumn() != null && !caps.distributionKey()) {
            errors.add(name + " does not support distribution keys (distribution_column: "
                    + hints.getDistributionColumn() + ")");
        }

        int maxIdentifier = dialect.identifierPolicy().maxLength();
        if (schema.getTableName().length() > maxIdentifier) {
            errors.add(name + " identifiers are limited to " + maxIdentifier + " characters, table name '"
                    + schema.getTableName() + "' has " + schema.getTableName().length());
        }
        for (ColumnDefinition column : schema.getColumns()) {
            if (column.getName().length() > maxIdentifier) {
                errors.add(name + " identifiers are limited to " + maxIdentifier + " characters, column '"
                        + column.getName() + "' has " + column.getName().length());
            }
            if (!dialect.typeMapper().supports(column.getLogicalType())) {
                errors.add(name + " has no physical type for " + column.getLogicalType().token()
                        + " (column '" + column.getName() + "')");
            }
        }

        validatePlatform(errors);
        return errors;
    }

    /**
     * Platform-specific checks beyond the capability table.
     */
    protected void validatePlatform(List<String> errors) {
    }

    @Override
    public Map<String, String> toPhysicalTypes() {
        Map<String, String> types = new LinkedHashMap<>();
        for (ColumnDefinition column : schema.getColumns()) {
            types.put(column.getName(), dialect.physicalType(column));
        }
        return types;
    }

    @Override
    public String toDdl(TableKind kind) {
        requireValid();
        String ddl = new CreateTableBuilder(tableReference(), kind, dialect)
                .defaultsFrom(schema)
                .build();
        log.debug("Rendered {} DDL for {} ({} columns)", platform().token(), tableReference(), schema.getColumns().size());
        return ddl;
    }

    @Override
    public boolean supportsSchemaDocument() {
        return dialect.capabilities().schemaDocument();
    }

    @Override
    public String toSchemaDocument() {
        dialect.capabilities().requireSchemaDocument();
        requireValid();
        return renderSchemaDocument();
    }

    /**
     * Called only on platforms whose capability table lists a schema document, after validation.
     */
    protected String renderSchemaDocument() {
        throw new IllegalStateException(platform().displayName() + " renderer has no schema document writer");
    }

    public String tableReference() {
        return dialect.tableReference(schema);
    }

    protected void requireValid() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            throw new ValidationException("table '" + schema.getTableName() + "' on " + platform().token(), problems);
        }
    }
}
