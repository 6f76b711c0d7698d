package org.schemaforge.render.bigquery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.schemaforge.error.SchemaDocumentException;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;
import org.schemaforge.model.OptimizationHints;
import org.schemaforge.render.AbstractRenderer;
import org.schemaforge.render.DataFormat;
import org.schemaforge.render.ShellCommands;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BigQuery DDL, {@code bq} invocations and the JSON schema file {@code bq load} understands.
 */
public class BigQueryRenderer extends AbstractRenderer {

    private static final long SECONDS_PER_DAY = 86_400L;

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public BigQueryRenderer(CanonicalSchema schema) {
        super(schema, new BigQueryDialect());
    }

    @Override
    protected void validatePlatform(List<String> errors) {
        for (String partition : schema.getOptimization().getPartitionColumns()) {
            schema.getColumn(partition)
                    .filter(c -> !c.getLogicalType().isTemporal())
                    .ifPresent(c -> errors.add("BigQuery partition column '" + c.getName()
                            + "' must be a date or timestamp, got " + c.getLogicalType().token()));
        }
    }

    /**
     * One object per column: {@code name}, {@code type}, {@code mode} and, when present, {@code description}.
     */
    @Override
    protected String renderSchemaDocument() {
        List<Map<String, Object>> fields = new ArrayList<>();
        for (ColumnDefinition column : schema.getColumns()) {
            Map<String, Object> field = new LinkedHashMap<>();
            field.put("name", column.getName());
            field.put("type", baseType(dialect.physicalType(column)));
            field.put("mode", column.isNullable() ? "NULLABLE" : "REQUIRED");
            if (column.getLogicalType() == LogicalType.DECIMAL && column.getPrecision() != null) {
                field.put("precision", column.getPrecision());
                field.put("scale", column.getScale() == null ? 0 : column.getScale());
            }
            if (column.getDescription() != null) {
                field.put("description", column.getDescription());
            }
            fields.add(field);
        }
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new SchemaDocumentException("Failed to render BigQuery schema for " + schema.getTableName(), e);
        }
    }

    @Override
    public String toCliCreate() {
        requireValid();
        OptimizationHints hints = schema.getOptimization();
        StringBuilder cmd = new StringBuilder("bq mk --table")
                .append(" --schema=").append(schemaFileName());
        if (!hints.getPartitionColumns().isEmpty()) {
            cmd.append(" --time_partitioning_field=").append(hints.getPartitionColumns().get(0))
                    .append(" --time_partitioning_type=DAY");
            if (hints.getPartitionExpirationDays() != null) {
                cmd.append(" --time_partitioning_expiration=")
                        .append(hints.getPartitionExpirationDays() * SECONDS_PER_DAY);
            }
            if (hints.isRequirePartitionFilter()) {
                cmd.append(" --require_partition_filter");
            }
        }
        if (!hints.getClusterColumns().isEmpty()) {
            cmd.append(" --clustering_fields=").append(String.join(",", hints.getClusterColumns()));
        }
        if (schema.getDescription() != null && !schema.getDescription().isBlank()) {
            cmd.append(" --description ").append(ShellCommands.doubleQuoted(schema.getDescription()));
        }
        return cmd.append(' ').append(bqTableId()).toString();
    }

    @Override
    public String toCliLoad(String dataReference) {
        requireValid();
        DataFormat format = DataFormat.fromReference(dataReference);
        StringBuilder cmd = new StringBuilder("bq load");
        switch (format) {
            case CSV -> cmd.append(" --source_format=CSV --skip_leading_rows=1 --schema=").append(schemaFileName());
            case JSON -> cmd.append(" --source_format=NEWLINE_DELIMITED_JSON --schema=").append(schemaFileName());
            case PARQUET -> cmd.append(" --source_format=PARQUET");
            case AVRO -> cmd.append(" --source_format=AVRO");
        }
        return cmd.append(' ').append(bqTableId()).append(' ').append(dataReference).toString();
    }

    public String schemaFileName() {
        return schema.getTableName() + "_schema.json";
    }

    // bq addresses tables as project:dataset.table
    private String bqTableId() {
        String datasetTable = schema.getDatasetName() + "." + schema.getTableName();
        return schema.getProjectId() == null || schema.getProjectId().isBlank()
                ? datasetTable
                : schema.getProjectId() + ":" + datasetTable;
    }

    private static String baseType(String physicalType) {
        int paren = physicalType.indexOf('(');
        return paren < 0 ? physicalType : physicalType.substring(0, paren);
    }
}
