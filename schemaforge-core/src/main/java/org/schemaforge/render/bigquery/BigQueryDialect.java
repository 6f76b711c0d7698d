package org.schemaforge.render.bigquery;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;
import org.schemaforge.model.OptimizationHints;
import org.schemaforge.render.AbstractDialect;
import org.schemaforge.render.IdentifierPolicy;
import org.schemaforge.render.LogicalTypeMapper;
import org.schemaforge.render.Platform;
import org.schemaforge.render.SqlType;
import org.schemaforge.render.TableKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Map.entry;

public class BigQueryDialect extends AbstractDialect {

    @Override
    public Platform platform() {
        return Platform.BIGQUERY;
    }

    @Override
    protected LogicalTypeMapper initializeTypeMapper() {
        return new LogicalTypeMapper(Platform.BIGQUERY, Map.ofEntries(
                entry(LogicalType.INTEGER, SqlType.fixed("INT64")),
                entry(LogicalType.BIGINT, SqlType.fixed("INT64")),
                entry(LogicalType.FLOAT, SqlType.fixed("FLOAT64")),
                entry(LogicalType.DECIMAL, SqlType.decimal("NUMERIC(%d, %d)", "NUMERIC")),
                entry(LogicalType.STRING, SqlType.length("STRING(%d)", "STRING", null, null)),
                entry(LogicalType.TEXT, SqlType.fixed("STRING")),
                entry(LogicalType.BOOLEAN, SqlType.fixed("BOOL")),
                entry(LogicalType.DATE, SqlType.fixed("DATE")),
                entry(LogicalType.TIMESTAMP, SqlType.fixed("TIMESTAMP")),
                entry(LogicalType.TIMESTAMPTZ, SqlType.fixed("TIMESTAMP")),
                entry(LogicalType.JSON, SqlType.fixed("JSON")),
                entry(LogicalType.BINARY, SqlType.fixed("BYTES"))
        ));
    }

    @Override
    protected IdentifierPolicy initializeIdentifierPolicy() {
        return new BigQueryIdentifierPolicy();
    }

    @Override
    public String physicalType(ColumnDefinition column) {
        // NUMERIC holds 29 integer and 9 fractional digits; anything wider needs BIGNUMERIC
        if (column.getLogicalType() == LogicalType.DECIMAL && column.getPrecision() != null) {
            int scale = column.getScale() == null ? 0 : column.getScale();
            if (scale > 9 || column.getPrecision() - scale > 29) {
                return String.format("BIGNUMERIC(%d, %d)", column.getPrecision(), scale);
            }
        }
        return super.physicalType(column);
    }

    /**
     * The whole path is quoted as one identifier: {@code `project.dataset.table`}.
     */
    @Override
    public String tableReference(String projectId, String datasetName, String tableName) {
        return "`" + Stream.of(projectId, datasetName, tableName)
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(".")) + "`";
    }

    @Override
    public String columnDefinitionSql(ColumnDefinition column) {
        String definition = super.columnDefinitionSql(column);
        if (column.getDescription() != null && !column.getDescription().isBlank()) {
            definition += " OPTIONS(description=" + doubleQuotedString(column.getDescription()) + ")";
        }
        return definition;
    }

    @Override
    public String openCreateTable(String tableReference, TableKind kind) {
        return (kind == TableKind.STAGING ? "CREATE OR REPLACE TABLE " : "CREATE TABLE ") + tableReference + " (\n";
    }

    @Override
    public Optional<String> partitionClause(CanonicalSchema schema) {
        List<String> partitions = schema.getOptimization().getPartitionColumns();
        if (partitions.isEmpty()) {
            return Optional.empty();
        }
        ColumnDefinition column = schema.getColumn(partitions.get(0)).orElseThrow();
        String name = quoteIdentifier(column.getName());
        if (column.getLogicalType() == LogicalType.DATE) {
            return Optional.of("PARTITION BY " + name);
        }
        return Optional.of("PARTITION BY DATE(" + name + ")");
    }

    @Override
    public List<String> clusteringClauses(CanonicalSchema schema) {
        List<String> cluster = schema.getOptimization().getClusterColumns();
        return cluster.isEmpty() ? List.of() : List.of("CLUSTER BY " + columnList(cluster));
    }

    @Override
    public Optional<String> tableOptionsClause(CanonicalSchema schema) {
        OptimizationHints hints = schema.getOptimization();
        List<String> options = new ArrayList<>();
        if (hints.getPartitionExpirationDays() != null) {
            options.add("partition_expiration_days=" + hints.getPartitionExpirationDays());
        }
        if (hints.isRequirePartitionFilter()) {
            options.add("require_partition_filter=true");
        }
        if (schema.getDescription() != null && !schema.getDescription().isBlank()) {
            options.add("description=" + doubleQuotedString(schema.getDescription()));
        }
        if (options.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("OPTIONS(\n  " + String.join(",\n  ", options) + "\n)");
    }

    @Override
    public String stringLiteral(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private String doubleQuotedString(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
