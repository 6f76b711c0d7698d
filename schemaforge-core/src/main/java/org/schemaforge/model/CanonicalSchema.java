package org.schemaforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Platform-neutral description of one table: identity, ordered columns and layout hints.
 * <p>
 * Instances are immutable. A changed schema is produced through {@link #toBuilder()}.
 * Column order is the physical column order every renderer emits.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CanonicalSchema {

    @JsonProperty("table_name")
    String tableName;

    @JsonProperty("dataset_name")
    String datasetName;

    @JsonProperty("project_id")
    String projectId;

    @JsonProperty("columns")
    List<ColumnDefinition> columns;

    @JsonProperty("optimization")
    OptimizationHints optimization;

    @JsonProperty("description")
    String description;

    @JsonCreator
    public CanonicalSchema(@JsonProperty("table_name") String tableName,
                           @JsonProperty("dataset_name") String datasetName,
                           @JsonProperty("project_id") String projectId,
                           @JsonProperty("columns") List<ColumnDefinition> columns,
                           @JsonProperty("optimization") OptimizationHints optimization,
                           @JsonProperty("description") String description) {
        this.tableName = tableName;
        this.datasetName = datasetName;
        this.projectId = projectId;
        this.columns = columns == null ? List.of() : List.copyOf(columns);
        this.optimization = optimization == null ? OptimizationHints.none() : optimization;
        this.description = description;
    }

    public Optional<ColumnDefinition> getColumn(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    public boolean hasColumn(String name) {
        return getColumn(name).isPresent();
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDefinition::getName).toList();
    }

    /**
     * Joins the non-empty qualifiers and the table name, e.g. {@code project.dataset.table}.
     */
    public String qualifiedName(String separator) {
        return Stream.of(projectId, datasetName, tableName)
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(separator));
    }

    /**
     * Structural checks that hold regardless of the target platform.
     *
     * @return one message per problem, empty when the schema is well formed
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (tableName == null || tableName.isBlank()) {
            errors.add("table_name is required");
        }
        if (columns.isEmpty()) {
            errors.add("schema must contain at least one column");
        }

        Set<String> seen = new HashSet<>();
        for (ColumnDefinition column : columns) {
            String name = column.getName();
            if (name == null || name.isBlank()) {
                errors.add("column name is required");
                continue;
            }
            if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                errors.add("Duplicate column name: " + name);
            }
            validateColumn(column, errors);
        }

        validateHints(errors);
        return errors;
    }

    private void validateColumn(ColumnDefinition column, List<String> errors) {
        String name = column.getName();
        LogicalType type = column.getLogicalType();
        if (type == null) {
            errors.add("Column '" + name + "' has no logical_type");
            return;
        }
        if ((column.getPrecision() != null || column.getScale() != null) && type != LogicalType.DECIMAL) {
            errors.add("Column '" + name + "': precision/scale only apply to decimal columns");
        }
        if (column.getPrecision() != null && column.getScale() != null
                && column.getScale() > column.getPrecision()) {
            errors.add("Column '" + name + "': scale exceeds precision");
        }
        if (column.getMaxLength() != null) {
            if (type != LogicalType.STRING) {
                errors.add("Column '" + name + "': max_length only applies to string columns");
            } else if (column.getMaxLength() <= 0) {
                errors.add("Column '" + name + "': max_length must be positive");
            }
        }
        if ((column.getDateFormat() != null || column.getTimezone() != null) && !type.isTemporal()) {
            errors.add("Column '" + name + "': date_format/timezone only apply to date and timestamp columns");
        }
    }

    private void validateHints(List<String> errors) {
        OptimizationHints hints = optimization;
        if (hints.getPartitionColumns().size() > 1) {
            errors.add("partition_columns supports a single column, got " + hints.getPartitionColumns());
        }
        if (hints.getPartitionExpirationDays() != null && hints.getPartitionExpirationDays() <= 0) {
            errors.add("partition_expiration_days must be positive");
        }
        for (String name : hints.referencedColumns()) {
            if (!hasColumn(name)) {
                errors.add(hintField(hints, name) + " column '" + name + "' not found in schema");
            }
        }
    }

    /**
     * First hint field mentioning {@code name}; a column named by several hints is reported once.
     */
    private static String hintField(OptimizationHints hints, String name) {
        if (hints.getPartitionColumns().contains(name)) {
            return "partition_columns";
        }
        if (hints.getClusterColumns().contains(name)) {
            return "cluster_columns";
        }
        if (hints.getSortColumns().contains(name)) {
            return "sort_columns";
        }
        return "distribution_column";
    }
}
