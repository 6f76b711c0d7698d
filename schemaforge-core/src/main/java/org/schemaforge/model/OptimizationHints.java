package org.schemaforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Physical layout intent of a table. Each renderer honours the subset its platform supports
 * and reports the rest from {@code validate()}.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OptimizationHints {

    private static final OptimizationHints NONE = OptimizationHints.builder().build();

    @JsonProperty("partition_columns")
    List<String> partitionColumns;

    @JsonProperty("cluster_columns")
    List<String> clusterColumns;

    @JsonProperty("sort_columns")
    List<String> sortColumns;

    @JsonProperty("distribution_column")
    String distributionColumn;

    @JsonProperty("partition_expiration_days")
    Integer partitionExpirationDays;

    @JsonProperty("require_partition_filter")
    boolean requirePartitionFilter;

    @JsonCreator
    public OptimizationHints(@JsonProperty("partition_columns") List<String> partitionColumns,
                             @JsonProperty("cluster_columns") List<String> clusterColumns,
                             @JsonProperty("sort_columns") List<String> sortColumns,
                             @JsonProperty("distribution_column") String distributionColumn,
                             @JsonProperty("partition_expiration_days") Integer partitionExpirationDays,
                             @JsonProperty("require_partition_filter") boolean requirePartitionFilter) {
        this.partitionColumns = partitionColumns == null ? List.of() : List.copyOf(partitionColumns);
        this.clusterColumns = clusterColumns == null ? List.of() : List.copyOf(clusterColumns);
        this.sortColumns = sortColumns == null ? List.of() : List.copyOf(sortColumns);
        this.distributionColumn = distributionColumn;
        this.partitionExpirationDays = partitionExpirationDays;
        this.requirePartitionFilter = requirePartitionFilter;
    }

    public static OptimizationHints none() {
        return NONE;
    }

    public boolean hasOptimizations() {
        return !partitionColumns.isEmpty()
                || !clusterColumns.isEmpty()
                || !sortColumns.isEmpty()
                || distributionColumn != null;
    }

    /**
     * Every column name mentioned by any hint, in first-mention order.
     */
    public List<String> referencedColumns() {
        Set<String> names = new LinkedHashSet<>();
        names.addAll(partitionColumns);
        names.addAll(clusterColumns);
        names.addAll(sortColumns);
        if (distributionColumn != null) {
            names.add(distributionColumn);
        }
        return new ArrayList<>(names);
    }
}
