package org.schemaforge.inference;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.error.ValidationException;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.OptimizationHints;
import org.schemaforge.sample.ColumnSample;
import org.schemaforge.sample.TabularSample;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link CanonicalSchema} from a tabular sample.
 * <p>
 * Each column goes through {@link TypeInferencer}; names are optionally standardized and the
 * source header is kept as {@code original_name}. Hint columns in the options may be given by
 * either name.
 */
@Slf4j
public class SchemaInferrer {

    private final ColumnNameStandardizer standardizer;

    public SchemaInferrer() {
        this(new ColumnNameStandardizer());
    }

    public SchemaInferrer(ColumnNameStandardizer standardizer) {
        this.standardizer = standardizer;
    }

    public CanonicalSchema inferSchema(TabularSample sample, String tableName, InferenceOptions options) {
        TypeInferencer inferencer = new TypeInferencer(options);
        List<ColumnSample> samples = sample.columns();
        List<String> rawNames = samples.stream().map(ColumnSample::name).toList();
        List<String> names = options.isStandardizeNames() ? standardizer.standardizeAll(rawNames) : rawNames;

        Map<String, String> renamed = new HashMap<>();
        List<ColumnDefinition> columns = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            ColumnSample column = samples.get(i);
            InferredType inferred = inferencer.inferColumn(column);
            renamed.put(column.name(), names.get(i));
            columns.add(ColumnDefinition.builder()
                    .name(names.get(i))
                    .originalName(column.name())
                    .logicalType(inferred.logicalType())
                    .nullable(inferred.nullable())
                    .precision(inferred.precision())
                    .scale(inferred.scale())
                    .dateFormat(inferred.dateFormat())
                    .timezone(inferred.timezone())
                    .build());
        }

        CanonicalSchema schema = CanonicalSchema.builder()
                .tableName(tableName)
                .datasetName(options.getDatasetName())
                .projectId(options.getProjectId())
                .description(options.getDescription())
                .columns(columns)
                .optimization(resolveHints(options.getOptimization(), renamed))
                .build();

        List<String> problems = schema.validate();
        if (!problems.isEmpty()) {
            throw new ValidationException("table '" + tableName + "'", problems);
        }
        log.info("Inferred schema for '{}' with {} columns from {} sampled rows",
                tableName, columns.size(), sample.rowCount());
        return schema;
    }

    private OptimizationHints resolveHints(OptimizationHints hints, Map<String, String> renamed) {
        if (hints == null) {
            return OptimizationHints.none();
        }
        return hints.toBuilder()
                .partitionColumns(rename(hints.getPartitionColumns(), renamed))
                .clusterColumns(rename(hints.getClusterColumns(), renamed))
                .sortColumns(rename(hints.getSortColumns(), renamed))
                .distributionColumn(hints.getDistributionColumn() == null
                        ? null
                        : renamed.getOrDefault(hints.getDistributionColumn(), hints.getDistributionColumn()))
                .build();
    }

    private List<String> rename(List<String> names, Map<String, String> renamed) {
        return names.stream().map(n -> renamed.getOrDefault(n, n)).toList();
    }
}
