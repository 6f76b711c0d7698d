package org.schemaforge.cli;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.SchemaForge;
import org.schemaforge.cli.service.CsvSampleReader;
import org.schemaforge.cli.service.SchemaIoService;
import org.schemaforge.config.ConfigurationLoader;
import org.schemaforge.config.SchemaForgeSettings;
import org.schemaforge.inference.InferenceOptions;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.OptimizationHints;
import org.schemaforge.sample.TabularSample;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Infers a canonical schema document from a CSV sample.
 */
@Slf4j
@CommandLine.Command(
        name = "infer",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "Infers a canonical schema document from a CSV file."
)
public class InferCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", description = "CSV file with a header row")
    private Path csvFile;
    @CommandLine.Option(names = {"-t", "--table"}, required = true, description = "Table name of the inferred schema")
    private String tableName;
    @CommandLine.Option(names = "--dataset", description = "Dataset or schema qualifier")
    private String datasetName;
    @CommandLine.Option(names = "--project", description = "Project qualifier (BigQuery)")
    private String projectId;
    @CommandLine.Option(names = "--description", description = "Table description")
    private String description;
    @CommandLine.Option(names = "--out", description = "Output file (.json, .yaml); stdout when omitted")
    private Path out;
    @CommandLine.Option(names = "--sample-size", description = "Rows kept for type inference", defaultValue = "10000")
    private int sampleSize = CsvSampleReader.DEFAULT_SAMPLE_LIMIT;
    @CommandLine.Option(names = "--no-standardize", description = "Keep column names as found in the header")
    private boolean keepNames;
    @CommandLine.Option(names = "--partition", description = "Partition column")
    private String partitionColumn;
    @CommandLine.Option(names = "--cluster", split = ",", description = "Cluster columns")
    private List<String> clusterColumns;
    @CommandLine.Option(names = "--sort", split = ",", description = "Sort key columns")
    private List<String> sortColumns;
    @CommandLine.Option(names = "--distribution", description = "Distribution key column")
    private String distributionColumn;
    @CommandLine.Option(names = "--profile", description = "Configuration profile (dev, prod, test ...)")
    private String profile;

    @Override
    public Integer call() {
        try {
            if (!Files.exists(csvFile)) {
                System.err.println("CSV file not found: " + csvFile);
                return 1;
            }
            SchemaForgeSettings settings = new ConfigurationLoader().loadSettings(profile);
            InferenceOptions.InferenceOptionsBuilder options = settings.inferenceOptions()
                    .datasetName(datasetName)
                    .projectId(projectId)
                    .description(description)
                    .optimization(hints());
            if (keepNames) {
                options.standardizeNames(false);
            }

            InferenceOptions inference = options.build();
            TabularSample sample = new CsvSampleReader(sampleSize, inference.getNullMarkers()).read(csvFile);
            CanonicalSchema schema = SchemaForge.inferSchema(sample, tableName, inference);
            new SchemaIoService().saveSchema(schema, out);
            if (out != null) {
                System.out.println("Wrote schema for '" + tableName + "' (" + schema.getColumns().size()
                        + " columns) to " + out);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Inference failed: " + e.getMessage());
            log.debug("Inference failed", e);
            return 1;
        }
    }

    private OptimizationHints hints() {
        return OptimizationHints.builder()
                .partitionColumns(partitionColumn == null ? List.of() : List.of(partitionColumn))
                .clusterColumns(clusterColumns == null ? List.of() : clusterColumns)
                .sortColumns(sortColumns == null ? List.of() : sortColumns)
                .distributionColumn(distributionColumn)
                .build();
    }
}
