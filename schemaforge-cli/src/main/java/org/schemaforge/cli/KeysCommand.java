package org.schemaforge.cli;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.cli.service.CsvSampleReader;
import org.schemaforge.config.ConfigurationLoader;
import org.schemaforge.config.SchemaForgeSettings;
import org.schemaforge.keys.PrimaryKeyDetector;
import org.schemaforge.model.KeyCandidate;
import org.schemaforge.sample.TabularSample;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Detects primary key candidates in a CSV file, or checks a chosen key.
 */
@Slf4j
@CommandLine.Command(
        name = "keys",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "Detects primary key candidates in a CSV file."
)
public class KeysCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", description = "CSV file with a header row")
    private Path csvFile;
    @CommandLine.Option(names = "--max", description = "Maximum number of candidates shown", defaultValue = "5")
    private int max;
    @CommandLine.Option(names = "--validate", split = ",", description = "Check these key columns instead of detecting")
    private List<String> validateColumns;
    @CommandLine.Option(names = "--allow-nulls", description = "Accept null key values when validating")
    private boolean allowNulls;
    @CommandLine.Option(names = "--allow-duplicates", description = "Accept duplicate key values when validating")
    private boolean allowDuplicates;
    @CommandLine.Option(names = "--sample-size", description = "Rows analysed", defaultValue = "10000")
    private int sampleSize = CsvSampleReader.DEFAULT_SAMPLE_LIMIT;
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
            TabularSample sample = new CsvSampleReader(sampleSize, settings.inferenceOptions().build().getNullMarkers())
                    .read(csvFile);
            PrimaryKeyDetector detector = new PrimaryKeyDetector(settings.keyDetectorOptions());

            if (validateColumns != null) {
                return validate(detector, sample);
            }

            List<KeyCandidate> candidates = detector.detectKeys(sample);
            if (candidates.isEmpty()) {
                System.out.println("No key candidates found.");
                return 0;
            }
            int rank = 1;
            for (KeyCandidate candidate : candidates.subList(0, Math.min(max, candidates.size()))) {
                System.out.println(String.format(Locale.ROOT, "%d. %s  confidence=%.2f  (%s)", rank++,
                        String.join(", ", candidate.getColumns()), candidate.getConfidence(), candidate.getReasoning()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Key detection failed: " + e.getMessage());
            log.debug("Key detection failed", e);
            return 1;
        }
    }

    private int validate(PrimaryKeyDetector detector, TabularSample sample) {
        List<String> problems = detector.validateKeys(sample, validateColumns, allowNulls, allowDuplicates);
        if (problems.isEmpty()) {
            System.out.println("Key (" + String.join(", ", validateColumns) + ") is valid.");
            return 0;
        }
        System.err.println("Key (" + String.join(", ", validateColumns) + ") is not valid:");
        problems.forEach(problem -> System.err.println("   - " + problem));
        return 1;
    }
}
