package org.schemaforge.cli.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.schemaforge.inference.InferenceOptions;
import org.schemaforge.sample.ColumnSample;
import org.schemaforge.sample.TabularSample;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a headed CSV file into a {@link TabularSample}.
 * <p>
 * Only the first {@code sampleLimit} rows are kept as values, but the whole file is scanned
 * so row and null counts describe the full column. Blank cells and null markers such as
 * {@code NULL} or {@code n/a} count as nulls.
 */
@Slf4j
public class CsvSampleReader {

    public static final int DEFAULT_SAMPLE_LIMIT = 10_000;

    private final CSVFormat format;
    private final int sampleLimit;
    private final Set<String> nullMarkers;

    public CsvSampleReader() {
        this(DEFAULT_SAMPLE_LIMIT);
    }

    public CsvSampleReader(int sampleLimit) {
        this(sampleLimit, InferenceOptions.DEFAULT_NULL_MARKERS);
    }

    public CsvSampleReader(int sampleLimit, Set<String> nullMarkers) {
        if (sampleLimit <= 0) {
            throw new IllegalArgumentException("Sample limit must be positive, got " + sampleLimit);
        }
        // header is read as a plain record so blank header cells reach the name standardizer
        this.format = CSVFormat.DEFAULT.builder().setIgnoreEmptyLines(true).build();
        this.sampleLimit = sampleLimit;
        Set<String> markers = new HashSet<>();
        nullMarkers.forEach(m -> markers.add(m.toLowerCase(Locale.ROOT)));
        this.nullMarkers = Set.copyOf(markers);
    }

    /**
     * @throws IOException if the file cannot be read or has no header row
     */
    public TabularSample read(Path csvFile) throws IOException {
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8);
             CSVParser parser = CSVParser.parse(reader, format)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new IOException("CSV file is empty: " + csvFile);
            }
            List<String> header = records.next().toList();
            List<List<String>> values = new ArrayList<>();
            long[] nullCounts = new long[header.size()];
            header.forEach(h -> values.add(new ArrayList<>()));

            long total = 0;
            while (records.hasNext()) {
                CSVRecord record = records.next();
                for (int i = 0; i < header.size(); i++) {
                    String value = i < record.size() ? record.get(i) : null;
                    if (isNull(value)) {
                        nullCounts[i]++;
                    }
                    if (total < sampleLimit) {
                        values.get(i).add(value);
                    }
                }
                total++;
            }

            List<ColumnSample> columns = new ArrayList<>(header.size());
            for (int i = 0; i < header.size(); i++) {
                columns.add(new ColumnSample(header.get(i), values.get(i), total, nullCounts[i]));
            }
            log.debug("Read {} rows ({} sampled) from {}", total, Math.min(total, sampleLimit), csvFile);
            return TabularSample.of(columns);
        }
    }

    private boolean isNull(String value) {
        return value == null || value.isBlank() || nullMarkers.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
