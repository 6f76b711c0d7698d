package org.schemaforge.keys;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.inference.TypeInferencer;
import org.schemaforge.model.KeyCandidate;
import org.schemaforge.model.LogicalType;
import org.schemaforge.sample.ColumnSample;
import org.schemaforge.sample.TabularSample;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Proposes merge keys from sampled data.
 * <p>
 * Every column, then every combination of up to {@code maxCompositeColumns} columns, is scored:
 * <pre>
 * 0.5 * uniqueness + 0.3 * completeness + 0.1 * name bonus + 0.1 * type bonus - 0.1 * (columns - 1)
 * </pre>
 * clamped to [0, 1]. The name bonus is the share of columns whose name contains {@code id},
 * {@code key} or {@code pk}; the type bonus the share inferred as integer or string. Candidates
 * below the uniqueness or confidence threshold are dropped, as are combinations containing a column
 * that is already a key on its own.
 */
@Slf4j
public class PrimaryKeyDetector {

    private static final Pattern KEY_NAME = Pattern.compile("id|key|pk", Pattern.CASE_INSENSITIVE);
    private static final int DUPLICATE_EXAMPLES = 5;

    private final KeyDetectorOptions options;
    private final TypeInferencer typeInferencer;

    public PrimaryKeyDetector() {
        this(KeyDetectorOptions.defaults());
    }

    public PrimaryKeyDetector(KeyDetectorOptions options) {
        this(options, new TypeInferencer());
    }

    public PrimaryKeyDetector(KeyDetectorOptions options, TypeInferencer typeInferencer) {
        this.options = options;
        this.typeInferencer = typeInferencer;
    }

    /**
     * @return accepted candidates, best first; empty for an empty sample
     */
    public List<KeyCandidate> detectKeys(TabularSample sample) {
        if (sample.columns().isEmpty() || sample.rowCount() == 0) {
            return List.of();
        }
        List<String> names = sample.columnNames();
        List<KeyCandidate> candidates = new ArrayList<>();
        Set<String> singleKeys = new HashSet<>();

        for (String name : names) {
            evaluate(sample, List.of(name)).ifPresent(candidate -> {
                candidates.add(candidate);
                singleKeys.add(name);
            });
        }
        for (int width = 2; width <= options.getMaxCompositeColumns(); width++) {
            for (List<String> combination : combinations(names, width)) {
                if (combination.stream().anyMatch(singleKeys::contains)) {
                    continue;
                }
                evaluate(sample, combination).ifPresent(candidates::add);
            }
        }

        candidates.sort(Comparator.comparingDouble(KeyCandidate::getConfidence).reversed()
                .thenComparingInt(c -> c.getColumns().size())
                .thenComparing(c -> c.getColumns().stream().map(sample::columnIndex).toList(), PrimaryKeyDetector::compareIndexes));
        log.debug("Key candidates: {}", candidates);
        return candidates;
    }

    public Optional<KeyCandidate> autoDetectBestKey(TabularSample sample) {
        return detectKeys(sample).stream().findFirst();
    }

    /**
     * Column lists of the best {@code max} candidates.
     */
    public List<List<String>> suggestKeys(TabularSample sample, int max) {
        return detectKeys(sample).stream().limit(max).map(KeyCandidate::getColumns).toList();
    }

    /**
     * @throws IllegalArgumentException if a column is not in the sample
     */
    public KeyAnalysis analyzeKeyColumns(TabularSample sample, List<String> columns) {
        List<ColumnSample> keyColumns = columns.stream().map(sample::requireColumn).toList();
        Map<List<String>, Integer> occurrences = tupleCounts(sample, keyColumns, true);

        Map<String, Long> nullCounts = new LinkedHashMap<>();
        for (ColumnSample column : keyColumns) {
            nullCounts.put(column.name(), column.values().stream().filter(typeInferencer::isNull).count());
        }
        List<List<String>> duplicates = occurrences.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .limit(DUPLICATE_EXAMPLES)
                .toList();

        int total = sample.rowCount();
        return KeyAnalysis.builder()
                .columns(List.copyOf(columns))
                .totalRows(total)
                .uniqueCombinations(occurrences.size())
                .uniquenessPct(total == 0 ? 0.0 : 100.0 * occurrences.size() / total)
                .unique(occurrences.size() == total)
                .hasNulls(nullCounts.values().stream().anyMatch(n -> n > 0))
                .nullCounts(nullCounts)
                .duplicateExamples(duplicates)
                .build();
    }

    /**
     * Checks a user-chosen key against the sample.
     *
     * @return problems found; empty when the key holds
     */
    public List<String> validateKeys(TabularSample sample, List<String> columns, boolean allowNulls,
                                     boolean allowDuplicates) {
        List<String> problems = new ArrayList<>();
        if (columns == null || columns.isEmpty()) {
            problems.add("At least one key column is required");
            return problems;
        }
        for (String column : columns) {
            if (sample.column(column).isEmpty()) {
                problems.add("Key column '" + column + "' not found in sample");
            }
        }
        if (!problems.isEmpty()) {
            return problems;
        }

        KeyAnalysis analysis = analyzeKeyColumns(sample, columns);
        if (!allowNulls) {
            analysis.getNullCounts().forEach((column, nulls) -> {
                if (nulls > 0) {
                    problems.add("Key column '" + column + "' has " + nulls + " null value(s)");
                }
            });
        }
        if (!allowDuplicates && !analysis.isUnique()) {
            int duplicates = analysis.getTotalRows() - analysis.getUniqueCombinations();
            problems.add("Found " + duplicates + " duplicate key value(s) for " + String.join(", ", columns)
                    + ", e.g. " + analysis.getDuplicateExamples());
        }
        return problems;
    }

    private Optional<KeyCandidate> evaluate(TabularSample sample, List<String> columns) {
        List<ColumnSample> keyColumns = columns.stream().map(sample::requireColumn).toList();
        int rows = sample.rowCount();
        Map<List<String>, Integer> complete = tupleCounts(sample, keyColumns, false);
        long completeRows = complete.values().stream().mapToLong(Integer::longValue).sum();

        double uniqueness = (double) complete.size() / rows;
        double completeness = (double) completeRows / rows;
        if (uniqueness < options.getMinUniqueness()) {
            return Optional.empty();
        }

        long nameMatches = columns.stream().filter(c -> KEY_NAME.matcher(c).find()).count();
        long typeMatches = keyColumns.stream().filter(this::hasKeyType).count();
        double confidence = 0.5 * uniqueness
                + 0.3 * completeness
                + 0.1 * nameMatches / columns.size()
                + 0.1 * typeMatches / columns.size()
                - 0.1 * (columns.size() - 1);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        if (confidence < options.getMinConfidence()) {
            return Optional.empty();
        }

        return Optional.of(KeyCandidate.builder()
                .columns(List.copyOf(columns))
                .confidence(confidence)
                .uniqueness(uniqueness)
                .completeness(completeness)
                .cardinality(complete.size())
                .reasoning(reasoning(uniqueness, completeness, nameMatches > 0, typeMatches == columns.size()))
                .build());
    }

    /**
     * Occurrences per key tuple in row order. Rows with a null key part are skipped unless {@code includeNulls}.
     */
    private Map<List<String>, Integer> tupleCounts(TabularSample sample, List<ColumnSample> keyColumns,
                                                   boolean includeNulls) {
        Map<List<String>, Integer> counts = new LinkedHashMap<>();
        for (int row = 0; row < sample.rowCount(); row++) {
            String[] tuple = new String[keyColumns.size()];
            boolean hasNull = false;
            for (int i = 0; i < tuple.length; i++) {
                String value = keyColumns.get(i).values().get(row);
                if (typeInferencer.isNull(value)) {
                    hasNull = true;
                    value = null;
                }
                tuple[i] = value;
            }
            if (hasNull && !includeNulls) {
                continue;
            }
            counts.merge(Arrays.asList(tuple), 1, Integer::sum);
        }
        return counts;
    }

    private boolean hasKeyType(ColumnSample column) {
        LogicalType type = typeInferencer.inferColumn(column).logicalType();
        return type.isIntegral() || type == LogicalType.STRING;
    }

    private static String reasoning(double uniqueness, double completeness, boolean keyName, boolean keyType) {
        List<String> parts = new ArrayList<>();
        parts.add(String.format(Locale.ROOT, "%.1f%% unique", uniqueness * 100));
        parts.add(String.format(Locale.ROOT, "%.1f%% complete", completeness * 100));
        if (keyName) {
            parts.add("key-like name");
        }
        if (keyType) {
            parts.add("integer or string type");
        }
        return String.join("; ", parts);
    }

    private static List<List<String>> combinations(List<String> names, int width) {
        List<List<String>> result = new ArrayList<>();
        collect(names, width, 0, new ArrayList<>(), result);
        return result;
    }

    private static void collect(List<String> names, int width, int start, List<String> current,
                                List<List<String>> result) {
        if (current.size() == width) {
            result.add(List.copyOf(current));
            return;
        }
        for (int i = start; i < names.size(); i++) {
            current.add(names.get(i));
            collect(names, width, i + 1, current, result);
            current.remove(current.size() - 1);
        }
    }

    private static int compareIndexes(List<Integer> left, List<Integer> right) {
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            int cmp = Integer.compare(left.get(i), right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}
