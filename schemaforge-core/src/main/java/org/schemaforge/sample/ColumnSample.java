package org.schemaforge.sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Sampled raw values of one column plus counts taken over the full column.
 * <p>
 * {@code totalRows} and {@code nullCount} may exceed what the sample shows when the reader
 * sampled a larger source; they never fall below it.
 *
 * @param name      column name as found in the source
 * @param values    ordered raw values, {@code null} entries allowed
 * @param totalRows rows in the full column
 * @param nullCount null, blank or null-marker entries in the full column
 */
public record ColumnSample(String name, List<String> values, long totalRows, long nullCount) {

    public ColumnSample {
        Objects.requireNonNull(name, "name");
        values = Collections.unmodifiableList(new ArrayList<>(values == null ? List.of() : values));
        if (totalRows < values.size()) {
            throw new IllegalArgumentException("totalRows " + totalRows + " is smaller than sample size " + values.size()
                    + " for column '" + name + "'");
        }
    }

    /**
     * A sample that is the whole column: counts are derived from the values themselves.
     */
    public static ColumnSample of(String name, List<String> values) {
        long nulls = values.stream().filter(ColumnSample::isBlank).count();
        return new ColumnSample(name, values, values.size(), nulls);
    }

    public int size() {
        return values.size();
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
