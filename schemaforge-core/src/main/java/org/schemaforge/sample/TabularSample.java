package org.schemaforge.sample;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Column-oriented view of sampled tabular data, in source column order.
 * All columns hold the same number of sampled values.
 */
public final class TabularSample {

    private final Map<String, ColumnSample> columns;
    private final int rowCount;

    private TabularSample(Map<String, ColumnSample> columns) {
        this.columns = columns;
        this.rowCount = columns.values().stream().findFirst().map(ColumnSample::size).orElse(0);
        for (ColumnSample column : columns.values()) {
            if (column.size() != rowCount) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
                        + " sampled values, expected " + rowCount);
            }
        }
    }

    public static TabularSample of(List<ColumnSample> columns) {
        Map<String, ColumnSample> byName = new LinkedHashMap<>();
        for (ColumnSample column : columns) {
            if (byName.putIfAbsent(column.name(), column) != null) {
                throw new IllegalArgumentException("Duplicate column in sample: " + column.name());
            }
        }
        return new TabularSample(byName);
    }

    /**
     * Builds a sample from row-major data, e.g. the records of a parsed file.
     */
    public static TabularSample fromRows(List<String> header, List<List<String>> rows) {
        List<List<String>> values = new ArrayList<>();
        header.forEach(h -> values.add(new ArrayList<>()));
        for (List<String> row : rows) {
            for (int i = 0; i < header.size(); i++) {
                values.get(i).add(i < row.size() ? row.get(i) : null);
            }
        }
        List<ColumnSample> columns = new ArrayList<>();
        for (int i = 0; i < header.size(); i++) {
            columns.add(ColumnSample.of(header.get(i), values.get(i)));
        }
        return of(columns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ColumnSample> columns() {
        return List.copyOf(columns.values());
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public Optional<ColumnSample> column(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    public ColumnSample requireColumn(String name) {
        return column(name).orElseThrow(() -> new IllegalArgumentException("Column '" + name + "' not found in sample"));
    }

    /**
     * Number of sampled rows.
     */
    public int rowCount() {
        return rowCount;
    }

    public int columnIndex(String name) {
        return columnNames().indexOf(name);
    }

    public static final class Builder {
        private final List<ColumnSample> columns = new ArrayList<>();

        public Builder column(String name, String... values) {
            columns.add(ColumnSample.of(name, Arrays.asList(values)));
            return this;
        }

        public Builder column(ColumnSample column) {
            columns.add(column);
            return this;
        }

        public TabularSample build() {
            return TabularSample.of(columns);
        }
    }
}
