package org.schemaforge.keys;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Uniqueness and completeness of a chosen key over a sample.
 */
@Value
@Builder
public class KeyAnalysis {

    List<String> columns;
    int totalRows;
    int uniqueCombinations;
    /** uniqueCombinations / totalRows, as a percentage. */
    double uniquenessPct;
    boolean unique;
    boolean hasNulls;
    /** Null count per key column, in key order. */
    Map<String, Long> nullCounts;
    /** Up to five key values occurring more than once. */
    List<List<String>> duplicateExamples;
}
