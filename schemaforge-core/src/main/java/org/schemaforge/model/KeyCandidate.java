package org.schemaforge.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * A scored proposal of one or more columns usable as a merge key.
 */
@Value
@Builder
public class KeyCandidate {

    List<String> columns;
    double confidence;
    double uniqueness;
    double completeness;
    long cardinality;
    String reasoning;

    public boolean isComposite() {
        return columns.size() > 1;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "KeyCandidate(%s, confidence=%.2f)", String.join("+", columns), confidence);
    }
}
