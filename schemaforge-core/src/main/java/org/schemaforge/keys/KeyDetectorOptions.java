package org.schemaforge.keys;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds of {@link PrimaryKeyDetector}.
 */
@Value
@Builder(toBuilder = true)
public class KeyDetectorOptions {

    public static final double DEFAULT_MIN_UNIQUENESS = 0.995;
    public static final int DEFAULT_MAX_COMPOSITE_COLUMNS = 2;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.0;

    /** Share of sampled rows with a distinct, complete key value a candidate needs. */
    double minUniqueness;
    /** Widest column combination tried. */
    int maxCompositeColumns;
    double minConfidence;

    public static KeyDetectorOptions defaults() {
        return builder().build();
    }

    public static class KeyDetectorOptionsBuilder {
        private double minUniqueness = DEFAULT_MIN_UNIQUENESS;
        private int maxCompositeColumns = DEFAULT_MAX_COMPOSITE_COLUMNS;
        private double minConfidence = DEFAULT_MIN_CONFIDENCE;
    }
}
