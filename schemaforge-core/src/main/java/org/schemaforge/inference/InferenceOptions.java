package org.schemaforge.inference;

import lombok.Builder;
import lombok.Value;
import org.schemaforge.model.OptimizationHints;

import java.util.Set;

@Value
@Builder(toBuilder = true)
public class InferenceOptions {

    public static final double DEFAULT_TEMPORAL_MATCH_RATIO = 0.5;
    public static final int DEFAULT_TEXT_LENGTH_THRESHOLD = 65_535;
    public static final Set<String> DEFAULT_NULL_MARKERS = Set.of("null", "none", "nan", "n/a");

    String datasetName;
    String projectId;
    String description;
    OptimizationHints optimization;
    boolean standardizeNames;
    double temporalMatchRatio;
    int textLengthThreshold;
    Set<String> nullMarkers;

    public static InferenceOptions defaults() {
        return builder().build();
    }

    public static class InferenceOptionsBuilder {
        private OptimizationHints optimization = OptimizationHints.none();
        private boolean standardizeNames = true;
        private double temporalMatchRatio = DEFAULT_TEMPORAL_MATCH_RATIO;
        private int textLengthThreshold = DEFAULT_TEXT_LENGTH_THRESHOLD;
        private Set<String> nullMarkers = DEFAULT_NULL_MARKERS;
    }
}
