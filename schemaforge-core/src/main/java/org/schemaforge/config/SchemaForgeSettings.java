package org.schemaforge.config;

import org.schemaforge.error.ConfigurationException;
import org.schemaforge.incremental.IncrementalConfig;
import org.schemaforge.inference.InferenceOptions;
import org.schemaforge.keys.KeyDetectorOptions;
import org.schemaforge.options.SchemaForgeOptions;
import org.schemaforge.render.Platform;

import java.util.Map;

/**
 * Typed view over the option map produced by {@link ConfigurationLoader}.
 */
public class SchemaForgeSettings {

    private final Map<String, String> values;

    public SchemaForgeSettings(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public Map<String, String> asMap() {
        return values;
    }

    public InferenceOptions.InferenceOptionsBuilder inferenceOptions() {
        return InferenceOptions.builder()
                .temporalMatchRatio(doubleValue(SchemaForgeOptions.Inference.TEMPORAL_MATCH_RATIO_KEY,
                        SchemaForgeOptions.Inference.TEMPORAL_MATCH_RATIO_DEFAULT))
                .textLengthThreshold(intValue(SchemaForgeOptions.Inference.TEXT_LENGTH_THRESHOLD_KEY,
                        SchemaForgeOptions.Inference.TEXT_LENGTH_THRESHOLD_DEFAULT))
                .standardizeNames(Boolean.parseBoolean(values.getOrDefault(SchemaForgeOptions.Inference.STANDARDIZE_NAMES_KEY,
                        String.valueOf(SchemaForgeOptions.Inference.STANDARDIZE_NAMES_DEFAULT))));
    }

    public KeyDetectorOptions keyDetectorOptions() {
        return KeyDetectorOptions.builder()
                .minUniqueness(doubleValue(SchemaForgeOptions.Keys.MIN_UNIQUENESS_KEY,
                        SchemaForgeOptions.Keys.MIN_UNIQUENESS_DEFAULT))
                .maxCompositeColumns(intValue(SchemaForgeOptions.Keys.MAX_COMPOSITE_COLUMNS_KEY,
                        SchemaForgeOptions.Keys.MAX_COMPOSITE_COLUMNS_DEFAULT))
                .minConfidence(doubleValue(SchemaForgeOptions.Keys.MIN_CONFIDENCE_KEY,
                        SchemaForgeOptions.Keys.MIN_CONFIDENCE_DEFAULT))
                .build();
    }

    public Platform defaultPlatform() {
        return Platform.fromName(values.getOrDefault(SchemaForgeOptions.Output.PLATFORM_KEY,
                SchemaForgeOptions.Output.PLATFORM_DEFAULT));
    }

    /**
     * Incremental config builder preloaded with the configured sentinel and staging suffix.
     */
    public IncrementalConfig.IncrementalConfigBuilder incrementalConfig() {
        return IncrementalConfig.builder()
                .farFutureDate(values.getOrDefault(SchemaForgeOptions.Incremental.FAR_FUTURE_DATE_KEY,
                        SchemaForgeOptions.Incremental.FAR_FUTURE_DATE_DEFAULT))
                .stagingSuffix(values.getOrDefault(SchemaForgeOptions.Incremental.STAGING_SUFFIX_KEY,
                        SchemaForgeOptions.Incremental.STAGING_SUFFIX_DEFAULT));
    }

    private double doubleValue(String key, double fallback) {
        String raw = values.get(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "expected a number, got '" + raw + "'");
        }
    }

    private int intValue(String key, int fallback) {
        String raw = values.get(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "expected an integer, got '" + raw + "'");
        }
    }
}
