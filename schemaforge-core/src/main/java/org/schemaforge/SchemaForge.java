package org.schemaforge;

import org.schemaforge.incremental.IncrementalConfig;
import org.schemaforge.incremental.IncrementalGenerator;
import org.schemaforge.incremental.IncrementalGeneratorFactory;
import org.schemaforge.incremental.IncrementalScript;
import org.schemaforge.incremental.LoadPattern;
import org.schemaforge.inference.InferenceOptions;
import org.schemaforge.inference.SchemaInferrer;
import org.schemaforge.keys.KeyDetectorOptions;
import org.schemaforge.keys.PrimaryKeyDetector;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.KeyCandidate;
import org.schemaforge.render.Platform;
import org.schemaforge.render.Renderer;
import org.schemaforge.render.RendererFactory;
import org.schemaforge.sample.TabularSample;

import java.util.List;

/**
 * Entry points for callers outside the core: inference, DDL rendering, load generation and key detection.
 */
public final class SchemaForge {

    private SchemaForge() {
    }

    public static CanonicalSchema inferSchema(TabularSample sample, String tableName) {
        return inferSchema(sample, tableName, InferenceOptions.defaults());
    }

    public static CanonicalSchema inferSchema(TabularSample sample, String tableName, InferenceOptions options) {
        return new SchemaInferrer().inferSchema(sample, tableName, options);
    }

    /**
     * @throws IllegalArgumentException for an unknown platform name
     * @throws org.schemaforge.error.ValidationException if the schema is structurally invalid for the platform
     */
    public static Renderer getRenderer(String platform, CanonicalSchema schema) {
        return RendererFactory.getRenderer(platform, schema);
    }

    public static Renderer getRenderer(Platform platform, CanonicalSchema schema) {
        return RendererFactory.getRenderer(platform, schema);
    }

    public static IncrementalGenerator getIncrementalGenerator(String platform) {
        return IncrementalGeneratorFactory.getGenerator(platform);
    }

    public static IncrementalGenerator getIncrementalGenerator(Platform platform) {
        return IncrementalGeneratorFactory.getGenerator(platform);
    }

    /**
     * Upsert of {@code tableName} from its staging table on {@code primaryKeys}, overwriting every other column.
     *
     * @throws org.schemaforge.error.UnsupportedCapabilityException on platforms without a native MERGE
     * @throws org.schemaforge.error.ConfigurationException if a key column is missing from the schema
     */
    public static IncrementalScript generateMerge(String platform, CanonicalSchema schema, String tableName,
                                                  List<String> primaryKeys) {
        return generateMerge(Platform.fromName(platform), schema, tableName, primaryKeys);
    }

    public static IncrementalScript generateMerge(Platform platform, CanonicalSchema schema, String tableName,
                                                  List<String> primaryKeys) {
        IncrementalConfig config = IncrementalConfig.builder()
                .loadPattern(LoadPattern.UPSERT)
                .primaryKeys(primaryKeys)
                .build();
        return getIncrementalGenerator(platform).generate(schema, tableName, config);
    }

    public static List<KeyCandidate> detectKeys(TabularSample sample) {
        return detectKeys(sample, KeyDetectorOptions.defaults());
    }

    public static List<KeyCandidate> detectKeys(TabularSample sample, KeyDetectorOptions options) {
        return new PrimaryKeyDetector(options).detectKeys(sample);
    }
}
