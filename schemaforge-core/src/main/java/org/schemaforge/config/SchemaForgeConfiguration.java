package org.schemaforge.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Shape of {@code schemaforge.yaml}:
 * <pre>
 * profiles:
 *   dev:
 *     inference:
 *       temporalMatchRatio: 0.5
 *     keys:
 *       minUniqueness: 0.99
 *     output:
 *       platform: snowflake
 * </pre>
 */
@Data
public class SchemaForgeConfiguration {

    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    public static class ProfileConfiguration {

        @JsonProperty("inference")
        private InferenceConfiguration inference;

        @JsonProperty("keys")
        private KeysConfiguration keys;

        @JsonProperty("output")
        private OutputConfiguration output;

        @JsonProperty("incremental")
        private IncrementalConfiguration incremental;
    }

    @Data
    public static class InferenceConfiguration {

        @JsonProperty("temporalMatchRatio")
        private Double temporalMatchRatio;

        @JsonProperty("textLengthThreshold")
        private Integer textLengthThreshold;

        @JsonProperty("standardizeNames")
        private Boolean standardizeNames;
    }

    @Data
    public static class KeysConfiguration {

        @JsonProperty("minUniqueness")
        private Double minUniqueness;

        @JsonProperty("maxCompositeColumns")
        private Integer maxCompositeColumns;

        @JsonProperty("minConfidence")
        private Double minConfidence;
    }

    @Data
    public static class OutputConfiguration {

        @JsonProperty("platform")
        private String platform;
    }

    @Data
    public static class IncrementalConfiguration {

        @JsonProperty("farFutureDate")
        private String farFutureDate;

        @JsonProperty("stagingSuffix")
        private String stagingSuffix;
    }
}
