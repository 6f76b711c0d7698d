package org.schemaforge.options;

/**
 * Configuration keys shared by the loader, the CLI and library callers.
 */
public final class SchemaForgeOptions {

    private SchemaForgeOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        public static final String DEFAULT = "dev";

        public static final String ENV_VAR = "SCHEMAFORGE_PROFILE";

        public static final String CONFIG_FILE = "schemaforge.yaml";
    }

    public static final class Inference {
        private Inference() {}

        /**
         * Share of values a temporal pattern must match. Default: 0.5
         */
        public static final String TEMPORAL_MATCH_RATIO_KEY = "schemaforge.inference.temporalMatchRatio";
        public static final double TEMPORAL_MATCH_RATIO_DEFAULT = 0.5;

        /**
         * Longest value still typed STRING rather than TEXT. Default: 65535
         */
        public static final String TEXT_LENGTH_THRESHOLD_KEY = "schemaforge.inference.textLengthThreshold";
        public static final int TEXT_LENGTH_THRESHOLD_DEFAULT = 65_535;

        public static final String STANDARDIZE_NAMES_KEY = "schemaforge.inference.standardizeNames";
        public static final boolean STANDARDIZE_NAMES_DEFAULT = true;
    }

    public static final class Keys {
        private Keys() {}

        public static final String MIN_UNIQUENESS_KEY = "schemaforge.keys.minUniqueness";
        public static final double MIN_UNIQUENESS_DEFAULT = 0.995;

        public static final String MAX_COMPOSITE_COLUMNS_KEY = "schemaforge.keys.maxCompositeColumns";
        public static final int MAX_COMPOSITE_COLUMNS_DEFAULT = 2;

        public static final String MIN_CONFIDENCE_KEY = "schemaforge.keys.minConfidence";
        public static final double MIN_CONFIDENCE_DEFAULT = 0.0;
    }

    public static final class Output {
        private Output() {}

        /**
         * Platform used when a command names none. Default: bigquery
         */
        public static final String PLATFORM_KEY = "schemaforge.output.platform";
        public static final String PLATFORM_DEFAULT = "bigquery";
    }

    public static final class Incremental {
        private Incremental() {}

        /**
         * Expiration value of open SCD type 2 rows. Default: 9999-12-31
         */
        public static final String FAR_FUTURE_DATE_KEY = "schemaforge.incremental.farFutureDate";
        public static final String FAR_FUTURE_DATE_DEFAULT = "9999-12-31";

        public static final String STAGING_SUFFIX_KEY = "schemaforge.incremental.stagingSuffix";
        public static final String STAGING_SUFFIX_DEFAULT = "_staging";
    }
}
