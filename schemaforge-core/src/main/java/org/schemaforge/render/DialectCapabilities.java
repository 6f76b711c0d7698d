package org.schemaforge.render;

import org.schemaforge.error.UnsupportedCapabilityException;

/**
 * Static capability table per platform.
 *
 * @param maxClusterColumns 0 when the platform has no clustering at all
 * @param partitionOptions  whether partition expiration and required partition filters exist
 * @param nativeMerge       whether a single atomic upsert statement exists (MERGE or ON CONFLICT)
 * @param schemaDocument    whether a structured schema artifact for bulk loading exists
 * @param requiresDataset   whether tables must be qualified by a dataset
 */
public record DialectCapabilities(Platform platform,
                                  boolean partitioning,
                                  boolean partitionOptions,
                                  int maxClusterColumns,
                                  boolean sortKeys,
                                  boolean distributionKey,
                                  boolean nativeMerge,
                                  boolean schemaDocument,
                                  boolean requiresDataset) {

    public static DialectCapabilities of(Platform platform) {
        return switch (platform) {
            case BIGQUERY -> new DialectCapabilities(platform, true, true, 4, false, false, true, true, true);
            case SNOWFLAKE -> new DialectCapabilities(platform, false, false, 4, false, false, true, false, false);
            case REDSHIFT -> new DialectCapabilities(platform, false, false, 0, true, true, false, false, false);
            case POSTGRESQL -> new DialectCapabilities(platform, true, false, 0, false, false, true, false, false);
            case SQLSERVER -> new DialectCapabilities(platform, false, false, 16, false, false, true, false, false);
        };
    }

    public boolean clustering() {
        return maxClusterColumns > 0;
    }

    public void requireSchemaDocument() {
        if (!schemaDocument) {
            throw new UnsupportedCapabilityException(platform, "structured schema documents", null);
        }
    }
}
