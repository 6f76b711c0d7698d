package org.schemaforge.incremental;

import org.schemaforge.incremental.bigquery.BigQueryIncrementalGenerator;
import org.schemaforge.incremental.postgresql.PostgreSqlIncrementalGenerator;
import org.schemaforge.incremental.redshift.RedshiftIncrementalGenerator;
import org.schemaforge.incremental.snowflake.SnowflakeIncrementalGenerator;
import org.schemaforge.incremental.sqlserver.SqlServerIncrementalGenerator;
import org.schemaforge.render.Platform;

import java.util.List;

public final class IncrementalGeneratorFactory {

    private IncrementalGeneratorFactory() {
    }

    public static IncrementalGenerator getGenerator(String platformName) {
        return getGenerator(Platform.fromName(platformName));
    }

    public static IncrementalGenerator getGenerator(Platform platform) {
        return switch (platform) {
            case BIGQUERY -> new BigQueryIncrementalGenerator();
            case SNOWFLAKE -> new SnowflakeIncrementalGenerator();
            case REDSHIFT -> new RedshiftIncrementalGenerator();
            case POSTGRESQL -> new PostgreSqlIncrementalGenerator();
            case SQLSERVER -> new SqlServerIncrementalGenerator();
        };
    }

    /**
     * Patterns {@code platform} can generate, in declaration order.
     */
    public static List<LoadPattern> supportedPatterns(Platform platform) {
        IncrementalGenerator generator = getGenerator(platform);
        return List.of(LoadPattern.values()).stream().filter(generator::supports).toList();
    }
}
