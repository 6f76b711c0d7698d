package org.schemaforge.render;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.bigquery.BigQueryRenderer;
import org.schemaforge.render.postgresql.PostgreSqlRenderer;
import org.schemaforge.render.redshift.RedshiftRenderer;
import org.schemaforge.render.snowflake.SnowflakeRenderer;
import org.schemaforge.render.sqlserver.SqlServerRenderer;

import java.util.List;

public final class RendererFactory {

    private RendererFactory() {
    }

    public static Renderer getRenderer(String platformName, CanonicalSchema schema) {
        return getRenderer(Platform.fromName(platformName), schema);
    }

    public static Renderer getRenderer(Platform platform, CanonicalSchema schema) {
        return switch (platform) {
            case BIGQUERY -> new BigQueryRenderer(schema);
            case SNOWFLAKE -> new SnowflakeRenderer(schema);
            case REDSHIFT -> new RedshiftRenderer(schema);
            case POSTGRESQL -> new PostgreSqlRenderer(schema);
            case SQLSERVER -> new SqlServerRenderer(schema);
        };
    }

    public static List<Platform> supportedPlatforms() {
        return List.of(Platform.values());
    }
}
