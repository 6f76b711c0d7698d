package org.schemaforge.render.snowflake;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.AbstractRenderer;
import org.schemaforge.render.DataFormat;
import org.schemaforge.render.ShellCommands;

/**
 * Snowflake DDL and {@code snowsql} invocations. Local files are staged to the table stage with
 * PUT before COPY INTO; bucket URIs and named stages are copied from directly.
 */
public class SnowflakeRenderer extends AbstractRenderer {

    public SnowflakeRenderer(CanonicalSchema schema) {
        super(schema, new SnowflakeDialect());
    }

    @Override
    public String toCliCreate() {
        return "snowsql -q " + ShellCommands.doubleQuoted(toDdl().strip());
    }

    @Override
    public String toCliLoad(String dataReference) {
        requireValid();
        String table = tableReference();
        String fileFormat = copyOptions(DataFormat.fromReference(dataReference));
        String sql;
        if (dataReference.startsWith("@")) {
            sql = "COPY INTO " + table + " FROM " + dataReference + " " + fileFormat + ";";
        } else if (dataReference.contains("://")) {
            sql = "COPY INTO " + table + " FROM '" + dataReference + "' " + fileFormat + ";";
        } else {
            String tableStage = "@%" + schema.getTableName();
            sql = "PUT file://" + dataReference + " " + tableStage + "; "
                    + "COPY INTO " + table + " FROM " + tableStage + " " + fileFormat + ";";
        }
        return "snowsql -q " + ShellCommands.doubleQuoted(sql);
    }

    private static String copyOptions(DataFormat format) {
        if (format == DataFormat.CSV) {
            return "FILE_FORMAT = (TYPE = CSV SKIP_HEADER = 1 FIELD_OPTIONALLY_ENCLOSED_BY = '\"')";
        }
        return "FILE_FORMAT = (TYPE = " + format.name() + ") MATCH_BY_COLUMN_NAME = CASE_INSENSITIVE";
    }
}
