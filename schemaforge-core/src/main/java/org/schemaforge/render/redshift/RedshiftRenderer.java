package org.schemaforge.render.redshift;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.AbstractRenderer;
import org.schemaforge.render.DataFormat;
import org.schemaforge.render.ShellCommands;

/**
 * Redshift DDL and {@code psql} invocations. Connection settings and the IAM role used by COPY
 * come from the {@code REDSHIFT_*} environment variables at run time.
 */
public class RedshiftRenderer extends AbstractRenderer {

    static final String PSQL = "psql -h \"$REDSHIFT_HOST\" -p 5439 -d \"$REDSHIFT_DATABASE\" -U \"$REDSHIFT_USER\"";

    public RedshiftRenderer(CanonicalSchema schema) {
        super(schema, new RedshiftDialect());
    }

    @Override
    public String toCliCreate() {
        return ShellCommands.heredoc(PSQL, toDdl(), false);
    }

    @Override
    public String toCliLoad(String dataReference) {
        requireValid();
        String copy = "COPY " + tableReference() + "\nFROM '" + dataReference + "'\n"
                + "IAM_ROLE '${REDSHIFT_IAM_ROLE}'\n" + formatOptions(DataFormat.fromReference(dataReference)) + ";";
        return ShellCommands.heredoc(PSQL, copy, true);
    }

    private static String formatOptions(DataFormat format) {
        return switch (format) {
            case CSV -> "FORMAT AS CSV\nIGNOREHEADER 1";
            case JSON -> "FORMAT AS JSON 'auto'";
            case PARQUET -> "FORMAT AS PARQUET";
            case AVRO -> "FORMAT AS AVRO 'auto'";
        };
    }
}
