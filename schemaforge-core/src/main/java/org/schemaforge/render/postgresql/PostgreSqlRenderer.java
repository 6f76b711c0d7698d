package org.schemaforge.render.postgresql;

import org.schemaforge.error.UnsupportedCapabilityException;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.AbstractRenderer;
import org.schemaforge.render.DataFormat;
import org.schemaforge.render.Platform;
import org.schemaforge.render.ShellCommands;

import java.util.Locale;

/**
 * PostgreSQL DDL and {@code psql} invocations; loads go through client-side {@code \copy}.
 */
public class PostgreSqlRenderer extends AbstractRenderer {

    static final String PSQL = "psql -d \"$PGDATABASE\"";

    public PostgreSqlRenderer(CanonicalSchema schema) {
        super(schema, new PostgreSqlDialect());
    }

    @Override
    public String toCliCreate() {
        return ShellCommands.heredoc(PSQL, toDdl(), false);
    }

    @Override
    public String toCliLoad(String dataReference) {
        requireValid();
        if (DataFormat.fromReference(dataReference) != DataFormat.CSV) {
            throw new UnsupportedCapabilityException(Platform.POSTGRESQL, "bulk loading "
                    + DataFormat.fromReference(dataReference).name().toLowerCase(Locale.ROOT) + " files", dataReference);
        }
        String copy = "\\copy " + tableReference() + " FROM " + dialect.stringLiteral(dataReference)
                + " WITH (FORMAT csv, HEADER true, DELIMITER ',', NULL '', ENCODING 'UTF8')";
        return ShellCommands.heredoc(PSQL, copy, false);
    }
}
