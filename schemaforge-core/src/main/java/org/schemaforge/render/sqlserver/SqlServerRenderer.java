package org.schemaforge.render.sqlserver;

import org.schemaforge.error.UnsupportedCapabilityException;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.AbstractRenderer;
import org.schemaforge.render.DataFormat;
import org.schemaforge.render.Platform;
import org.schemaforge.render.ShellCommands;

import java.util.Locale;

/**
 * SQL Server DDL, {@code sqlcmd} for statements and {@code bcp} for CSV loads.
 */
public class SqlServerRenderer extends AbstractRenderer {

    static final String CONNECTION = "-S \"$MSSQL_SERVER\" -d \"$MSSQL_DATABASE\"";

    public SqlServerRenderer(CanonicalSchema schema) {
        super(schema, new SqlServerDialect());
    }

    @Override
    public String toCliCreate() {
        return "sqlcmd " + CONNECTION + " -b -Q " + ShellCommands.doubleQuoted(toDdl().strip());
    }

    @Override
    public String toCliLoad(String dataReference) {
        requireValid();
        DataFormat format = DataFormat.fromReference(dataReference);
        if (format != DataFormat.CSV) {
            throw new UnsupportedCapabilityException(Platform.SQLSERVER, "bulk loading "
                    + format.name().toLowerCase(Locale.ROOT) + " files", dataReference);
        }
        String bcpTable = schema.getDatasetName() == null
                ? schema.getTableName()
                : schema.getDatasetName() + "." + schema.getTableName();
        return "bcp " + bcpTable + " in " + ShellCommands.doubleQuoted(dataReference) + " "
                + CONNECTION + " -T -c -t\",\" -F 2";
    }
}
