package org.schemaforge.render.sqlserver;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.LogicalType;
import org.schemaforge.render.AbstractDialect;
import org.schemaforge.render.IdentifierPolicy;
import org.schemaforge.render.LogicalTypeMapper;
import org.schemaforge.render.Platform;
import org.schemaforge.render.SqlType;

import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * T-SQL. There is no native JSON column type: JSON columns are rejected rather than stored as text.
 */
public class SqlServerDialect extends AbstractDialect {

    @Override
    public Platform platform() {
        return Platform.SQLSERVER;
    }

    @Override
    protected LogicalTypeMapper initializeTypeMapper() {
        return new LogicalTypeMapper(Platform.SQLSERVER, Map.ofEntries(
                entry(LogicalType.INTEGER, SqlType.fixed("INT")),
                entry(LogicalType.BIGINT, SqlType.fixed("BIGINT")),
                entry(LogicalType.FLOAT, SqlType.fixed("FLOAT")),
                entry(LogicalType.DECIMAL, SqlType.decimal("DECIMAL(%d,%d)", "DECIMAL(18,0)")),
                entry(LogicalType.STRING, SqlType.length("NVARCHAR(%d)", "NVARCHAR(MAX)", 255, 4000)),
                entry(LogicalType.TEXT, SqlType.fixed("NVARCHAR(MAX)")),
                entry(LogicalType.BOOLEAN, SqlType.fixed("BIT")),
                entry(LogicalType.DATE, SqlType.fixed("DATE")),
                entry(LogicalType.TIMESTAMP, SqlType.fixed("DATETIME2")),
                entry(LogicalType.TIMESTAMPTZ, SqlType.fixed("DATETIMEOFFSET")),
                entry(LogicalType.BINARY, SqlType.fixed("VARBINARY(MAX)"))
        ));
    }

    @Override
    protected IdentifierPolicy initializeIdentifierPolicy() {
        return new SqlServerIdentifierPolicy();
    }

    @Override
    public List<String> postCreateStatements(CanonicalSchema schema, String tableReference) {
        List<String> cluster = schema.getOptimization().getClusterColumns();
        if (cluster.isEmpty()) {
            return List.of();
        }
        return List.of("CREATE CLUSTERED INDEX " + quoteIdentifier("cix_" + schema.getTableName())
                + " ON " + tableReference + " (" + columnList(cluster) + ")");
    }

    @Override
    public String stringLiteral(String value) {
        return "N'" + value.replace("'", "''") + "'";
    }
}
