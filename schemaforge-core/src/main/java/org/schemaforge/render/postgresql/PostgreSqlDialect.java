package org.schemaforge.render.postgresql;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;
import org.schemaforge.render.AbstractDialect;
import org.schemaforge.render.IdentifierPolicy;
import org.schemaforge.render.LogicalTypeMapper;
import org.schemaforge.render.Platform;
import org.schemaforge.render.SqlType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

public class PostgreSqlDialect extends AbstractDialect {

    @Override
    public Platform platform() {
        return Platform.POSTGRESQL;
    }

    @Override
    protected LogicalTypeMapper initializeTypeMapper() {
        return new LogicalTypeMapper(Platform.POSTGRESQL, Map.ofEntries(
                entry(LogicalType.INTEGER, SqlType.fixed("INTEGER")),
                entry(LogicalType.BIGINT, SqlType.fixed("BIGINT")),
                entry(LogicalType.FLOAT, SqlType.fixed("DOUBLE PRECISION")),
                entry(LogicalType.DECIMAL, SqlType.decimal("NUMERIC(%d,%d)", "NUMERIC")),
                entry(LogicalType.STRING, SqlType.length("VARCHAR(%d)", "VARCHAR", 255, 10_485_760)),
                entry(LogicalType.TEXT, SqlType.fixed("TEXT")),
                entry(LogicalType.BOOLEAN, SqlType.fixed("BOOLEAN")),
                entry(LogicalType.DATE, SqlType.fixed("DATE")),
                entry(LogicalType.TIMESTAMP, SqlType.fixed("TIMESTAMP")),
                entry(LogicalType.TIMESTAMPTZ, SqlType.fixed("TIMESTAMPTZ")),
                entry(LogicalType.JSON, SqlType.fixed("JSONB")),
                entry(LogicalType.BINARY, SqlType.fixed("BYTEA"))
        ));
    }

    @Override
    protected IdentifierPolicy initializeIdentifierPolicy() {
        return new PostgreSqlIdentifierPolicy();
    }

    /**
     * PostgreSQL has no three-part names, so the project qualifier is not rendered.
     */
    @Override
    public String tableReference(String projectId, String datasetName, String tableName) {
        return super.tableReference(null, datasetName, tableName);
    }

    @Override
    public Optional<String> partitionClause(CanonicalSchema schema) {
        List<String> partitions = schema.getOptimization().getPartitionColumns();
        if (partitions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("PARTITION BY RANGE (" + columnList(partitions) + ")");
    }

    @Override
    public List<String> postCreateStatements(CanonicalSchema schema, String tableReference) {
        List<String> statements = new ArrayList<>();
        if (schema.getDescription() != null && !schema.getDescription().isBlank()) {
            statements.add("COMMENT ON TABLE " + tableReference + " IS " + stringLiteral(schema.getDescription()));
        }
        for (ColumnDefinition column : schema.getColumns()) {
            if (column.getDescription() != null && !column.getDescription().isBlank()) {
                statements.add("COMMENT ON COLUMN " + tableReference + "." + quoteIdentifier(column.getName())
                        + " IS " + stringLiteral(column.getDescription()));
            }
        }
        return statements;
    }
}
