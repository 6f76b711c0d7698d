package org.schemaforge.render.snowflake;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;
import org.schemaforge.render.AbstractDialect;
import org.schemaforge.render.IdentifierPolicy;
import org.schemaforge.render.LogicalTypeMapper;
import org.schemaforge.render.Platform;
import org.schemaforge.render.SqlType;
import org.schemaforge.render.TableKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

public class SnowflakeDialect extends AbstractDialect {

    static final int MAX_VARCHAR = 16_777_216;

    @Override
    public Platform platform() {
        return Platform.SNOWFLAKE;
    }

    @Override
    protected LogicalTypeMapper initializeTypeMapper() {
        return new LogicalTypeMapper(Platform.SNOWFLAKE, Map.ofEntries(
                entry(LogicalType.INTEGER, SqlType.fixed("NUMBER(38,0)")),
                entry(LogicalType.BIGINT, SqlType.fixed("NUMBER(38,0)")),
                entry(LogicalType.FLOAT, SqlType.fixed("FLOAT")),
                entry(LogicalType.DECIMAL, SqlType.decimal("NUMBER(%d,%d)", "NUMBER(38,9)")),
                entry(LogicalType.STRING, SqlType.length("VARCHAR(%d)", "VARCHAR(" + MAX_VARCHAR + ")", MAX_VARCHAR, MAX_VARCHAR)),
                entry(LogicalType.TEXT, SqlType.fixed("VARCHAR(" + MAX_VARCHAR + ")")),
                entry(LogicalType.BOOLEAN, SqlType.fixed("BOOLEAN")),
                entry(LogicalType.DATE, SqlType.fixed("DATE")),
                entry(LogicalType.TIMESTAMP, SqlType.fixed("TIMESTAMP_NTZ")),
                entry(LogicalType.TIMESTAMPTZ, SqlType.fixed("TIMESTAMP_TZ")),
                entry(LogicalType.JSON, SqlType.fixed("VARIANT")),
                entry(LogicalType.BINARY, SqlType.fixed("BINARY"))
        ));
    }

    @Override
    protected IdentifierPolicy initializeIdentifierPolicy() {
        return new SnowflakeIdentifierPolicy();
    }

    @Override
    public String columnDefinitionSql(ColumnDefinition column) {
        String definition = super.columnDefinitionSql(column);
        if (column.getDescription() != null && !column.getDescription().isBlank()) {
            definition += " COMMENT " + stringLiteral(column.getDescription());
        }
        return definition;
    }

    @Override
    public String openCreateTable(String tableReference, TableKind kind) {
        if (kind == TableKind.STAGING) {
            return "CREATE OR REPLACE TRANSIENT TABLE " + tableReference + " (\n";
        }
        return "CREATE TABLE " + tableReference + " (\n";
    }

    @Override
    public List<String> clusteringClauses(CanonicalSchema schema) {
        List<String> cluster = schema.getOptimization().getClusterColumns();
        return cluster.isEmpty() ? List.of() : List.of("CLUSTER BY (" + columnList(cluster) + ")");
    }

    @Override
    public Optional<String> tableOptionsClause(CanonicalSchema schema) {
        if (schema.getDescription() == null || schema.getDescription().isBlank()) {
            return Optional.empty();
        }
        return Optional.of("COMMENT = " + stringLiteral(schema.getDescription()));
    }
}
