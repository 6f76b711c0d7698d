package org.schemaforge.render.redshift;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;
import org.schemaforge.model.OptimizationHints;
import org.schemaforge.render.AbstractDialect;
import org.schemaforge.render.IdentifierPolicy;
import org.schemaforge.render.LogicalTypeMapper;
import org.schemaforge.render.Platform;
import org.schemaforge.render.SqlType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

public class RedshiftDialect extends AbstractDialect {

    static final int MAX_VARCHAR = 65_535;

    @Override
    public Platform platform() {
        return Platform.REDSHIFT;
    }

    @Override
    protected LogicalTypeMapper initializeTypeMapper() {
        return new LogicalTypeMapper(Platform.REDSHIFT, Map.ofEntries(
                entry(LogicalType.INTEGER, SqlType.fixed("INTEGER")),
                entry(LogicalType.BIGINT, SqlType.fixed("BIGINT")),
                entry(LogicalType.FLOAT, SqlType.fixed("DOUBLE PRECISION")),
                entry(LogicalType.DECIMAL, SqlType.decimal("DECIMAL(%d,%d)", "DECIMAL(18,0)")),
                entry(LogicalType.STRING, SqlType.length("VARCHAR(%d)", "VARCHAR(" + MAX_VARCHAR + ")", 256, MAX_VARCHAR)),
                entry(LogicalType.TEXT, SqlType.fixed("VARCHAR(" + MAX_VARCHAR + ")")),
                entry(LogicalType.BOOLEAN, SqlType.fixed("BOOLEAN")),
                entry(LogicalType.DATE, SqlType.fixed("DATE")),
                entry(LogicalType.TIMESTAMP, SqlType.fixed("TIMESTAMP")),
                entry(LogicalType.TIMESTAMPTZ, SqlType.fixed("TIMESTAMPTZ")),
                entry(LogicalType.JSON, SqlType.fixed("SUPER")),
                entry(LogicalType.BINARY, SqlType.fixed("VARBYTE"))
        ));
    }

    @Override
    protected IdentifierPolicy initializeIdentifierPolicy() {
        return new RedshiftIdentifierPolicy();
    }

    @Override
    public List<String> clusteringClauses(CanonicalSchema schema) {
        OptimizationHints hints = schema.getOptimization();
        List<String> clauses = new ArrayList<>();
        if (hints.getDistributionColumn() != null) {
            clauses.add("DISTSTYLE KEY");
            clauses.add("DISTKEY (" + quoteIdentifier(hints.getDistributionColumn()) + ")");
        }
        if (!hints.getSortColumns().isEmpty()) {
            clauses.add("SORTKEY (" + columnList(hints.getSortColumns()) + ")");
        }
        return clauses;
    }

    /**
     * Tables are addressed as {@code schema.table}; the project qualifier is not rendered.
     */
    @Override
    public String tableReference(String projectId, String datasetName, String tableName) {
        return super.tableReference(null, datasetName, tableName);
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
