package org.schemaforge.incremental.sqlserver;

import org.schemaforge.incremental.AbstractIncrementalGenerator;
import org.schemaforge.incremental.DeleteStrategy;
import org.schemaforge.incremental.LoadContext;
import org.schemaforge.incremental.LoadSteps;
import org.schemaforge.incremental.MergeStrategy;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.sqlserver.SqlServerDialect;

import java.util.List;
import java.util.stream.Collectors;

/**
 * T-SQL: MERGE with {@code WHEN NOT MATCHED BY TARGET}, joined UPDATE/DELETE, BIT literals 1 and 0.
 */
public class SqlServerIncrementalGenerator extends AbstractIncrementalGenerator {

    static final String MAX_VARIABLE = "@max_ts";
    private static final String NULL_SENTINEL = "N'<null>'";

    public SqlServerIncrementalGenerator() {
        super(new SqlServerDialect());
    }

    @Override
    protected void upsert(LoadContext ctx, LoadSteps steps) {
        steps.add(mergeUpsert(ctx, updateColumns(ctx),
                ctx.config().getMergeStrategy() == MergeStrategy.UPDATE_CHANGED));
    }

    @Override
    protected void scdType1(LoadContext ctx, LoadSteps steps) {
        steps.add(mergeUpsert(ctx, nonKeyColumns(ctx), false));
    }

    /**
     * MERGE accepts at most one matched UPDATE clause, so soft deletes run as a separate UPDATE first.
     */
    @Override
    protected void cdcMerge(LoadContext ctx, LoadSteps steps) {
        DeleteStrategy deletes = ctx.config().getDeleteStrategy();
        if (deletes == DeleteStrategy.SOFT_DELETE) {
            steps.add(updateFrom(ctx, softDeleteAssignments(ctx), cdcSource(ctx), keyJoin(TARGET, SOURCE, ctx.keys()),
                    deleteOperation(SOURCE, ctx)));
            steps.add(mergeChanges(ctx, DeleteStrategy.IGNORE));
        } else {
            steps.add(mergeChanges(ctx, deletes));
        }
    }

    @Override
    protected void incrementalTimestamp(LoadContext ctx, LoadSteps steps) {
        Watermark watermark = watermark(ctx);
        String column = q(watermark.column().getName());
        steps.declare("DECLARE " + MAX_VARIABLE + " " + watermark.physicalType() + " = (SELECT ISNULL(MAX("
                + column + "), " + watermark.floor() + ") FROM " + ctx.target() + ")");

        String bound = MAX_VARIABLE;
        if (watermark.lookback() != null) {
            bound = "DATEADD(" + watermark.lookback().sqlUnit() + ", -" + watermark.lookback().amount() + ", "
                    + MAX_VARIABLE + ")";
        }
        steps.add(insertSelect(ctx, ctx.dataColumns(), ctx.staging(), SOURCE + "." + column + " > " + bound));
    }

    @Override
    public List<String> maintenanceStatements(CanonicalSchema schema, String tableName) {
        return List.of("UPDATE STATISTICS " + reference(schema, tableName));
    }

    @Override
    protected String notMatched() {
        return "WHEN NOT MATCHED BY TARGET";
    }

    /**
     * EXCEPT compares NULLs as equal, which IS DISTINCT FROM would do on newer versions only.
     */
    @Override
    protected String changedPredicate(String targetAlias, String sourceAlias, List<String> columns) {
        return "EXISTS (SELECT " + String.join(", ", prefixed(targetAlias, columns))
                + " EXCEPT SELECT " + String.join(", ", prefixed(sourceAlias, columns)) + ")";
    }

    @Override
    protected String updateFrom(LoadContext ctx, List<String> assignments, String source, String join, String where) {
        return "UPDATE " + TARGET
                + "\nSET " + String.join(",\n    ", assignments)
                + "\nFROM " + ctx.target() + " AS " + TARGET
                + "\nINNER JOIN " + source + " AS " + SOURCE
                + "\n  ON " + join
                + (where == null ? "" : "\nWHERE " + where);
    }

    @Override
    protected String deleteUsing(LoadContext ctx, String source, String join, String where) {
        return "DELETE " + TARGET
                + "\nFROM " + ctx.target() + " AS " + TARGET
                + "\nINNER JOIN " + source + " AS " + SOURCE
                + "\n  ON " + join
                + (where == null ? "" : "\nWHERE " + where);
    }

    @Override
    protected String beginTransaction() {
        return "BEGIN TRANSACTION";
    }

    @Override
    protected String commitTransaction() {
        return "COMMIT TRANSACTION";
    }

    @Override
    protected String currentTimestamp() {
        return "GETDATE()";
    }

    @Override
    protected String currentDate() {
        return "CAST(GETDATE() AS DATE)";
    }

    @Override
    protected String trueLiteral() {
        return "1";
    }

    @Override
    protected String falseLiteral() {
        return "0";
    }

    @Override
    protected String rowHash(String alias, List<String> columns) {
        List<String> parts = columns.stream()
                .map(c -> "ISNULL(CAST(" + alias + "." + q(c) + " AS NVARCHAR(MAX)), " + NULL_SENTINEL + ")")
                .toList();
        // CONCAT_WS needs at least two values
        String input = parts.size() == 1 ? parts.get(0)
                : "CONCAT_WS('|', " + parts.stream().collect(Collectors.joining(", ")) + ")";
        return "HASHBYTES('SHA2_256', " + input + ")";
    }
}
