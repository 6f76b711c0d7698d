package org.schemaforge.incremental.redshift;

import org.schemaforge.incremental.AbstractIncrementalGenerator;
import org.schemaforge.incremental.DeleteStrategy;
import org.schemaforge.incremental.LoadContext;
import org.schemaforge.incremental.LoadPattern;
import org.schemaforge.incremental.LoadSteps;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.redshift.RedshiftDialect;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Redshift has no MERGE here: keyed loads become UPDATE ... FROM followed by an anti-joined INSERT.
 * UPDATE and DELETE cannot alias their target, so the target is addressed by its bare table name.
 */
public class RedshiftIncrementalGenerator extends AbstractIncrementalGenerator {

    private static final String NULL_SENTINEL = "'<null>'";

    public RedshiftIncrementalGenerator() {
        super(new RedshiftDialect());
    }

    @Override
    protected String unsupportedHint(LoadPattern pattern) {
        return "no native MERGE, use delete_insert or scd_type1 instead";
    }

    @Override
    protected void upsert(LoadContext ctx, LoadSteps steps) {
        throw new IllegalStateException("upsert is rejected during validation");
    }

    @Override
    protected void scdType1(LoadContext ctx, LoadSteps steps) {
        List<String> update = nonKeyColumns(ctx);
        if (!update.isEmpty()) {
            steps.add(updateFrom(ctx, updateAssignments(ctx, SOURCE, update), ctx.staging(),
                    keyJoin(targetAlias(ctx), SOURCE, ctx.keys()), null));
        }
        steps.add(insertSelect(ctx, ctx.dataColumns(), ctx.staging(), notExistsInTarget(ctx, null)));
    }

    @Override
    protected void cdcMerge(LoadContext ctx, LoadSteps steps) {
        String source = cdcSource(ctx);
        String join = keyJoin(targetAlias(ctx), SOURCE, ctx.keys());
        DeleteStrategy deletes = ctx.config().getDeleteStrategy();
        if (deletes == DeleteStrategy.HARD_DELETE) {
            steps.add(deleteUsing(ctx, source, join, deleteOperation(SOURCE, ctx)));
        } else if (deletes == DeleteStrategy.SOFT_DELETE) {
            steps.add(updateFrom(ctx, softDeleteAssignments(ctx), source, join, deleteOperation(SOURCE, ctx)));
        }
        List<String> update = nonKeyColumns(ctx);
        if (!update.isEmpty()) {
            steps.add(updateFrom(ctx, updateAssignments(ctx, SOURCE, update), source, join,
                    upsertOperations(SOURCE, ctx)));
        }
        steps.add(insertSelect(ctx, ctx.dataColumns(), source,
                upsertOperations(SOURCE, ctx) + "\n  AND " + notExistsInTarget(ctx, null)));
    }

    @Override
    protected void incrementalTimestamp(LoadContext ctx, LoadSteps steps) {
        Watermark watermark = watermark(ctx);
        String column = q(watermark.column().getName());
        String bound = "(SELECT COALESCE(MAX(" + column + "), " + watermark.floor() + ") FROM " + ctx.target() + ")";
        if (watermark.lookback() != null) {
            bound = "DATEADD(" + watermark.lookback().sqlUnit().toLowerCase(Locale.ROOT) + ", -" + watermark.lookback().amount()
                    + ", " + bound + ")";
        }
        steps.add(insertSelect(ctx, ctx.dataColumns(), ctx.staging(), SOURCE + "." + column + " > " + bound));
    }

    @Override
    public List<String> maintenanceStatements(CanonicalSchema schema, String tableName) {
        String target = reference(schema, tableName);
        return List.of("VACUUM " + target, "ANALYZE " + target);
    }

    @Override
    protected String targetAlias(LoadContext ctx) {
        return q(ctx.tableName());
    }

    @Override
    protected String updateFrom(LoadContext ctx, List<String> assignments, String source, String join, String where) {
        return "UPDATE " + ctx.target()
                + "\nSET " + String.join(",\n    ", assignments)
                + "\nFROM " + source + " AS " + SOURCE
                + "\nWHERE " + join
                + (where == null ? "" : "\n  AND " + where);
    }

    @Override
    protected String deleteUsing(LoadContext ctx, String source, String join, String where) {
        return "DELETE FROM " + ctx.target()
                + "\nUSING " + source + " AS " + SOURCE
                + "\nWHERE " + join
                + (where == null ? "" : "\n  AND " + where);
    }

    @Override
    protected String beginTransaction() {
        return "BEGIN TRANSACTION";
    }

    @Override
    protected String commitTransaction() {
        return "COMMIT";
    }

    @Override
    protected String currentTimestamp() {
        return "GETDATE()";
    }

    @Override
    protected String rowHash(String alias, List<String> columns) {
        return "MD5(" + columns.stream()
                .map(c -> "COALESCE(CAST(" + alias + "." + q(c) + " AS VARCHAR), " + NULL_SENTINEL + ")")
                .collect(Collectors.joining(" || '|' || ")) + ")";
    }
}
