package org.schemaforge.incremental.postgresql;

import org.schemaforge.incremental.AbstractIncrementalGenerator;
import org.schemaforge.incremental.DeleteStrategy;
import org.schemaforge.incremental.LoadContext;
import org.schemaforge.incremental.LoadSteps;
import org.schemaforge.incremental.MergeStrategy;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.postgresql.PostgreSqlDialect;

import java.util.List;

/**
 * PostgreSQL: keyed loads use {@code INSERT ... ON CONFLICT}, which needs a unique constraint
 * on the primary key columns of the target.
 */
public class PostgreSqlIncrementalGenerator extends AbstractIncrementalGenerator {

    private static final String EXCLUDED = "EXCLUDED";

    public PostgreSqlIncrementalGenerator() {
        super(new PostgreSqlDialect());
    }

    @Override
    protected void upsert(LoadContext ctx, LoadSteps steps) {
        steps.add(onConflict(ctx, ctx.staging(), null, updateColumns(ctx),
                ctx.config().getMergeStrategy() == MergeStrategy.UPDATE_CHANGED));
    }

    @Override
    protected void scdType1(LoadContext ctx, LoadSteps steps) {
        steps.add(onConflict(ctx, ctx.staging(), null, nonKeyColumns(ctx), false));
    }

    @Override
    protected void cdcMerge(LoadContext ctx, LoadSteps steps) {
        String source = cdcSource(ctx);
        DeleteStrategy deletes = ctx.config().getDeleteStrategy();
        if (deletes == DeleteStrategy.HARD_DELETE) {
            steps.add(deleteUsing(ctx, source, keyJoin(TARGET, SOURCE, ctx.keys()), deleteOperation(SOURCE, ctx)));
        } else if (deletes == DeleteStrategy.SOFT_DELETE) {
            steps.add(updateFrom(ctx, softDeleteAssignments(ctx), source, keyJoin(TARGET, SOURCE, ctx.keys()),
                    deleteOperation(SOURCE, ctx)));
        }
        steps.add(onConflict(ctx, source, upsertOperations(SOURCE, ctx), nonKeyColumns(ctx), false));
    }

    /**
     * A scalar subquery bounds the insert so no session state is needed.
     */
    @Override
    protected void incrementalTimestamp(LoadContext ctx, LoadSteps steps) {
        Watermark watermark = watermark(ctx);
        String column = q(watermark.column().getName());
        String bound = "(SELECT COALESCE(MAX(" + column + "), " + watermark.floor() + ") FROM " + ctx.target() + ")";
        if (watermark.lookback() != null) {
            bound += " - INTERVAL '" + watermark.lookback() + "'";
        }
        steps.add(insertSelect(ctx, ctx.dataColumns(), ctx.staging(), SOURCE + "." + column + " > " + bound));
    }

    @Override
    public List<String> maintenanceStatements(CanonicalSchema schema, String tableName) {
        return List.of("VACUUM ANALYZE " + reference(schema, tableName));
    }

    @Override
    protected String beginTransaction() {
        return "BEGIN";
    }

    @Override
    protected String commitTransaction() {
        return "COMMIT";
    }

    @Override
    protected String rowHash(String alias, List<String> columns) {
        return "md5(ROW(" + String.join(", ", prefixed(alias, columns)) + ")::text)";
    }

    @Override
    protected String hashDiffers(String targetAlias, String sourceAlias, List<String> columns) {
        return rowHash(targetAlias, columns) + " IS DISTINCT FROM " + rowHash(sourceAlias, columns);
    }

    private String onConflict(LoadContext ctx, String source, String where, List<String> update, boolean changedOnly) {
        String insert = "INSERT INTO " + ctx.target() + " AS " + TARGET + " (" + cols(ctx.dataColumns()) + ")"
                + "\nSELECT " + String.join(", ", prefixed(SOURCE, ctx.dataColumns()))
                + "\nFROM " + source + " AS " + SOURCE
                + (where == null ? "" : "\nWHERE " + where)
                + "\nON CONFLICT (" + cols(ctx.keys()) + ")";
        if (update.isEmpty()) {
            return insert + " DO NOTHING";
        }
        String statement = insert + " DO UPDATE SET\n    "
                + String.join(",\n    ", updateAssignments(ctx, EXCLUDED, update));
        if (changedOnly) {
            statement += "\nWHERE " + changedPredicate(TARGET, EXCLUDED, update);
        }
        return statement;
    }
}
