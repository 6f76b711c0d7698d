package org.schemaforge.incremental.bigquery;

import org.schemaforge.incremental.AbstractIncrementalGenerator;
import org.schemaforge.incremental.LoadContext;
import org.schemaforge.incremental.LoadSteps;
import org.schemaforge.incremental.MergeStrategy;
import org.schemaforge.render.bigquery.BigQueryDialect;

import java.util.List;

/**
 * BigQuery scripting: MERGE for keyed loads, a declared script variable for the watermark.
 */
public class BigQueryIncrementalGenerator extends AbstractIncrementalGenerator {

    static final String MAX_VARIABLE = "max_ts";

    public BigQueryIncrementalGenerator() {
        super(new BigQueryDialect());
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

    @Override
    protected void cdcMerge(LoadContext ctx, LoadSteps steps) {
        steps.add(mergeChanges(ctx, ctx.config().getDeleteStrategy()));
    }

    @Override
    protected void incrementalTimestamp(LoadContext ctx, LoadSteps steps) {
        Watermark watermark = watermark(ctx);
        String column = q(watermark.column().getName());
        steps.declare("DECLARE " + MAX_VARIABLE + " " + watermark.physicalType() + " DEFAULT (\n  SELECT COALESCE(MAX("
                + column + "), " + watermark.floor() + ") FROM " + ctx.target() + "\n)");

        String bound = MAX_VARIABLE;
        if (watermark.lookback() != null) {
            String function = watermark.isDate() ? "DATE_SUB" : "TIMESTAMP_SUB";
            bound = function + "(" + MAX_VARIABLE + ", INTERVAL " + watermark.lookback().amount() + " "
                    + watermark.lookback().sqlUnit() + ")";
        }
        steps.add(insertSelect(ctx, ctx.dataColumns(), ctx.staging(), SOURCE + "." + column + " > " + bound));
    }

    /**
     * BigQuery has no DELETE ... USING; the staged keys are matched with EXISTS.
     */
    @Override
    protected String deleteUsing(LoadContext ctx, String source, String join, String where) {
        return "DELETE FROM " + ctx.target() + " AS " + TARGET
                + "\nWHERE EXISTS (\n  SELECT 1 FROM " + source + " AS " + SOURCE
                + "\n  WHERE " + join.replace("\n  AND ", "\n    AND ")
                + (where == null ? "" : "\n    AND " + where)
                + "\n)";
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
        return "CURRENT_TIMESTAMP()";
    }

    @Override
    protected String currentDate() {
        return "CURRENT_DATE()";
    }

    @Override
    protected String rowHash(String alias, List<String> columns) {
        return "FARM_FINGERPRINT(TO_JSON_STRING(STRUCT(" + String.join(", ", prefixed(alias, columns)) + ")))";
    }
}
