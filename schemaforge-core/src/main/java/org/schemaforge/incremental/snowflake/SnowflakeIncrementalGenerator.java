package org.schemaforge.incremental.snowflake;

import org.schemaforge.incremental.AbstractIncrementalGenerator;
import org.schemaforge.incremental.LoadContext;
import org.schemaforge.incremental.LoadSteps;
import org.schemaforge.incremental.MergeStrategy;
import org.schemaforge.render.snowflake.SnowflakeDialect;

import java.util.List;

/**
 * Snowflake: MERGE for keyed loads, a session variable for the watermark.
 */
public class SnowflakeIncrementalGenerator extends AbstractIncrementalGenerator {

    static final String MAX_VARIABLE = "max_ts";

    public SnowflakeIncrementalGenerator() {
        super(new SnowflakeDialect());
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
        steps.declare("SET " + MAX_VARIABLE + " = (SELECT COALESCE(MAX(" + column + "), " + watermark.floor()
                + ") FROM " + ctx.target() + ")");

        String bound = "$" + MAX_VARIABLE;
        if (watermark.lookback() != null) {
            bound = "DATEADD(" + watermark.lookback().sqlUnit() + ", -" + watermark.lookback().amount() + ", "
                    + bound + ")";
        }
        steps.add(insertSelect(ctx, ctx.dataColumns(), ctx.staging(), SOURCE + "." + column + " > " + bound));
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
        return "CURRENT_TIMESTAMP()";
    }

    @Override
    protected String currentDate() {
        return "CURRENT_DATE()";
    }

    @Override
    protected String rowHash(String alias, List<String> columns) {
        return "HASH(" + String.join(", ", prefixed(alias, columns)) + ")";
    }
}
