package org.schemaforge.incremental;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.error.ConfigurationException;
import org.schemaforge.error.UnsupportedCapabilityException;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;
import org.schemaforge.model.OptimizationHints;
import org.schemaforge.render.DdlDialect;
import org.schemaforge.render.Platform;
import org.schemaforge.render.RendererFactory;
import org.schemaforge.render.TableKind;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Pattern recipes written against a small set of dialect hooks.
 * <p>
 * Portable patterns (full refresh, append, incremental append, snapshot, delete-insert, SCD type 2)
 * are assembled here from {@link #updateFrom}, {@link #deleteUsing} and the literal hooks. Subclasses
 * supply the statements whose shape differs per platform: upsert, SCD type 1, CDC and the
 * timestamp watermark.
 */
@Slf4j
public abstract class AbstractIncrementalGenerator implements IncrementalGenerator {

    protected static final String TARGET = "target";
    protected static final String SOURCE = "source";
    protected static final String ROW_NUMBER_COLUMN = "_row_num";
    protected static final String WATERMARK_FLOOR = "1970-01-01";

    protected final DdlDialect dialect;

    protected AbstractIncrementalGenerator(DdlDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public Platform platform() {
        return dialect.platform();
    }

    @Override
    public boolean supports(LoadPattern pattern) {
        return pattern != LoadPattern.UPSERT || dialect.capabilities().nativeMerge();
    }

    @Override
    public void validate(CanonicalSchema schema, IncrementalConfig config) {
        config.validate(schema);
        if (!supports(config.getLoadPattern())) {
            throw new UnsupportedCapabilityException(platform(), "load pattern " + config.getLoadPattern().token(),
                    unsupportedHint(config.getLoadPattern()));
        }
    }

    /**
     * Suggestion appended to the error for a pattern this platform cannot run.
     */
    protected String unsupportedHint(LoadPattern pattern) {
        return null;
    }

    @Override
    public IncrementalScript generate(CanonicalSchema schema, String tableName, IncrementalConfig config) {
        validate(schema, config);
        LoadContext ctx = context(schema, tableName, config);
        LoadSteps steps = new LoadSteps();

        switch (config.getLoadPattern()) {
            case FULL_REFRESH -> fullRefresh(ctx, steps);
            case APPEND_ONLY -> appendOnly(ctx, steps);
            case UPSERT -> upsert(ctx, steps);
            case DELETE_INSERT -> deleteInsert(ctx, steps);
            case INCREMENTAL_TIMESTAMP -> incrementalTimestamp(ctx, steps);
            case INCREMENTAL_APPEND -> incrementalAppend(ctx, steps);
            case SCD_TYPE1 -> scdType1(ctx, steps);
            case SCD_TYPE2 -> scdType2(ctx, steps);
            case CDC_MERGE -> cdcMerge(ctx, steps);
            case SNAPSHOT -> snapshot(ctx, steps);
        }

        IncrementalScript script = IncrementalScript.builder()
                .platform(platform())
                .pattern(config.getLoadPattern())
                .targetTable(ctx.target())
                .stagingTable(ctx.staging())
                .stagingDdl(generateStagingDdl(schema, tableName, config))
                .preamble(steps.preamble())
                .statements(steps.statements())
                .beginTransaction(config.isUseTransaction() ? beginTransaction() : null)
                .commitTransaction(config.isUseTransaction() ? commitTransaction() : null)
                .build();
        log.info("Generated {} load for {} on {} ({} statements)", config.getLoadPattern().token(), ctx.target(),
                platform().token(), script.getStatements().size());
        return script;
    }

    @Override
    public String generateStagingDdl(CanonicalSchema schema, String tableName, IncrementalConfig config) {
        CanonicalSchema staging = schema.toBuilder()
                .tableName(config.resolveStagingTable(tableName))
                .optimization(OptimizationHints.none())
                .description(null)
                .build();
        return RendererFactory.getRenderer(platform(), staging).toDdl(TableKind.STAGING);
    }

    @Override
    public String maxValueQuery(CanonicalSchema schema, String tableName, String column) {
        ColumnDefinition definition = schema.getColumn(column)
                .orElseThrow(() -> new ConfigurationException(IncrementalConfig.INCREMENTAL_COLUMN,
                        "column '" + column + "' not found in schema '" + schema.getTableName() + "'"));
        return "SELECT MAX(" + q(definition.getName()) + ") AS max_value FROM " + reference(schema, tableName);
    }

    @Override
    public List<String> maintenanceStatements(CanonicalSchema schema, String tableName) {
        return List.of();
    }

    // ---------------------------------------------------------------- recipes

    protected void fullRefresh(LoadContext ctx, LoadSteps steps) {
        steps.add(truncate(ctx.target()));
        steps.add(insertSelect(ctx, ctx.dataColumns(), ctx.staging(), null));
    }

    protected void appendOnly(LoadContext ctx, LoadSteps steps) {
        steps.add(insertSelect(ctx, ctx.dataColumns(), ctx.staging(), null));
    }

    protected abstract void upsert(LoadContext ctx, LoadSteps steps);

    protected void deleteInsert(LoadContext ctx, LoadSteps steps) {
        steps.add(deleteUsing(ctx, ctx.staging(), keyJoin(targetAlias(ctx), SOURCE, ctx.keys()), null));
        steps.add(insertSelect(ctx, ctx.dataColumns(), ctx.staging(), null));
    }

    protected abstract void incrementalTimestamp(LoadContext ctx, LoadSteps steps);

    /**
     * Inserts only staged rows whose key is absent from the target.
     */
    protected void incrementalAppend(LoadContext ctx, LoadSteps steps) {
        steps.add(insertSelect(ctx, ctx.dataColumns(), ctx.staging(), notExistsInTarget(ctx, null)));
    }

    protected abstract void scdType1(LoadContext ctx, LoadSteps steps);

    /**
     * Closes the current version of every changed row, then inserts a new current version for
     * changed and new keys. The order matters: the insert relies on the close-out having run.
     */
    protected void scdType2(LoadContext ctx, LoadSteps steps) {
        IncrementalConfig config = ctx.config();
        String alias = targetAlias(ctx);
        String expiration = q(config.getExpirationDateColumn());
        String current = q(config.getIsCurrentColumn());

        String closeCondition = alias + "." + current + " = " + trueLiteral()
                + "\n  AND " + hashDiffers(alias, SOURCE, config.getHashColumns());
        steps.add(updateFrom(ctx,
                List.of(expiration + " = " + now(columnType(ctx, config.getExpirationDateColumn())),
                        current + " = " + falseLiteral()),
                ctx.staging(), keyJoin(alias, SOURCE, ctx.keys()), closeCondition));

        List<String> columns = new ArrayList<>(ctx.dataColumns());
        columns.add(config.getEffectiveDateColumn());
        columns.add(config.getExpirationDateColumn());
        columns.add(config.getIsCurrentColumn());
        List<String> values = new ArrayList<>(prefixed(SOURCE, ctx.dataColumns()));
        values.add(now(columnType(ctx, config.getEffectiveDateColumn())));
        values.add(typedLiteral(config.getFarFutureDate(), ctx, config.getExpirationDateColumn()));
        values.add(trueLiteral());
        steps.add(insertSelect(ctx, columns, values, ctx.staging(),
                notExistsInTarget(ctx, TARGET + "." + current + " = " + trueLiteral())));
        log.debug("SCD2 on {} compares {}", ctx.target(), config.getHashColumns());
    }

    protected abstract void cdcMerge(LoadContext ctx, LoadSteps steps);

    /**
     * Appends the staged rows stamped with the load time.
     */
    protected void snapshot(LoadContext ctx, LoadSteps steps) {
        String snapshotColumn = ctx.config().getSnapshotColumn();
        List<String> columns = ctx.dataColumns();
        List<String> values = new ArrayList<>(prefixed(SOURCE, columns));
        List<String> targetColumns = new ArrayList<>(columns);
        if (ctx.schema().hasColumn(snapshotColumn)) {
            targetColumns.add(snapshotColumn);
            values.add(now(columnType(ctx, snapshotColumn)));
        } else {
            log.warn("Snapshot column '{}' not in schema of {}, rows are appended without a load time",
                    snapshotColumn, ctx.tableName());
        }
        steps.add(insertSelect(ctx, targetColumns, values, ctx.staging(), null));
    }

    // ---------------------------------------------------------------- dialect hooks

    protected abstract String beginTransaction();

    protected abstract String commitTransaction();

    protected String currentTimestamp() {
        return "CURRENT_TIMESTAMP";
    }

    protected String currentDate() {
        return "CURRENT_DATE";
    }

    protected String trueLiteral() {
        return "TRUE";
    }

    protected String falseLiteral() {
        return "FALSE";
    }

    protected String truncate(String target) {
        return "TRUNCATE TABLE " + target;
    }

    /**
     * Deterministic fingerprint of {@code columns} read through {@code alias}.
     */
    protected abstract String rowHash(String alias, List<String> columns);

    protected String hashDiffers(String targetAlias, String sourceAlias, List<String> columns) {
        return rowHash(targetAlias, columns) + " <> " + rowHash(sourceAlias, columns);
    }

    /**
     * True when any of {@code columns} differs between the two aliases, nulls compared as values.
     */
    protected String changedPredicate(String targetAlias, String sourceAlias, List<String> columns) {
        return "(" + columns.stream()
                .map(c -> targetAlias + "." + q(c) + " IS DISTINCT FROM " + sourceAlias + "." + q(c))
                .collect(Collectors.joining("\n    OR ")) + ")";
    }

    /**
     * Alias the target is addressed by inside UPDATE and DELETE statements.
     */
    protected String targetAlias(LoadContext ctx) {
        return TARGET;
    }

    /**
     * {@code UPDATE ... FROM} joining {@code source} on {@code join}; {@code where} may be null.
     */
    protected String updateFrom(LoadContext ctx, List<String> assignments, String source, String join, String where) {
        return "UPDATE " + ctx.target() + " AS " + TARGET
                + "\nSET " + String.join(",\n    ", assignments)
                + "\nFROM " + source + " AS " + SOURCE
                + "\nWHERE " + join
                + (where == null ? "" : "\n  AND " + where);
    }

    /**
     * Deletes target rows with a matching {@code source} row; {@code where} may be null.
     */
    protected String deleteUsing(LoadContext ctx, String source, String join, String where) {
        return "DELETE FROM " + ctx.target() + " AS " + TARGET
                + "\nUSING " + source + " AS " + SOURCE
                + "\nWHERE " + join
                + (where == null ? "" : "\n  AND " + where);
    }

    /**
     * Opening of {@code WHEN NOT MATCHED} clauses in MERGE.
     */
    protected String notMatched() {
        return "WHEN NOT MATCHED";
    }

    // ---------------------------------------------------------------- shared building blocks

    protected String q(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }

    protected String cols(List<String> columns) {
        return columns.stream().map(this::q).collect(Collectors.joining(", "));
    }

    protected List<String> prefixed(String alias, List<String> columns) {
        return columns.stream().map(c -> alias + "." + q(c)).toList();
    }

    protected String keyJoin(String left, String right, List<String> keys) {
        return keys.stream()
                .map(k -> left + "." + q(k) + " = " + right + "." + q(k))
                .collect(Collectors.joining("\n  AND "));
    }

    protected String assign(String column, String expression) {
        return q(column) + " = " + expression;
    }

    protected List<String> assignFrom(String alias, List<String> columns) {
        return columns.stream().map(c -> assign(c, alias + "." + q(c))).toList();
    }

    protected MergeStatement mergeInto(LoadContext ctx, String source) {
        return MergeStatement.into(ctx.target(), TARGET, source, SOURCE, keyJoin(TARGET, SOURCE, ctx.keys()));
    }

    /**
     * MERGE overwriting {@code update} on a key match, only for differing rows when {@code changedOnly},
     * and inserting unmatched staged rows.
     */
    protected String mergeUpsert(LoadContext ctx, List<String> update, boolean changedOnly) {
        MergeStatement merge = mergeInto(ctx, ctx.staging());
        if (!update.isEmpty()) {
            merge.whenMatchedUpdate(changedOnly ? changedPredicate(TARGET, SOURCE, update) : null,
                    updateAssignments(ctx, SOURCE, update));
        }
        return merge.whenNotMatchedInsert(notMatched(), null, quoted(ctx.dataColumns()),
                prefixed(SOURCE, ctx.dataColumns())).build();
    }

    /**
     * MERGE applying a change feed: deletes per {@code deletes}, inserts and updates for the other operations.
     */
    protected String mergeChanges(LoadContext ctx, DeleteStrategy deletes) {
        MergeStatement merge = mergeInto(ctx, cdcSource(ctx));
        if (deletes == DeleteStrategy.HARD_DELETE) {
            merge.whenMatchedDelete(deleteOperation(SOURCE, ctx));
        } else if (deletes == DeleteStrategy.SOFT_DELETE) {
            merge.whenMatchedUpdate(deleteOperation(SOURCE, ctx), softDeleteAssignments(ctx));
        }
        List<String> update = nonKeyColumns(ctx);
        if (!update.isEmpty()) {
            merge.whenMatchedUpdate(upsertOperations(SOURCE, ctx), updateAssignments(ctx, SOURCE, update));
        }
        return merge.whenNotMatchedInsert(notMatched(), upsertOperations(SOURCE, ctx),
                quoted(ctx.dataColumns()), prefixed(SOURCE, ctx.dataColumns())).build();
    }

    protected List<String> softDeleteAssignments(LoadContext ctx) {
        List<String> assignments = new ArrayList<>();
        assignments.add(assign(ctx.config().getSoftDeleteColumn(), trueLiteral()));
        String updatedAt = ctx.config().getUpdatedAtColumn();
        if (updatedAt != null && !updatedAt.isBlank()) {
            assignments.add(assign(updatedAt, now(columnType(ctx, updatedAt))));
        }
        return assignments;
    }

    protected List<String> quoted(List<String> columns) {
        return columns.stream().map(this::q).toList();
    }

    protected String insertSelect(LoadContext ctx, List<String> columns, String source, String where) {
        return insertSelect(ctx, columns, prefixed(SOURCE, columns), source, where);
    }

    protected String insertSelect(LoadContext ctx, List<String> columns, List<String> values, String source,
                                  String where) {
        return "INSERT INTO " + ctx.target() + " (" + cols(columns) + ")"
                + "\nSELECT " + String.join(", ", values)
                + "\nFROM " + source + " AS " + SOURCE
                + (where == null ? "" : "\nWHERE " + where);
    }

    /**
     * {@code NOT EXISTS} over the target on the key columns, optionally narrowed by {@code extra}.
     */
    protected String notExistsInTarget(LoadContext ctx, String extra) {
        return "NOT EXISTS (\n  SELECT 1 FROM " + ctx.target() + " AS " + TARGET
                + "\n  WHERE " + keyJoin(TARGET, SOURCE, ctx.keys()).replace("\n  AND ", "\n    AND ")
                + (extra == null ? "" : "\n    AND " + extra)
                + "\n)";
    }

    /**
     * Columns overwritten on a key match under the configured merge strategy. The updated-at
     * column is excluded; see {@link #updateAssignments}.
     */
    protected List<String> updateColumns(LoadContext ctx) {
        IncrementalConfig config = ctx.config();
        return switch (config.getMergeStrategy()) {
            case UPDATE_NONE -> List.of();
            case UPDATE_SELECTIVE -> config.getUpdateColumns().stream()
                    .filter(c -> !c.equalsIgnoreCase(config.getUpdatedAtColumn()))
                    .toList();
            case UPDATE_ALL, UPDATE_CHANGED -> nonKeyColumns(ctx);
        };
    }

    protected List<String> nonKeyColumns(LoadContext ctx) {
        String updatedAt = ctx.config().getUpdatedAtColumn();
        return ctx.dataColumns().stream()
                .filter(c -> !ctx.isKey(c))
                .filter(c -> !c.equalsIgnoreCase(updatedAt))
                .toList();
    }

    /**
     * Assignments for {@code columns} read from {@code alias}, plus the updated-at stamp when configured.
     */
    protected List<String> updateAssignments(LoadContext ctx, String alias, List<String> columns) {
        List<String> assignments = new ArrayList<>(assignFrom(alias, columns));
        String updatedAt = ctx.config().getUpdatedAtColumn();
        if (updatedAt != null && !updatedAt.isBlank() && !assignments.isEmpty()) {
            assignments.add(assign(updatedAt, now(columnType(ctx, updatedAt))));
        }
        return assignments;
    }

    /**
     * Staging relation holding only the latest change per key when a sequence column is configured.
     */
    protected String cdcSource(LoadContext ctx) {
        String sequence = ctx.config().getSequenceColumn();
        if (sequence == null || sequence.isBlank()) {
            return ctx.staging();
        }
        return "(\n  SELECT * FROM (\n    SELECT s.*, ROW_NUMBER() OVER (PARTITION BY "
                + prefixed("s", ctx.keys()).stream().collect(Collectors.joining(", "))
                + " ORDER BY s." + q(sequence) + " DESC) AS " + ROW_NUMBER_COLUMN
                + "\n    FROM " + ctx.staging() + " AS s"
                + "\n  ) ranked\n  WHERE " + ROW_NUMBER_COLUMN + " = 1\n)";
    }

    protected String operationIs(String alias, LoadContext ctx, String... operations) {
        String column = alias + "." + q(ctx.config().getOperationColumn());
        if (operations.length == 1) {
            return column + " = " + dialect.stringLiteral(operations[0]);
        }
        List<String> literals = new ArrayList<>();
        for (String operation : operations) {
            literals.add(dialect.stringLiteral(operation));
        }
        return column + " IN (" + String.join(", ", literals) + ")";
    }

    protected String upsertOperations(String alias, LoadContext ctx) {
        return operationIs(alias, ctx, CdcOperation.INSERT, CdcOperation.UPDATE);
    }

    protected String deleteOperation(String alias, LoadContext ctx) {
        return operationIs(alias, ctx, CdcOperation.DELETE);
    }

    protected String now(LogicalType type) {
        return type == LogicalType.DATE ? currentDate() : currentTimestamp();
    }

    protected LogicalType columnType(LoadContext ctx, String column) {
        return ctx.schema().getColumn(column).map(ColumnDefinition::getLogicalType).orElse(LogicalType.TIMESTAMP);
    }

    /**
     * {@code CAST('value' AS <physical type of column>)}, TIMESTAMP when the column is not in the schema.
     */
    protected String typedLiteral(String value, LoadContext ctx, String column) {
        ColumnDefinition definition = ctx.schema().getColumn(column)
                .orElseGet(() -> ColumnDefinition.of(column, LogicalType.TIMESTAMP));
        return "CAST(" + dialect.stringLiteral(value) + " AS " + dialect.physicalType(definition) + ")";
    }

    /**
     * Resolves and checks the incremental column of an {@code incremental_timestamp} load.
     */
    protected Watermark watermark(LoadContext ctx) {
        IncrementalConfig config = ctx.config();
        ColumnDefinition column = ctx.schema().getColumn(config.getIncrementalColumn()).orElseThrow();
        LogicalType type = column.getLogicalType();
        LookbackWindow lookback = config.getLookbackWindow();
        if (!type.isTemporal() && !type.isNumeric()) {
            throw new ConfigurationException(IncrementalConfig.INCREMENTAL_COLUMN, "incremental_column '"
                    + column.getName() + "' must be temporal or numeric, got " + type.token());
        }
        if (lookback != null && type.isNumeric()) {
            throw new ConfigurationException("lookback_window",
                    "lookback_window only applies to date and timestamp columns, '" + column.getName() + "' is "
                            + type.token());
        }
        if (lookback != null && type == LogicalType.DATE && lookback.unit() != ChronoUnit.DAYS) {
            throw new ConfigurationException("lookback_window",
                    "date column '" + column.getName() + "' needs a lookback in days, got " + lookback);
        }
        String floor = type.isNumeric() ? "0" : typedLiteral(WATERMARK_FLOOR, ctx, column.getName());
        return new Watermark(column, dialect.physicalType(column), floor, lookback);
    }

    protected LoadContext context(CanonicalSchema schema, String tableName, IncrementalConfig config) {
        String stagingName = config.resolveStagingTable(tableName);
        return new LoadContext(schema, config, tableName, stagingName,
                reference(schema, tableName), reference(schema, stagingName), dataColumns(schema, config));
    }

    protected String reference(CanonicalSchema schema, String tableName) {
        return dialect.tableReference(schema.getProjectId(), schema.getDatasetName(), tableName);
    }

    /**
     * Schema columns copied into the target: CDC bookkeeping and the SCD2 / snapshot columns
     * the load writes itself are left out.
     */
    private static List<String> dataColumns(CanonicalSchema schema, IncrementalConfig config) {
        List<String> excluded = new ArrayList<>();
        switch (config.getLoadPattern()) {
            case CDC_MERGE -> {
                excluded.add(config.getOperationColumn());
                excluded.add(config.getSequenceColumn());
            }
            case SCD_TYPE2 -> {
                excluded.add(config.getEffectiveDateColumn());
                excluded.add(config.getExpirationDateColumn());
                excluded.add(config.getIsCurrentColumn());
            }
            case SNAPSHOT -> excluded.add(config.getSnapshotColumn());
            default -> {
            }
        }
        List<String> lowered = excluded.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(c -> c.toLowerCase(Locale.ROOT))
                .toList();
        return schema.columnNames().stream()
                .filter(c -> !lowered.contains(c.toLowerCase(Locale.ROOT)))
                .toList();
    }

    /**
     * High-water mark of an incremental load.
     *
     * @param physicalType declared type of the mark variable
     * @param floor        value used while the target is still empty
     * @param lookback     null when no lookback applies
     */
    protected record Watermark(ColumnDefinition column, String physicalType, String floor, LookbackWindow lookback) {

        public boolean isDate() {
            return column.getLogicalType() == LogicalType.DATE;
        }
    }

    /**
     * Operation codes a CDC feed uses.
     */
    protected static final class CdcOperation {
        public static final String INSERT = "I";
        public static final String UPDATE = "U";
        public static final String DELETE = "D";

        private CdcOperation() {
        }
    }
}
