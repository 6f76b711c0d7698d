package org.schemaforge.cli;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.SchemaForge;
import org.schemaforge.cli.service.SchemaIoService;
import org.schemaforge.config.ConfigurationLoader;
import org.schemaforge.config.SchemaForgeSettings;
import org.schemaforge.incremental.DeleteStrategy;
import org.schemaforge.incremental.IncrementalConfig;
import org.schemaforge.incremental.IncrementalGenerator;
import org.schemaforge.incremental.IncrementalScript;
import org.schemaforge.incremental.LoadPattern;
import org.schemaforge.incremental.LookbackWindow;
import org.schemaforge.incremental.MergeStrategy;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.Platform;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Generates the staging DDL and load statements of one load pattern.
 */
@Slf4j
@CommandLine.Command(
        name = "incremental",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "Generates incremental load SQL for a schema document."
)
public class IncrementalCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", description = "Schema document (.json, .yaml)")
    private Path schemaFile;
    @CommandLine.Option(names = {"-d", "--platform"}, description = "Target platform; configured default when omitted")
    private String platformName;
    @CommandLine.Option(names = {"-P", "--pattern"}, required = true,
            description = "full_refresh, append, upsert, delete_insert, incremental_timestamp, incremental_append, scd_type1, scd_type2, cdc, snapshot")
    private String patternName;
    @CommandLine.Option(names = "--table", description = "Target table; the schema's table name when omitted")
    private String tableName;
    @CommandLine.Option(names = {"-k", "--keys"}, split = ",", description = "Primary key columns")
    private List<String> primaryKeys;
    @CommandLine.Option(names = "--merge-strategy", description = "update_all, update_changed, update_selective, update_none", defaultValue = "update_all")
    private String mergeStrategy;
    @CommandLine.Option(names = "--update-columns", split = ",", description = "Columns overwritten by update_selective")
    private List<String> updateColumns;
    @CommandLine.Option(names = "--incremental-column", description = "Watermark column of incremental_timestamp")
    private String incrementalColumn;
    @CommandLine.Option(names = "--lookback", description = "Lookback window, e.g. '2 hours'")
    private String lookback;
    @CommandLine.Option(names = "--hash-columns", split = ",", description = "Columns compared by scd_type2")
    private List<String> hashColumns;
    @CommandLine.Option(names = "--effective-date-column", description = "SCD2 validity start column")
    private String effectiveDateColumn;
    @CommandLine.Option(names = "--expiration-date-column", description = "SCD2 validity end column")
    private String expirationDateColumn;
    @CommandLine.Option(names = "--is-current-column", description = "SCD2 current-row flag column")
    private String isCurrentColumn;
    @CommandLine.Option(names = "--operation-column", description = "CDC operation column (I, U, D)")
    private String operationColumn;
    @CommandLine.Option(names = "--sequence-column", description = "CDC ordering column")
    private String sequenceColumn;
    @CommandLine.Option(names = "--delete-strategy", description = "hard_delete, soft_delete, ignore", defaultValue = "ignore")
    private String deleteStrategy;
    @CommandLine.Option(names = "--soft-delete-column", description = "Flag set by soft deletes")
    private String softDeleteColumn;
    @CommandLine.Option(names = "--updated-at-column", description = "Column stamped on every update")
    private String updatedAtColumn;
    @CommandLine.Option(names = "--staging-table", description = "Staging table name; <table>_staging when omitted")
    private String stagingTable;
    @CommandLine.Option(names = "--no-transaction", description = "Do not wrap the statements in a transaction")
    private boolean noTransaction;
    @CommandLine.Option(names = "--skip-staging", description = "Omit the staging table DDL")
    private boolean skipStaging;
    @CommandLine.Option(names = "--maintenance", description = "Append post-load maintenance statements")
    private boolean maintenance;
    @CommandLine.Option(names = "--out", description = "Output file; stdout when omitted")
    private Path out;
    @CommandLine.Option(names = "--profile", description = "Configuration profile (dev, prod, test ...)")
    private String profile;

    @Override
    public Integer call() {
        try {
            SchemaIoService io = new SchemaIoService();
            CanonicalSchema schema = io.loadSchema(schemaFile);
            SchemaForgeSettings settings = new ConfigurationLoader().loadSettings(profile);
            Platform platform = platformName != null ? Platform.fromName(platformName) : settings.defaultPlatform();
            String target = tableName != null ? tableName : schema.getTableName();

            IncrementalConfig config = buildConfig(settings);
            IncrementalGenerator generator = SchemaForge.getIncrementalGenerator(platform);
            IncrementalScript script = generator.generate(schema, target, config);

            StringBuilder sql = new StringBuilder();
            if (!skipStaging) {
                sql.append(script.getStagingDdl()).append('\n');
            }
            sql.append(script.toSql());
            if (maintenance) {
                for (String statement : generator.maintenanceStatements(schema, target)) {
                    sql.append('\n').append(statement).append(";\n");
                }
            }
            io.emit(sql.toString(), out);
            return 0;
        } catch (Exception e) {
            System.err.println("Incremental generation failed: " + e.getMessage());
            log.debug("Incremental generation failed", e);
            return 1;
        }
    }

    IncrementalConfig buildConfig(SchemaForgeSettings settings) {
        IncrementalConfig.IncrementalConfigBuilder builder = settings.incrementalConfig()
                .loadPattern(LoadPattern.fromToken(patternName))
                .mergeStrategy(MergeStrategy.valueOf(mergeStrategy.toUpperCase(Locale.ROOT)))
                .deleteStrategy(DeleteStrategy.valueOf(deleteStrategy.toUpperCase(Locale.ROOT)))
                .incrementalColumn(incrementalColumn)
                .operationColumn(operationColumn)
                .sequenceColumn(sequenceColumn)
                .softDeleteColumn(softDeleteColumn)
                .updatedAtColumn(updatedAtColumn)
                .stagingTable(stagingTable)
                .useTransaction(!noTransaction);
        if (primaryKeys != null) {
            builder.primaryKeys(primaryKeys);
        }
        if (updateColumns != null) {
            builder.updateColumns(updateColumns);
        }
        if (hashColumns != null) {
            builder.hashColumns(hashColumns);
        }
        if (lookback != null) {
            builder.lookbackWindow(LookbackWindow.parse(lookback));
        }
        if (effectiveDateColumn != null) {
            builder.effectiveDateColumn(effectiveDateColumn);
        }
        if (expirationDateColumn != null) {
            builder.expirationDateColumn(expirationDateColumn);
        }
        if (isCurrentColumn != null) {
            builder.isCurrentColumn(isCurrentColumn);
        }
        return builder.build();
    }
}
