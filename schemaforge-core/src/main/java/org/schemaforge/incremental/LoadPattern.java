package org.schemaforge.incremental;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Strategies for moving staged rows into a target table.
 * <p>
 * Each pattern names the configuration fields it cannot do without; {@link IncrementalConfig#validate}
 * enforces them before any SQL is generated.
 */
public enum LoadPattern {

    FULL_REFRESH("full_refresh", "Full Refresh", PatternComplexity.SIMPLE, false, false,
            Set.of(),
            List.of("small dimension tables", "daily snapshots that replace everything", "reference data")),
    APPEND_ONLY("append", "Append Only", PatternComplexity.SIMPLE, false, false,
            Set.of(),
            List.of("event logs", "immutable facts", "audit trails")),
    UPSERT("upsert", "Upsert (Merge)", PatternComplexity.MEDIUM, true, false,
            Set.of(IncrementalConfig.PRIMARY_KEYS),
            List.of("dimension tables", "customer records", "mutable entities")),
    DELETE_INSERT("delete_insert", "Delete-Insert", PatternComplexity.MEDIUM, true, false,
            Set.of(IncrementalConfig.PRIMARY_KEYS),
            List.of("platforms without merge", "partition reloads", "batch corrections")),
    INCREMENTAL_TIMESTAMP("incremental_timestamp", "Incremental by Timestamp", PatternComplexity.MEDIUM, false, false,
            Set.of(IncrementalConfig.INCREMENTAL_COLUMN),
            List.of("append-mostly sources with an updated_at column", "late-arriving data with a lookback window")),
    INCREMENTAL_APPEND("incremental_append", "Incremental Append", PatternComplexity.SIMPLE, true, false,
            Set.of(IncrementalConfig.PRIMARY_KEYS),
            List.of("event logs with replays", "deduplicated appends")),
    SCD_TYPE1("scd_type1", "Slowly Changing Dimension Type 1", PatternComplexity.MEDIUM, true, false,
            Set.of(IncrementalConfig.PRIMARY_KEYS),
            List.of("dimension tables without history", "corrections that overwrite")),
    SCD_TYPE2("scd_type2", "Slowly Changing Dimension Type 2", PatternComplexity.ADVANCED, true, false,
            Set.of(IncrementalConfig.PRIMARY_KEYS, IncrementalConfig.HASH_COLUMNS,
                    IncrementalConfig.EFFECTIVE_DATE_COLUMN, IncrementalConfig.EXPIRATION_DATE_COLUMN,
                    IncrementalConfig.IS_CURRENT_COLUMN),
            List.of("dimension tables with history", "audit requirements", "point-in-time reporting")),
    CDC_MERGE("cdc", "Change Data Capture Merge", PatternComplexity.ADVANCED, true, true,
            Set.of(IncrementalConfig.PRIMARY_KEYS, IncrementalConfig.OPERATION_COLUMN),
            List.of("database replication", "change data capture feeds", "real-time sync")),
    SNAPSHOT("snapshot", "Snapshot", PatternComplexity.SIMPLE, false, false,
            Set.of(),
            List.of("periodic snapshots", "historical balances", "point-in-time copies"));

    private final String token;
    private final String displayName;
    private final PatternComplexity complexity;
    private final boolean requiresPrimaryKey;
    private final boolean supportsDelete;
    private final Set<String> requiredFields;
    private final List<String> useCases;

    LoadPattern(String token, String displayName, PatternComplexity complexity, boolean requiresPrimaryKey,
                boolean supportsDelete, Set<String> requiredFields, List<String> useCases) {
        this.token = token;
        this.displayName = displayName;
        this.complexity = complexity;
        this.requiresPrimaryKey = requiresPrimaryKey;
        this.supportsDelete = supportsDelete;
        this.requiredFields = requiredFields;
        this.useCases = useCases;
    }

    public String token() {
        return token;
    }

    public String displayName() {
        return displayName;
    }

    public PatternComplexity complexity() {
        return complexity;
    }

    public boolean requiresPrimaryKey() {
        return requiresPrimaryKey;
    }

    public boolean supportsDelete() {
        return supportsDelete;
    }

    public Set<String> requiredFields() {
        return requiredFields;
    }

    public List<String> useCases() {
        return useCases;
    }

    public static LoadPattern fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Load pattern must not be null");
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (LoadPattern pattern : values()) {
            if (pattern.token.equals(normalized) || pattern.name().equalsIgnoreCase(normalized)) {
                return pattern;
            }
        }
        throw new IllegalArgumentException("Unknown load pattern: " + token);
    }

    public static List<LoadPattern> simplePatterns() {
        return byComplexity(PatternComplexity.SIMPLE);
    }

    public static List<LoadPattern> advancedPatterns() {
        return byComplexity(PatternComplexity.ADVANCED);
    }

    /**
     * Patterns whose use cases mention {@code keyword}, ignoring case.
     */
    public static List<LoadPattern> forUseCase(String keyword) {
        String needle = keyword.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.useCases.stream().anyMatch(u -> u.toLowerCase(Locale.ROOT).contains(needle)))
                .toList();
    }

    private static List<LoadPattern> byComplexity(PatternComplexity complexity) {
        return Arrays.stream(values()).filter(p -> p.complexity == complexity).toList();
    }
}
