package org.schemaforge.incremental;

import lombok.Builder;
import lombok.Value;
import org.schemaforge.render.Platform;

import java.util.ArrayList;
import java.util.List;

/**
 * Generated load for one table: staging DDL plus the ordered statements of the pattern.
 * Statements carry no trailing semicolon; {@link #toSql()} adds them.
 */
@Value
@Builder
public class IncrementalScript {

    Platform platform;
    LoadPattern pattern;
    String targetTable;
    String stagingTable;
    String stagingDdl;
    /** Declarations that must precede the transaction, e.g. variables. */
    @Builder.Default
    List<String> preamble = List.of();
    @Builder.Default
    List<String> statements = List.of();
    /** Null when the load runs outside a transaction. */
    String beginTransaction;
    String commitTransaction;

    public boolean isTransactional() {
        return beginTransaction != null;
    }

    public String toSql() {
        List<String> parts = new ArrayList<>(preamble);
        if (isTransactional()) {
            parts.add(beginTransaction);
        }
        parts.addAll(statements);
        if (isTransactional()) {
            parts.add(commitTransaction);
        }
        return String.join(";\n\n", parts) + ";\n";
    }
}
