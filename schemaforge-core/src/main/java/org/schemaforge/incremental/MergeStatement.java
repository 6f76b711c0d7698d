package org.schemaforge.incremental;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles a MERGE statement clause by clause:
 * <pre>
 * MERGE INTO t AS target
 * USING s AS source
 * ON target.id = source.id
 * WHEN MATCHED THEN
 *   UPDATE SET name = source.name
 * WHEN NOT MATCHED THEN
 *   INSERT (id, name)
 *   VALUES (source.id, source.name)
 * </pre>
 */
public class MergeStatement {
    private final String header;
    private final List<String> clauses = new ArrayList<>();

    private MergeStatement(String header) {
        this.header = header;
    }

    public static MergeStatement into(String target, String targetAlias, String source, String sourceAlias, String on) {
        return new MergeStatement("MERGE INTO " + target + " AS " + targetAlias
                + "\nUSING " + source + " AS " + sourceAlias
                + "\nON " + on);
    }

    public MergeStatement whenMatchedUpdate(String condition, List<String> assignments) {
        clauses.add(when("WHEN MATCHED", condition) + "\n  UPDATE SET " + String.join(",\n    ", assignments));
        return this;
    }

    public MergeStatement whenMatchedDelete(String condition) {
        clauses.add(when("WHEN MATCHED", condition) + "\n  DELETE");
        return this;
    }

    /**
     * @param notMatched {@code WHEN NOT MATCHED} or a dialect spelling such as {@code WHEN NOT MATCHED BY TARGET}
     */
    public MergeStatement whenNotMatchedInsert(String notMatched, String condition, List<String> columns, List<String> values) {
        clauses.add(when(notMatched, condition)
                + "\n  INSERT (" + String.join(", ", columns) + ")"
                + "\n  VALUES (" + String.join(", ", values) + ")");
        return this;
    }

    public boolean hasClauses() {
        return !clauses.isEmpty();
    }

    public String build() {
        if (clauses.isEmpty()) {
            throw new IllegalStateException("MERGE needs at least one WHEN clause");
        }
        return header + "\n" + String.join("\n", clauses);
    }

    private static String when(String keyword, String condition) {
        return keyword + (condition == null ? "" : " AND " + condition) + " THEN";
    }
}
