package org.schemaforge.render;

import java.util.Set;

/**
 * Reserved words common to the supported dialects. Identifiers matching one are quoted.
 */
public final class SqlKeywords {

    public static final Set<String> COMMON = Set.of(
            "ALL", "AND", "ANY", "ARRAY", "AS", "ASC", "BETWEEN", "BY", "CASE", "CAST", "CHECK", "COLUMN",
            "CONSTRAINT", "CREATE", "CROSS", "CURRENT", "CURRENT_DATE", "CURRENT_TIME", "CURRENT_TIMESTAMP",
            "DEFAULT", "DELETE", "DESC", "DISTINCT", "DROP", "ELSE", "END", "EXCEPT", "EXISTS", "FALSE",
            "FETCH", "FOR", "FOREIGN", "FROM", "FULL", "GRANT", "GROUP", "HAVING", "IN", "INNER", "INSERT",
            "INTERSECT", "INTERVAL", "INTO", "IS", "JOIN", "LEFT", "LIKE", "LIMIT", "MERGE", "NATURAL", "NOT",
            "NULL", "OF", "OFFSET", "ON", "OR", "ORDER", "OUTER", "OVER", "PARTITION", "PRIMARY", "RANGE",
            "REFERENCES", "RIGHT", "ROW", "ROWS", "SELECT", "SET", "SOME", "TABLE", "THEN", "TO", "TRUE",
            "UNION", "UNIQUE", "UPDATE", "USER", "USING", "VALUES", "WHEN", "WHERE", "WINDOW", "WITH");

    private SqlKeywords() {
    }
}
