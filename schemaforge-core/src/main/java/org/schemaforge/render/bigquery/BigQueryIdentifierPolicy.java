package org.schemaforge.render.bigquery;

import org.schemaforge.render.IdentifierPolicy;
import org.schemaforge.render.SqlKeywords;

import java.util.Set;

class BigQueryIdentifierPolicy implements IdentifierPolicy {
    private static final Set<String> EXTRA_KEYWORDS = Set.of("ENUM", "HASH", "LOOKUP", "NEW", "NO", "PROTO",
            "QUALIFY", "STRUCT", "TABLESAMPLE", "TREAT", "UNNEST", "WITHIN");

    public int maxLength()          { return 300; }
    public String quote(String raw) { return "`" + raw.replace("`", "\\`") + "`"; }
    public boolean isKeyword(String raw) { return SqlKeywords.COMMON.contains(raw) || EXTRA_KEYWORDS.contains(raw); }
    public boolean alwaysQuote()    { return false; }
}
