package org.schemaforge.render.snowflake;

import org.schemaforge.render.IdentifierPolicy;
import org.schemaforge.render.SqlKeywords;

import java.util.Set;

class SnowflakeIdentifierPolicy implements IdentifierPolicy {
    private static final Set<String> EXTRA_KEYWORDS = Set.of("ACCOUNT", "CONNECTION", "DATABASE", "GSCLUSTER",
            "ILIKE", "INCREMENT", "ISSUE", "LATERAL", "MINUS", "ORGANIZATION", "QUALIFY", "REGEXP", "RLIKE",
            "SAMPLE", "SCHEMA", "SYSDATE", "TRIGGER", "TRY_CAST", "VIEW");

    public int maxLength()          { return 255; }
    public String quote(String raw) { return "\"" + raw.replace("\"", "\"\"") + "\""; }
    public boolean isKeyword(String raw) { return SqlKeywords.COMMON.contains(raw) || EXTRA_KEYWORDS.contains(raw); }
    public boolean alwaysQuote()    { return false; }
}
