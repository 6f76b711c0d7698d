package org.schemaforge.render.postgresql;

import org.schemaforge.render.IdentifierPolicy;
import org.schemaforge.render.SqlKeywords;

class PostgreSqlIdentifierPolicy implements IdentifierPolicy {
    public int maxLength()          { return 63; }
    public String quote(String raw) { return "\"" + raw.replace("\"", "\"\"") + "\""; }
    public boolean isKeyword(String raw) { return SqlKeywords.COMMON.contains(raw); }
    public boolean alwaysQuote()    { return true; }
}
