package org.schemaforge.render.sqlserver;

import org.schemaforge.render.IdentifierPolicy;
import org.schemaforge.render.SqlKeywords;

class SqlServerIdentifierPolicy implements IdentifierPolicy {
    public int maxLength()          { return 128; }
    public String quote(String raw) { return "[" + raw.replace("]", "]]") + "]"; }
    public boolean isKeyword(String raw) { return SqlKeywords.COMMON.contains(raw); }
    public boolean alwaysQuote()    { return true; }
}
