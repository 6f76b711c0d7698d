package org.schemaforge.render.redshift;

import org.schemaforge.render.IdentifierPolicy;
import org.schemaforge.render.SqlKeywords;

import java.util.Set;

class RedshiftIdentifierPolicy implements IdentifierPolicy {
    private static final Set<String> EXTRA_KEYWORDS = Set.of("DELTA", "DISTKEY", "DISTSTYLE", "ENCODE",
            "INTERLEAVED", "OFFLINE", "OID", "PERCENT", "SORTKEY", "TAG", "TIMESTAMP", "WALLET");

    public int maxLength()          { return 127; }
    public String quote(String raw) { return "\"" + raw.replace("\"", "\"\"") + "\""; }
    public boolean isKeyword(String raw) { return SqlKeywords.COMMON.contains(raw) || EXTRA_KEYWORDS.contains(raw); }
    public boolean alwaysQuote()    { return false; }
}
