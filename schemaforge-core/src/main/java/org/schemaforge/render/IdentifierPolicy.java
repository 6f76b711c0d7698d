package org.schemaforge.render;

import java.util.Locale;
import java.util.regex.Pattern;

public interface IdentifierPolicy {

    Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    int maxLength();                       // 63, 128, 300
    String quote(String raw);              // `foo`, "foo", [foo]
    boolean isKeyword(String raw);
    boolean alwaysQuote();

    /**
     * Quotes only when the platform needs it, unless the platform always quotes.
     */
    default String apply(String raw) {
        if (alwaysQuote() || !PLAIN_IDENTIFIER.matcher(raw).matches() || isKeyword(raw.toUpperCase(Locale.ROOT))) {
            return quote(raw);
        }
        return raw;
    }
}
