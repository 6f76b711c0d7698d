package org.schemaforge.inference;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns source column headers into warehouse-safe snake_case identifiers.
 * <p>
 * Examples:
 * <ul>
 *   <li>"User ID" → "user_id"</li>
 *   <li>"orderDate" → "order_date"</li>
 *   <li>"HTTPStatus" → "http_status"</li>
 *   <li>"2023 Revenue ($)" → "_2023_revenue"</li>
 * </ul>
 */
public class ColumnNameStandardizer {

    public String standardize(String rawName) {
        if (rawName == null) {
            return "";
        }
        String snake = splitCamelCase(rawName.trim()).toLowerCase(Locale.ROOT);
        String collapsed = snake.replaceAll("[^a-z0-9]+", "_");
        String trimmed = collapsed.replaceAll("^_+|_+$", "");
        if (!trimmed.isEmpty() && Character.isDigit(trimmed.charAt(0))) {
            return "_" + trimmed;
        }
        return trimmed;
    }

    /**
     * Standardizes a whole header row. Empty results become {@code column_<n>} (1-based) and
     * collisions get a numeric suffix, so the output is unique ignoring case.
     */
    public List<String> standardizeAll(List<String> rawNames) {
        List<String> result = new ArrayList<>(rawNames.size());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < rawNames.size(); i++) {
            String name = standardize(rawNames.get(i));
            if (name.isEmpty()) {
                name = "column_" + (i + 1);
            }
            String candidate = name;
            int suffix = 2;
            while (!used.add(candidate)) {
                candidate = name + "_" + suffix++;
            }
            result.add(candidate);
        }
        return result;
    }

    private String splitCamelCase(String name) {
        StringBuilder result = new StringBuilder();
        char[] chars = name.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char current = chars[i];
            if (Character.isUpperCase(current) && i > 0 && shouldInsertUnderscore(chars, i)) {
                result.append('_');
            }
            result.append(current);
        }
        return result.toString();
    }

    // "orderDate" -> order_Date, "HTTPServer" -> HTTP_Server, "get2HTTP" -> get2_HTTP
    private boolean shouldInsertUnderscore(char[] chars, int index) {
        char prev = chars[index - 1];
        if (Character.isLowerCase(prev) || Character.isDigit(prev)) {
            return true;
        }
        return Character.isUpperCase(prev)
                && index < chars.length - 1
                && Character.isLowerCase(chars[index + 1]);
    }
}
