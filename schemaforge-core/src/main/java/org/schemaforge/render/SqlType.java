package org.schemaforge.render;

import org.schemaforge.model.ColumnDefinition;

/**
 * Physical type template of one platform.
 *
 * @param bare          rendered when the column carries no parameters (or exceeds {@code lengthCap})
 * @param parameterized {@code String.format} template taking a length, or a precision and scale
 * @param defaultLength length used when a length-typed column has none, may be null
 * @param lengthCap     largest length the parameterized form accepts, may be null
 */
public record SqlType(String bare, String parameterized, Kind kind, Integer defaultLength, Integer lengthCap) {

    public enum Kind { FIXED, LENGTH, PRECISION_SCALE }

    public static SqlType fixed(String name) {
        return new SqlType(name, null, Kind.FIXED, null, null);
    }

    public static SqlType length(String template, String bare, Integer defaultLength, Integer lengthCap) {
        return new SqlType(bare, template, Kind.LENGTH, defaultLength, lengthCap);
    }

    public static SqlType decimal(String template, String bare) {
        return new SqlType(bare, template, Kind.PRECISION_SCALE, null, null);
    }

    public String format(ColumnDefinition column) {
        return switch (kind) {
            case FIXED -> bare;
            case LENGTH -> formatLength(column.getMaxLength());
            case PRECISION_SCALE -> column.getPrecision() == null
                    ? bare
                    : String.format(parameterized, column.getPrecision(), column.getScale() == null ? 0 : column.getScale());
        };
    }

    private String formatLength(Integer maxLength) {
        Integer length = maxLength != null ? maxLength : defaultLength;
        if (length == null || (lengthCap != null && length > lengthCap)) {
            return bare;
        }
        return String.format(parameterized, length);
    }
}
