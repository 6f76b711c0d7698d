package org.schemaforge.inference;

import org.schemaforge.model.LogicalType;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Date and time layouts recognised during inference, in tie-breaking order.
 */
enum TemporalPattern {

    ISO_DATE("yyyy-MM-dd", LogicalType.DATE, strict("uuuu-MM-dd")),
    ISO_DATE_TIME("yyyy-MM-dd'T'HH:mm:ss", LogicalType.TIMESTAMP, DateTimeFormatter.ISO_LOCAL_DATE_TIME),
    ISO_OFFSET_DATE_TIME("yyyy-MM-dd'T'HH:mm:ssXXX", LogicalType.TIMESTAMPTZ, DateTimeFormatter.ISO_OFFSET_DATE_TIME),
    SPACED_DATE_TIME("yyyy-MM-dd HH:mm:ss", LogicalType.TIMESTAMP, withFraction("uuuu-MM-dd HH:mm:ss")),
    SLASH_YEAR_FIRST("yyyy/MM/dd", LogicalType.DATE, strict("uuuu/MM/dd")),
    SLASH_US_DATE("MM/dd/yyyy", LogicalType.DATE, strict("MM/dd/uuuu")),
    SLASH_EU_DATE("dd/MM/yyyy", LogicalType.DATE, strict("dd/MM/uuuu")),
    SLASH_US_DATE_TIME("MM/dd/yyyy HH:mm:ss", LogicalType.TIMESTAMP, strict("MM/dd/uuuu HH:mm:ss")),
    DOT_DATE("dd.MM.yyyy", LogicalType.DATE, strict("dd.MM.uuuu")),
    DOT_DATE_TIME("dd.MM.yyyy HH:mm:ss", LogicalType.TIMESTAMP, strict("dd.MM.uuuu HH:mm:ss")),
    EPOCH_SECONDS("epoch_seconds", LogicalType.TIMESTAMP, Pattern.compile("\\d{9,10}")),
    EPOCH_MILLIS("epoch_millis", LogicalType.TIMESTAMP, Pattern.compile("\\d{12,13}"));

    static final List<TemporalPattern> ALL = List.of(values());

    private final String label;
    private final LogicalType type;
    private final DateTimeFormatter formatter;
    private final Pattern epochPattern;

    TemporalPattern(String label, LogicalType type, DateTimeFormatter formatter) {
        this.label = label;
        this.type = type;
        this.formatter = formatter;
        this.epochPattern = null;
    }

    TemporalPattern(String label, LogicalType type, Pattern epochPattern) {
        this.label = label;
        this.type = type;
        this.formatter = null;
        this.epochPattern = epochPattern;
    }

    String label() {
        return label;
    }

    LogicalType type() {
        return type;
    }

    boolean isEpoch() {
        return epochPattern != null;
    }

    boolean matches(String value) {
        if (epochPattern != null) {
            return epochPattern.matcher(value).matches();
        }
        try {
            formatter.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter withFraction(String pattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern(pattern)
                .optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                .optionalEnd()
                .toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
