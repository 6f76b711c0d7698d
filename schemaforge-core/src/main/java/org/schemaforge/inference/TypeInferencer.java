package org.schemaforge.inference;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.model.LogicalType;
import org.schemaforge.sample.ColumnSample;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks a {@link LogicalType} for a column from its sampled raw values.
 * <p>
 * Checks run in a fixed order on the non-null values: boolean, numeric, temporal, then
 * string. Numeric wins over temporal, so a column of years is INTEGER. DECIMAL is only inferred
 * for integers beyond 64 bits; fractional values are FLOAT, so re-inferring reformatted values
 * yields the same type.
 */
@Slf4j
public class TypeInferencer {

    private static final Set<String> BOOLEAN_TOKENS =
            Set.of("true", "false", "yes", "no", "y", "n", "1", "0", "t", "f");

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern SCIENTIFIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final BigInteger INT32_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT32_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger INT64_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger INT64_MAX = BigInteger.valueOf(Long.MAX_VALUE);
    private static final int MAX_DECIMAL_PRECISION = 38;

    private final double temporalMatchRatio;
    private final int textLengthThreshold;
    private final Set<String> nullMarkers;

    public TypeInferencer() {
        this(InferenceOptions.defaults());
    }

    public TypeInferencer(InferenceOptions options) {
        this.temporalMatchRatio = options.getTemporalMatchRatio();
        this.textLengthThreshold = options.getTextLengthThreshold();
        Set<String> markers = new HashSet<>();
        options.getNullMarkers().forEach(m -> markers.add(m.toLowerCase(Locale.ROOT)));
        this.nullMarkers = Set.copyOf(markers);
    }

    public InferredType inferColumn(ColumnSample column) {
        List<String> present = column.values().stream()
                .filter(v -> !isNull(v))
                .map(String::trim)
                .toList();
        boolean nullable = column.nullCount() > 0 || present.size() < column.size();

        InferredType inferred = infer(present, nullable);
        log.debug("Column '{}': {} (nullable={}) from {} non-null of {} sampled values",
                column.name(), inferred.logicalType(), inferred.nullable(), present.size(), column.size());
        return inferred;
    }

    public boolean isNull(String value) {
        return value == null || value.isBlank() || nullMarkers.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private InferredType infer(List<String> values, boolean nullable) {
        if (values.isEmpty()) {
            return InferredType.of(LogicalType.STRING, true);
        }
        if (isBoolean(values)) {
            return InferredType.of(LogicalType.BOOLEAN, nullable);
        }
        InferredType numeric = inferNumeric(values, nullable);
        if (numeric != null) {
            return numeric;
        }
        InferredType temporal = inferTemporal(values, nullable);
        if (temporal != null) {
            return temporal;
        }
        int maxLength = values.stream().mapToInt(String::length).max().orElse(0);
        return InferredType.of(maxLength <= textLengthThreshold ? LogicalType.STRING : LogicalType.TEXT, nullable);
    }

    private boolean isBoolean(List<String> values) {
        Set<String> distinct = new HashSet<>();
        for (String value : values) {
            String token = value.toLowerCase(Locale.ROOT);
            if (!BOOLEAN_TOKENS.contains(token)) {
                return false;
            }
            distinct.add(token);
        }
        return distinct.size() >= 2;
    }

    private InferredType inferNumeric(List<String> values, boolean nullable) {
        if (values.stream().allMatch(v -> INTEGER.matcher(v).matches())) {
            return inferInteger(values, nullable);
        }
        if (!values.stream().allMatch(v -> INTEGER.matcher(v).matches() || SCIENTIFIC.matcher(v).matches())) {
            return null;
        }
        return InferredType.of(LogicalType.FLOAT, nullable);
    }

    private InferredType inferInteger(List<String> values, boolean nullable) {
        LogicalType type = LogicalType.INTEGER;
        int maxDigits = 0;
        for (String value : values) {
            BigInteger parsed = new BigInteger(value);
            maxDigits = Math.max(maxDigits, parsed.abs().toString().length());
            if (parsed.compareTo(INT64_MIN) < 0 || parsed.compareTo(INT64_MAX) > 0) {
                type = LogicalType.DECIMAL;
            } else if (type == LogicalType.INTEGER
                    && (parsed.compareTo(INT32_MIN) < 0 || parsed.compareTo(INT32_MAX) > 0)) {
                type = LogicalType.BIGINT;
            }
        }
        if (type != LogicalType.DECIMAL) {
            return InferredType.of(type, nullable);
        }
        if (maxDigits > MAX_DECIMAL_PRECISION) {
            return InferredType.of(LogicalType.STRING, nullable);
        }
        return InferredType.decimal(nullable, maxDigits, 0);
    }

    private InferredType inferTemporal(List<String> values, boolean nullable) {
        TemporalPattern best = null;
        int bestMatches = 0;
        for (TemporalPattern pattern : TemporalPattern.ALL) {
            int matches = 0;
            for (String value : values) {
                if (pattern.matches(value)) {
                    matches++;
                }
            }
            if (matches > bestMatches) {
                best = pattern;
                bestMatches = matches;
            }
        }
        if (best == null || bestMatches < values.size() * temporalMatchRatio) {
            return null;
        }
        String timezone = best.isEpoch() ? "UTC" : null;
        return InferredType.temporal(best.type(), nullable, best.label(), timezone);
    }
}
