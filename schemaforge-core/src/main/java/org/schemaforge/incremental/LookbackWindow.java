package org.schemaforge.incremental;

import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Amount subtracted from the target's high-water mark so late rows are picked up again,
 * written as {@code "2 hours"}, {@code "30 minutes"} or {@code "1 day"}.
 */
public record LookbackWindow(long amount, ChronoUnit unit) {

    private static final Pattern FORMAT = Pattern.compile("\\s*(\\d+)\\s*([a-zA-Z]+)\\s*");

    private static final Map<String, ChronoUnit> UNITS = Map.ofEntries(
            entry("second", ChronoUnit.SECONDS), entry("seconds", ChronoUnit.SECONDS), entry("s", ChronoUnit.SECONDS),
            entry("minute", ChronoUnit.MINUTES), entry("minutes", ChronoUnit.MINUTES), entry("m", ChronoUnit.MINUTES),
            entry("hour", ChronoUnit.HOURS), entry("hours", ChronoUnit.HOURS), entry("h", ChronoUnit.HOURS),
            entry("day", ChronoUnit.DAYS), entry("days", ChronoUnit.DAYS), entry("d", ChronoUnit.DAYS));

    public LookbackWindow {
        if (amount <= 0) {
            throw new IllegalArgumentException("Lookback amount must be positive, got " + amount);
        }
        if (!UNITS.containsValue(unit)) {
            throw new IllegalArgumentException("Unsupported lookback unit: " + unit);
        }
    }

    public static LookbackWindow parse(String text) {
        Matcher matcher = FORMAT.matcher(text == null ? "" : text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid lookback window '" + text + "', expected e.g. '2 hours'");
        }
        ChronoUnit unit = UNITS.get(matcher.group(2).toLowerCase(Locale.ROOT));
        if (unit == null) {
            throw new IllegalArgumentException("Unknown lookback unit '" + matcher.group(2) + "'");
        }
        return new LookbackWindow(Long.parseLong(matcher.group(1)), unit);
    }

    /**
     * Singular unit keyword as SQL interval syntax spells it: SECOND, MINUTE, HOUR, DAY.
     */
    public String sqlUnit() {
        String plural = unit.name();
        return plural.substring(0, plural.length() - 1);
    }

    @Override
    public String toString() {
        String word = sqlUnit().toLowerCase(Locale.ROOT);
        return amount + " " + (amount == 1 ? word : word + "s");
    }
}
