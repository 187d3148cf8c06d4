package work.lcod.flow.shared;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Small helper to parse user-friendly durations: compact forms ({@code 30s}, {@code 2m}, {@code 5h},
 * {@code 1500} meaning milliseconds) and worded forms ({@code 5 minutes}, {@code 30 seconds}).
 */
public final class DurationParser {
    private static final Map<String, Long> WORD_UNITS = Map.ofEntries(
        Map.entry("millisecond", 1L),
        Map.entry("milliseconds", 1L),
        Map.entry("second", 1_000L),
        Map.entry("seconds", 1_000L),
        Map.entry("minute", 60_000L),
        Map.entry("minutes", 60_000L),
        Map.entry("hour", 3_600_000L),
        Map.entry("hours", 3_600_000L)
    );

    private DurationParser() {}

    /**
     * @throws IllegalArgumentException when {@code raw} is neither empty nor a duration
     */
    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        int space = trimmed.indexOf(' ');
        if (space > 0) {
            String unit = trimmed.substring(space + 1).trim();
            Long multiplier = WORD_UNITS.get(unit);
            if (multiplier == null) {
                throw new IllegalArgumentException("Unknown duration unit: " + unit);
            }
            return Optional.of(millis(trimmed.substring(0, space), multiplier));
        }
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        return Optional.of(millis(trimmed, multiplier));
    }

    /** Seconds as written in a {@code timeout: 30} config entry. */
    public static Duration ofSeconds(double seconds) {
        try {
            return Duration.ofMillis(BigDecimal.valueOf(seconds).multiply(BigDecimal.valueOf(1_000L))
                .setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException | NumberFormatException ex) {
            throw new IllegalArgumentException("Duration is too long: " + seconds + " seconds", ex);
        }
    }

    private static Duration millis(String amount, long multiplier) {
        var value = new BigDecimal(amount.trim());
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Duration can't be negative: " + amount);
        }
        try {
            return Duration.ofMillis(value.multiply(BigDecimal.valueOf(multiplier)).setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Duration is too long: " + amount, ex);
        }
    }
}
