package work.lcod.lookup.shared;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Small helper to parse user-friendly durations (e.g. {@code 30s}, {@code 2m}, {@code 5h}, {@code 1d})
 * as well as ISO-8601 ({@code PT30S}). A bare number is taken as milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        if (trimmed.startsWith("p") || trimmed.startsWith("-p")) {
            try {
                return Optional.of(Duration.parse(raw.trim()));
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("invalid ISO-8601 duration: " + raw, ex);
            }
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
        } else if (trimmed.endsWith("d")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 86_400_000L;
        }
        try {
            long value = Long.parseLong(trimmed);
            return Optional.of(Duration.ofMillis(Math.multiplyExact(value, multiplier)));
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new IllegalArgumentException("invalid duration: " + raw, ex);
        }
    }
}
