package work.pooled.pipeline.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses task resource limits written the way workflow configs spell them
 * ({@code 30s}, {@code 2m}, {@code 2.h}, {@code 1 h}, {@code 90 min}).
 */
public final class ResourceParser {
    private ResourceParser() {}

    public static Optional<Duration> parseDuration(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        int split = 0;
        while (split < trimmed.length() && (Character.isDigit(trimmed.charAt(split)))) {
            split++;
        }
        if (split == 0) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        long value = Long.parseLong(trimmed.substring(0, split));
        String unit = trimmed.substring(split);
        if (unit.startsWith(".")) {
            unit = unit.substring(1);
        }
        return Optional.of(switch (unit) {
            case "", "ms" -> Duration.ofMillis(value);
            case "s", "sec" -> Duration.ofSeconds(value);
            case "m", "min" -> Duration.ofMinutes(value);
            case "h", "hour", "hours" -> Duration.ofHours(value);
            case "d", "day", "days" -> Duration.ofDays(value);
            default -> throw new IllegalArgumentException("Unsupported duration unit '" + unit + "' in " + raw);
        });
    }
}
