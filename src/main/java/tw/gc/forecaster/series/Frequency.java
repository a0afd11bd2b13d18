package tw.gc.forecaster.series;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Nominal sampling frequency of a series, addressed by the short offset codes
 * used in configuration ({@code "D"}, {@code "H"}, ...).
 */
public enum Frequency {
    MINUTELY("min", ChronoUnit.MINUTES, 1),
    HOURLY("H", ChronoUnit.HOURS, 1),
    DAILY("D", ChronoUnit.DAYS, 1),
    WEEKLY("W", ChronoUnit.WEEKS, 1),
    MONTHLY("M", ChronoUnit.MONTHS, 1),
    QUARTERLY("Q", ChronoUnit.MONTHS, 3),
    YEARLY("Y", ChronoUnit.YEARS, 1);

    private final String code;
    private final ChronoUnit unit;
    private final int unitsPerStep;

    Frequency(String code, ChronoUnit unit, int unitsPerStep) {
        this.code = code;
        this.unit = unit;
        this.unitsPerStep = unitsPerStep;
    }

    public String code() {
        return code;
    }

    /**
     * Timestamp {@code steps} periods after {@code from}.
     */
    public LocalDateTime plus(LocalDateTime from, long steps) {
        return from.plus(steps * unitsPerStep, unit);
    }

    /**
     * Generates {@code count} timestamps, the first one a single period after
     * {@code last}.
     */
    public List<LocalDateTime> after(LocalDateTime last, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got: " + count);
        }
        List<LocalDateTime> result = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            result.add(plus(last, i));
        }
        return result;
    }

    /**
     * Resolves a frequency from its code (case-sensitive for {@code M}/{@code min}
     * ambiguity) or its enum name.
     */
    public static Frequency fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Frequency code cannot be null or blank");
        }
        String trimmed = code.trim();
        for (Frequency frequency : values()) {
            if (frequency.code.equals(trimmed) || frequency.name().equalsIgnoreCase(trimmed)) {
                return frequency;
            }
        }
        for (Frequency frequency : values()) {
            if (frequency.code.equalsIgnoreCase(trimmed)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown frequency code '%s', expected one of %s"
            .formatted(code, Arrays.stream(values()).map(Frequency::code).toList()));
    }
}
