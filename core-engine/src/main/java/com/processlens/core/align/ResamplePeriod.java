package com.processlens.core.align;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed resampling period parsed from strings such as {@code 1S}, {@code 5T},
 * {@code 15min} or {@code 1H}.
 *
 * <p>
 * Units: {@code L}/{@code ms} (milliseconds), {@code S}/{@code s}/{@code sec}
 * (seconds), {@code T}/{@code min} (minutes), {@code H}/{@code h} (hours),
 * {@code D}/{@code d} (days). A missing count means 1.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResamplePeriod {

    private static final Pattern FORMAT = Pattern.compile("^\\s*(\\d+)?\\s*([A-Za-z]+)\\s*$");

    private final String text;
    private final Duration duration;

    private ResamplePeriod(String text, Duration duration) {
        this.text = text;
        this.duration = duration;
    }

    /**
     * @param text period string; must not be {@code null}
     * @return parsed period
     * @throws IllegalArgumentException if the string is malformed or the
     *                                  period is not positive
     */
    public static ResamplePeriod parse(String text) {
        Objects.requireNonNull(text, "period must not be null");
        Matcher m = FORMAT.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid resample period: '" + text + "'");
        }
        long count = m.group(1) == null ? 1 : Long.parseLong(m.group(1));
        if (count <= 0) {
            throw new IllegalArgumentException("Resample period must be positive: '" + text + "'");
        }
        Duration unit = unitOf(m.group(2), text);
        return new ResamplePeriod(text.trim(), unit.multipliedBy(count));
    }

    public static ResamplePeriod of(Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Resample period must be positive: " + duration);
        }
        return new ResamplePeriod(duration.toString(), duration);
    }

    private static Duration unitOf(String unit, String text) {
        // exact-case aliases first: 'S' is seconds, 'ms' is milliseconds
        switch (unit) {
            case "L", "ms" -> {
                return Duration.ofMillis(1);
            }
            case "S", "s", "sec" -> {
                return Duration.ofSeconds(1);
            }
            case "T", "min" -> {
                return Duration.ofMinutes(1);
            }
            default -> {
                // long forms below
            }
        }
        return switch (unit.toLowerCase(Locale.ROOT)) {
            case "h", "hour", "hours" -> Duration.ofHours(1);
            case "d", "day", "days" -> Duration.ofDays(1);
            case "min", "minute", "minutes" -> Duration.ofMinutes(1);
            case "second", "seconds" -> Duration.ofSeconds(1);
            default -> throw new IllegalArgumentException(
                    "Unknown resample unit '" + unit + "' in '" + text
                            + "'. Supported: L/ms, S, T/min, H, D");
        };
    }

    public Duration getDuration() {
        return duration;
    }

    public long toMillis() {
        return duration.toMillis();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResamplePeriod that))
            return false;
        return duration.equals(that.duration);
    }

    @Override
    public int hashCode() {
        return duration.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
