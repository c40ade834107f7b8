package com.processlens.core.ingest;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses time-column cells into naive UTC timestamps.
 *
 * <ul>
 * <li>Offset or zoned ISO timestamps ({@code Z}, {@code +08:00},
 * {@code [Europe/Berlin]}) are converted to UTC and made naive.</li>
 * <li>Local timestamps are taken as already being in the reference range.</li>
 * <li>A space may replace the {@code T} separator, and {@code /} may separate
 * date fields.</li>
 * <li>Plain numbers are epoch seconds, or epoch milliseconds when large.</li>
 * </ul>
 * Results are clamped to [{@link #LOWER_BOUND}, {@link #UPPER_BOUND}].
 *
 * @since 1.0.0
 */
public final class TimestampParser {

    public static final LocalDateTime LOWER_BOUND = LocalDateTime.of(1970, 1, 1, 0, 0);
    public static final LocalDateTime UPPER_BOUND = LocalDateTime.of(2100, 1, 1, 0, 0);

    private static final Pattern EPOCH = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern SLASH_DATE = Pattern.compile("^(\\d{4})/(\\d{1,2})/(\\d{1,2})");

    /** Epoch values at or above this are read as milliseconds. */
    private static final double MILLIS_CUTOFF = 1e11;

    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalStart()
            .appendLiteral('[')
            .parseCaseSensitive()
            .appendZoneRegionId()
            .appendLiteral(']')
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private TimestampParser() {
        // utility class — not instantiable
    }

    /**
     * @param raw cell text; may be {@code null}
     * @return the parsed timestamp, or empty if the cell is not a timestamp
     */
    public static Optional<LocalDateTime> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = normalize(raw.trim());

        if (EPOCH.matcher(text).matches()) {
            return parseEpoch(text);
        }
        try {
            TemporalAccessor parsed = FORMAT.parseBest(text,
                    ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return Optional.of(clamp(zoned.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime()));
            }
            if (parsed instanceof LocalDateTime local) {
                return Optional.of(clamp(local));
            }
            return Optional.of(clamp(((LocalDate) parsed).atStartOfDay()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Clamp into the supported range.
     *
     * @param time timestamp
     * @return {@code time} limited to [{@link #LOWER_BOUND}, {@link #UPPER_BOUND}]
     */
    public static LocalDateTime clamp(LocalDateTime time) {
        if (time.isBefore(LOWER_BOUND)) {
            return LOWER_BOUND;
        }
        if (time.isAfter(UPPER_BOUND)) {
            return UPPER_BOUND;
        }
        return time;
    }

    private static String normalize(String text) {
        Matcher m = SLASH_DATE.matcher(text);
        if (m.find()) {
            text = String.format("%s-%02d-%02d", m.group(1),
                    Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)))
                    + text.substring(m.end());
        }
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11).trim();
        }
        return text;
    }

    private static Optional<LocalDateTime> parseEpoch(String text) {
        try {
            double value = Double.parseDouble(text);
            long millis = Math.abs(value) >= MILLIS_CUTOFF
                    ? (long) value
                    : Math.round(value * 1000.0);
            return Optional.of(clamp(LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), ZoneOffset.UTC)));
        } catch (NumberFormatException | DateTimeException e) {
            return Optional.empty();
        }
    }
}
