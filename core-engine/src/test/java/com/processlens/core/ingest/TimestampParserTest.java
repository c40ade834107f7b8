package com.processlens.core.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TimestampParser}.
 */
class TimestampParserTest {

    private static final LocalDateTime NOON = LocalDateTime.of(2024, 3, 1, 12, 30);

    @ParameterizedTest
    @ValueSource(strings = { "2024-03-01T12:30:00", "2024-03-01 12:30:00", "2024/3/1 12:30:00", " 2024-03-01T12:30 " })
    @DisplayName("Should parse local timestamps in common layouts")
    void shouldParseLocalLayouts(String text) {
        assertThat(TimestampParser.parse(text)).contains(NOON);
    }

    @Test
    @DisplayName("Should convert offset timestamps to naive UTC")
    void shouldNormalizeOffsets() {
        assertThat(TimestampParser.parse("2024-03-01T14:30:00+02:00")).contains(NOON);
        assertThat(TimestampParser.parse("2024-03-01T12:30:00Z")).contains(NOON);
    }

    @Test
    @DisplayName("Should parse date-only values as midnight")
    void shouldParseDates() {
        assertThat(TimestampParser.parse("2024-03-01")).contains(LocalDateTime.of(2024, 3, 1, 0, 0));
    }

    @Test
    @DisplayName("Should read epoch seconds and epoch milliseconds")
    void shouldParseEpoch() {
        LocalDateTime expected = LocalDateTime.of(2023, 11, 14, 22, 13, 20);

        assertThat(TimestampParser.parse("1700000000")).contains(expected);
        assertThat(TimestampParser.parse("1700000000000")).contains(expected);
    }

    @Test
    @DisplayName("Should keep fractional seconds")
    void shouldKeepFractions() {
        assertThat(TimestampParser.parse("2024-03-01T12:30:00.250"))
                .contains(NOON.plusNanos(250_000_000));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "   ", "not a time", "2024-13-45", "12:30" })
    @DisplayName("Should return empty for values that are not timestamps")
    void shouldRejectGarbage(String text) {
        assertThat(TimestampParser.parse(text)).isEmpty();
    }

    @Test
    @DisplayName("Should return empty for null")
    void shouldRejectNull() {
        assertThat(TimestampParser.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("Should clamp timestamps outside the supported range")
    void shouldClamp() {
        assertThat(TimestampParser.parse("1900-01-01T00:00:00")).contains(TimestampParser.LOWER_BOUND);
        assertThat(TimestampParser.parse("2300-06-01T00:00:00")).contains(TimestampParser.UPPER_BOUND);
    }
}
