package com.processlens.core.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ShortNames}.
 */
class ShortNamesTest {

    @Test
    @DisplayName("Should use the text before the bracket")
    void shouldUseTextBeforeBracket() {
        assertThat(ShortNames.shortName("Flow rate (m3/h)")).isEqualTo("Flow rate");
        assertThat(ShortNames.units("Flow rate (m3/h)")).isEqualTo("m3/h");
    }

    @Test
    @DisplayName("Should fall back to the bracket content when nothing precedes it")
    void shouldUseBracketContent() {
        assertThat(ShortNames.shortName("(TIC-101)")).isEqualTo("TIC-101");
    }

    @Test
    @DisplayName("Should truncate long names without brackets")
    void shouldTruncate() {
        assertThat(ShortNames.shortName("reactor_outlet_temperature")).isEqualTo("reactor_outlet_...");
        assertThat(ShortNames.shortName("short")).isEqualTo("short");
        assertThat(ShortNames.shortName("exactly15chars_")).isEqualTo("exactly15chars_");
    }

    @Test
    @DisplayName("Should report no units without brackets")
    void shouldHaveNoUnits() {
        assertThat(ShortNames.units("pressure")).isNull();
        assertThat(ShortNames.units("pressure ()")).isNull();
    }
}
