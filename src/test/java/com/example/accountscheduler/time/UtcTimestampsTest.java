package com.example.accountscheduler.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UtcTimestamps Tests")
class UtcTimestampsTest {

    @Nested
    @DisplayName("parse")
    class ParseTests {

        @Test
        @DisplayName("Operator format is interpreted as UTC")
        void operatorFormatIsUtc() {
            assertThat(UtcTimestamps.parse("2026-01-05 04:52")).isEqualTo(Instant.parse("2026-01-05T04:52:00Z"));
        }

        @Test
        @DisplayName("Surrounding whitespace is ignored")
        void whitespaceIsIgnored() {
            assertThat(UtcTimestamps.parse("  2026-01-05 04:52 ")).isEqualTo(Instant.parse("2026-01-05T04:52:00Z"));
        }

        @Test
        @DisplayName("ISO-8601 offsets are normalized to UTC")
        void isoOffsetIsNormalized() {
            assertThat(UtcTimestamps.parse("2026-01-05T06:52:00+02:00")).isEqualTo(Instant.parse("2026-01-05T04:52:00Z"));
            assertThat(UtcTimestamps.parse("2026-01-05T04:52:00Z")).isEqualTo(Instant.parse("2026-01-05T04:52:00Z"));
        }

        @Test
        @DisplayName("ISO-8601 without offset is rejected, not coerced")
        void naiveIsoIsRejected() {
            assertThatThrownBy(() -> UtcTimestamps.parse("2026-01-05T04:52"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("no timezone offset");
        }

        @ParameterizedTest
        @ValueSource(strings = {"2026-02-30 10:00", "2026-01-05 24:10", "2026-13-01 00:00"})
        @DisplayName("Impossible dates and times are rejected")
        void impossibleValuesAreRejected(String value) {
            assertThatThrownBy(() -> UtcTimestamps.parse(value))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Invalid date or time");
        }

        @ParameterizedTest
        @ValueSource(strings = {"tomorrow", "05/01/2026 04:52", "2026-01-05"})
        @DisplayName("Malformed input is rejected")
        void malformedInputIsRejected(String value) {
            assertThatThrownBy(() -> UtcTimestamps.parse(value))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unparseable");
        }

        @Test
        @DisplayName("Blank input is rejected")
        void blankIsRejected() {
            assertThatThrownBy(() -> UtcTimestamps.parse(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Timestamp is required");
        }
    }

    @Test
    @DisplayName("format renders UTC with an explicit marker")
    void formatRendersUtc() {
        assertThat(UtcTimestamps.format(Instant.parse("2026-01-05T04:52:00Z"))).isEqualTo("2026-01-05 04:52:00 UTC");
        assertThat(UtcTimestamps.format(null)).isEqualTo("-");
    }
}
