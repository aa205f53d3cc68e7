package dev.devanks.energy.rollup.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;

class EnergyWindowTest {

    private static final ZoneId AMSTERDAM = ZoneId.of("Europe/Amsterdam");

    @Test
    @DisplayName("hourly: windows align to whole epoch hours and are labelled in local time")
    void hourly_alignsAndLabels() {
        var window = EnergyWindow.hourly(AMSTERDAM);
        long timestamp = 1_699_999_200L + 1234; // 2023-11-14T22:20:34Z

        assertThat(window.startOf(timestamp)).isEqualTo(1_699_999_200L);
        assertThat(window.endOf(1_699_999_200L)).isEqualTo(1_700_002_800L);
        assertThat(window.label(1_699_999_200L)).isEqualTo("23:00");
    }

    @Test
    @DisplayName("daily: windows start at local midnight")
    void daily_startsAtLocalMidnight() {
        var window = EnergyWindow.daily(AMSTERDAM);
        var localMidnight = ZonedDateTime.of(2023, 11, 15, 0, 0, 0, 0, AMSTERDAM).toEpochSecond();

        // 23:30 UTC on Nov 14 is already Nov 15 in Amsterdam
        assertThat(window.startOf(1_700_004_600L)).isEqualTo(localMidnight);
        assertThat(window.label(localMidnight)).isEqualTo("Nov 15");
    }

    @Test
    @DisplayName("daily: a DST change day is 23 hours long")
    void daily_dstDay() {
        var window = EnergyWindow.daily(AMSTERDAM);
        var start = ZonedDateTime.of(2024, 3, 31, 0, 0, 0, 0, AMSTERDAM).toEpochSecond();

        assertThat(window.endOf(start) - start).isEqualTo(23 * 3600);
    }

    @Test
    @DisplayName("daily: labels use English month abbreviations")
    void daily_labelFormat() {
        var window = EnergyWindow.daily(UTC);

        assertThat(window.label(window.startOf(1_704_067_200L))).isEqualTo("Jan 1");
    }

    @Test
    @DisplayName("hourly: labels keep ASCII digits whatever the default locale")
    void hourly_labelIgnoresDefaultLocale() {
        var previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
        try {
            var window = EnergyWindow.hourly(UTC);

            assertThat(window.label(1_699_999_200L)).isEqualTo("22:00");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
