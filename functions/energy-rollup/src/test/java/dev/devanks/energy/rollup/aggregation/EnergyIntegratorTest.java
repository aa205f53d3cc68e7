package dev.devanks.energy.rollup.aggregation;

import dev.devanks.energy.rollup.model.AggregatedDataPoint;
import dev.devanks.energy.rollup.model.EnergyReading;
import dev.devanks.energy.rollup.model.PowerSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EnergyIntegratorTest {

    private static final long HOUR0 = 1_699_999_200L; // 2023-11-14T22:00:00Z

    private static EnergyReading home(long timestamp, double watts) {
        return EnergyReading.builder().timestamp(timestamp).home(watts).build();
    }

    @Test
    @DisplayName("integrate: constant power over an hour is watts / 1000 kWh")
    void integrate_constantPower() {
        var samples = List.of(new PowerSample(0, 1500), new PowerSample(1800, 1500), new PowerSample(3600, 1500));

        assertThat(EnergyIntegrator.integrate(samples)).isCloseTo(1.5, within(1e-12));
    }

    @Test
    @DisplayName("integrate: fewer than two samples carry no energy")
    void integrate_tooFewSamples_zero() {
        assertThat(EnergyIntegrator.integrate(List.of())).isZero();
        assertThat(EnergyIntegrator.integrate(List.of(new PowerSample(0, 5000)))).isZero();
    }

    @Test
    @DisplayName("groupByFixedWindow: one hour of samples forms a single point")
    void groupByFixedWindow_singleHour() {
        // Arrange
        var readings = List.of(home(HOUR0, 1000), home(HOUR0 + 600, 2000), home(HOUR0 + 1200, 1500));

        // Act
        List<AggregatedDataPoint> points = EnergyIntegrator.groupByFixedWindow(readings, EnergyWindow.hourly(UTC),
                EnergyReading::getHome);

        // Assert
        assertThat(points).hasSize(1);
        assertThat(points.get(0).getKwh()).isCloseTo(0.5833, within(1e-4));
        assertThat(points.get(0).getLabel()).isEqualTo("22:00");
        assertThat(points.get(0).getTimestamp()).isEqualTo(HOUR0);
    }

    @Test
    @DisplayName("groupByFixedWindow: windows with a single sample are dropped and no energy crosses windows")
    void groupByFixedWindow_dropsSparseWindows() {
        // Arrange: unsorted input, the second hour holds only one sample
        var readings = List.of(home(HOUR0 + 600, 1000), home(HOUR0 + 3700, 800), home(HOUR0, 1000));

        // Act
        var points = EnergyIntegrator.groupByFixedWindow(readings, EnergyWindow.hourly(UTC), EnergyReading::getHome);

        // Assert
        assertThat(points).extracting(AggregatedDataPoint::getLabel).containsExactly("22:00");
        assertThat(points.get(0).getKwh()).isCloseTo(1000.0 * 600 / 3_600_000, within(1e-12));
    }

    @Test
    @DisplayName("groupByFixedWindow: the filter applies before grouping")
    void groupByFixedWindow_filtersSamples() {
        // Arrange
        var readings = List.of(home(HOUR0, 1000), home(HOUR0 + 600, -50), home(HOUR0 + 1200, 1000));

        // Act
        var points = EnergyIntegrator.groupByFixedWindow(readings, EnergyWindow.hourly(UTC),
                EnergyReading::getHome, watts -> watts > 0);

        // Assert
        assertThat(points.get(0).getKwh()).isCloseTo(1000.0 * 1200 / 3_600_000, within(1e-12));
    }

    @Test
    @DisplayName("totalEnergy: integrates across window boundaries as one run")
    void totalEnergy_singleRun() {
        var readings = List.of(home(HOUR0 + 3000, 1200), home(HOUR0 + 4200, 1200));

        assertThat(EnergyIntegrator.totalEnergy(readings, EnergyReading::getHome)).isCloseTo(0.4, within(1e-12));
        assertThat(EnergyIntegrator.groupByFixedWindow(readings, EnergyWindow.hourly(UTC), EnergyReading::getHome)).isEmpty();
    }

    @Test
    @DisplayName("distinctByTimestamp: sorts and keeps the last reading per timestamp")
    void distinctByTimestamp_lastWins() {
        var readings = List.of(home(20, 1), home(10, 2), home(20, 3));

        assertThat(EnergyIntegrator.distinctByTimestamp(readings))
                .extracting(EnergyReading::getHome)
                .containsExactly(2.0, 3.0);
    }
}
