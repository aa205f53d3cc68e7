package dev.devanks.energy.rollup.aggregation;

import dev.devanks.energy.rollup.model.AggregatedDataPoint;
import dev.devanks.energy.rollup.model.EnergyReading;
import dev.devanks.energy.rollup.model.PowerSample;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.DoublePredicate;
import java.util.function.ToDoubleFunction;

/**
 * Trapezoidal energy integration over power samples.
 * <p>
 * Power is assumed to move linearly between two consecutive samples, so every pair contributes
 * {@code avg(p1, p2) * (t2 - t1)} watt-seconds. This is also the only assumption that holds for a
 * minute bucket that keeps nothing but its first and last sample. Both the minute rollup job and
 * the range queries integrate through this class.
 */
public final class EnergyIntegrator {

    private static final DoublePredicate ALL = value -> true;
    private static final double SECONDS_PER_HOUR = 3600;
    private static final double WATTS_PER_KILOWATT = 1000;

    private EnergyIntegrator() {
    }

    /**
     * Integrates samples already sorted by timestamp.
     *
     * @param samples the samples, ascending by timestamp.
     * @return the energy in kWh, or 0 when fewer than two samples are given.
     */
    public static double integrate(List<PowerSample> samples) {
        if (samples.size() < 2) {
            return 0;
        }
        double wattSeconds = 0;
        for (int i = 0; i < samples.size() - 1; i++) {
            var current = samples.get(i);
            var next = samples.get(i + 1);
            wattSeconds += (current.getWatts() + next.getWatts()) / 2 * (next.getTimestamp() - current.getTimestamp());
        }
        return wattSeconds / SECONDS_PER_HOUR / WATTS_PER_KILOWATT;
    }

    public static List<AggregatedDataPoint> groupByFixedWindow(List<EnergyReading> readings, EnergyWindow window,
                                                               ToDoubleFunction<EnergyReading> extractor) {
        return groupByFixedWindow(readings, window, extractor, ALL);
    }

    /**
     * Groups filtered samples into calendar windows and integrates each window on its own.
     * Windows left with fewer than two samples after filtering are dropped, not reported as 0.
     *
     * @param readings  the readings, in any order.
     * @param window    the window scheme (hourly or local daily).
     * @param extractor the channel value to integrate, in watts.
     * @param filter    keeps only samples whose extracted value passes.
     * @return one data point per window with enough samples, ascending by window start.
     */
    public static List<AggregatedDataPoint> groupByFixedWindow(List<EnergyReading> readings, EnergyWindow window,
                                                               ToDoubleFunction<EnergyReading> extractor,
                                                               DoublePredicate filter) {
        Map<Long, List<PowerSample>> windows = new TreeMap<>();
        for (PowerSample sample : toSamples(readings, extractor, filter)) {
            windows.computeIfAbsent(window.startOf(sample.getTimestamp()), start -> new ArrayList<>()).add(sample);
        }

        List<AggregatedDataPoint> points = new ArrayList<>();
        windows.forEach((start, samples) -> {
            if (samples.size() >= 2) {
                points.add(new AggregatedDataPoint(window.label(start), integrate(samples), start));
            }
        });
        return points;
    }

    public static double totalEnergy(List<EnergyReading> readings, ToDoubleFunction<EnergyReading> extractor) {
        return totalEnergy(readings, extractor, ALL);
    }

    /**
     * Integrates the whole filtered, sorted sequence as a single run.
     */
    public static double totalEnergy(List<EnergyReading> readings, ToDoubleFunction<EnergyReading> extractor,
                                     DoublePredicate filter) {
        return integrate(toSamples(readings, extractor, filter));
    }

    /**
     * Sorts readings by timestamp and collapses duplicates; for equal timestamps the reading that
     * comes later in {@code readings} wins.
     */
    public static List<EnergyReading> distinctByTimestamp(Collection<EnergyReading> readings) {
        Map<Long, EnergyReading> byTimestamp = new TreeMap<>();
        readings.forEach(reading -> byTimestamp.put(reading.getTimestamp(), reading));
        return new ArrayList<>(byTimestamp.values());
    }

    private static List<PowerSample> toSamples(List<EnergyReading> readings, ToDoubleFunction<EnergyReading> extractor,
                                               DoublePredicate filter) {
        return readings.stream()
                .map(reading -> new PowerSample(reading.getTimestamp(), extractor.applyAsDouble(reading)))
                .filter(sample -> filter.test(sample.getWatts()))
                .sorted(Comparator.comparingLong(PowerSample::getTimestamp))
                .toList();
    }
}
