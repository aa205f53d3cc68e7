package dev.devanks.energy.rollup.aggregation;

import dev.devanks.energy.rollup.model.EnergyBucket;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives coarser rollups (hourly, daily) from minute buckets. The result depends only on the
 * buckets passed in, so rebuilding a window any number of times yields the same row.
 */
public final class BucketRollups {

    private BucketRollups() {
    }

    public static List<EnergyBucket> rollUp(Collection<EnergyBucket> minuteBuckets, EnergyWindow window) {
        Map<Long, List<EnergyBucket>> windows = new TreeMap<>();
        for (EnergyBucket bucket : minuteBuckets) {
            windows.computeIfAbsent(window.startOf(bucket.getBucketStart()), start -> new ArrayList<>()).add(bucket);
        }

        List<EnergyBucket> rollups = new ArrayList<>(windows.size());
        windows.forEach((start, buckets) -> rollups.add(combine(start, window.endOf(start), buckets)));
        return rollups;
    }

    private static EnergyBucket combine(long start, long end, List<EnergyBucket> buckets) {
        buckets.sort(Comparator.comparingLong(EnergyBucket::getBucketStart));
        var first = buckets.get(0);
        var last = buckets.get(buckets.size() - 1);
        return EnergyBucket.builder()
                .bucketStart(start)
                .bucketEnd(end)
                .homeKwh(buckets.stream().mapToDouble(EnergyBucket::getHomeKwh).sum())
                .gridKwh(buckets.stream().mapToDouble(EnergyBucket::getGridKwh).sum())
                .carKwh(buckets.stream().mapToDouble(EnergyBucket::getCarKwh).sum())
                .solarKwh(buckets.stream().mapToDouble(EnergyBucket::getSolarKwh).sum())
                .readingsCount(buckets.stream().mapToLong(EnergyBucket::getReadingsCount).sum())
                .firstTimestamp(first.getFirstTimestamp())
                .lastTimestamp(last.getLastTimestamp())
                .firstHome(first.getFirstHome())
                .firstGrid(first.getFirstGrid())
                .firstCar(first.getFirstCar())
                .firstSolar(first.getFirstSolar())
                .lastHome(last.getLastHome())
                .lastGrid(last.getLastGrid())
                .lastCar(last.getLastCar())
                .lastSolar(last.getLastSolar())
                .build();
    }
}
