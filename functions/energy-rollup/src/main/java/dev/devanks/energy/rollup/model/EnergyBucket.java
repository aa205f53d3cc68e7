package dev.devanks.energy.rollup.model;

import lombok.Builder;
import lombok.Value;

/**
 * A rolled-up window of raw readings. Minute buckets come from the aggregation job; hourly and
 * daily rollups share the same shape and are summed from minute buckets.
 */
@Value
@Builder(toBuilder = true)
public class EnergyBucket {
    long bucketStart;
    long bucketEnd;
    double homeKwh;
    double gridKwh;
    double carKwh;
    double solarKwh;
    long readingsCount;
    long firstTimestamp;
    long lastTimestamp;
    double firstHome;
    double firstGrid;
    double firstCar;
    double firstSolar;
    double lastHome;
    double lastGrid;
    double lastCar;
    double lastSolar;

    /**
     * The first raw sample retained by this bucket, as a reading.
     */
    public EnergyReading firstReading() {
        return EnergyReading.builder()
                .timestamp(firstTimestamp)
                .home(firstHome)
                .grid(firstGrid)
                .car(firstCar)
                .solar(firstSolar)
                .build();
    }

    /**
     * The last raw sample retained by this bucket, as a reading.
     */
    public EnergyReading lastReading() {
        return EnergyReading.builder()
                .timestamp(lastTimestamp)
                .home(lastHome)
                .grid(lastGrid)
                .car(lastCar)
                .solar(lastSolar)
                .build();
    }
}
