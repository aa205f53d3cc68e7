package dev.devanks.energy.rollup.model;

import lombok.Value;

@Value
public class AggregatedDataPoint {
    String label;
    double kwh;
    long timestamp;
}
