package dev.devanks.energy.rollup.model;

import lombok.Value;

@Value
public class PricedDataPoint {
    String label;
    double kwh;
    double cost;
    long timestamp;
}
