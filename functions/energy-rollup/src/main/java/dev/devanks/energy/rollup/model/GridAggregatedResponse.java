package dev.devanks.energy.rollup.model;

import lombok.Value;

@Value
public class GridAggregatedResponse implements EnergyAggregation {
    AggregatedResponse consumption;
    AggregatedResponse feedIn;
}
