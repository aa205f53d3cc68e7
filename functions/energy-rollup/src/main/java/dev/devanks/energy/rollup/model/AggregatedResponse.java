package dev.devanks.energy.rollup.model;

import lombok.Value;

import java.util.List;

@Value
public class AggregatedResponse implements EnergyAggregation {

    private static final AggregatedResponse EMPTY = new AggregatedResponse(List.of(), 0);

    List<AggregatedDataPoint> data;
    double total;

    public static AggregatedResponse empty() {
        return EMPTY;
    }
}
