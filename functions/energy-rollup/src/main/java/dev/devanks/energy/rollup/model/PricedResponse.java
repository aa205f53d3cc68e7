package dev.devanks.energy.rollup.model;

import lombok.Value;

import java.util.List;

@Value
public class PricedResponse {
    List<PricedDataPoint> data;
    double totalKwh;
    double totalCost;
}
