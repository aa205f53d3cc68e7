package dev.devanks.energy.rollup.model;

import lombok.Value;

@Value
public class PowerSample {
    long timestamp;
    double watts;
}
