package dev.devanks.energy.rollup.model;

import lombok.Builder;
import lombok.Value;

/**
 * One raw power sample. Channel values are instantaneous watts; {@code grid} is signed,
 * negative while feeding in.
 */
@Value
@Builder(toBuilder = true)
public class EnergyReading {
    long timestamp;
    double home;
    double grid;
    double car;
    double solar;
}
