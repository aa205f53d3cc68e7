package dev.devanks.energy.rollup.model;

/**
 * Result of an aggregated energy query: {@link AggregatedResponse} for single-direction channels,
 * {@link GridAggregatedResponse} for the grid.
 */
public interface EnergyAggregation {
}
