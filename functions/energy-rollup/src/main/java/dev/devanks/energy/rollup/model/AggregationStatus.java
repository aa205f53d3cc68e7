package dev.devanks.energy.rollup.model;

public enum AggregationStatus {
    RUNNING, COMPLETED, ERROR
}
