package dev.devanks.energy.rollup.model;

import lombok.Value;

/**
 * Half-open range {@code [from, to)} in epoch seconds.
 */
@Value
public class TimeRange {
    long from;
    long to;

    public long length() {
        return to - from;
    }
}
