package dev.devanks.energy.rollup.model;

import lombok.Builder;
import lombok.Value;

/**
 * High-water mark of an aggregation job. {@code lastProcessedTimestamp} is the start of the last
 * minute known to be rolled up and is always minute aligned.
 * <p>
 * A backfill checkpoint also records the minute range {@code [rangeFrom, rangeTo)} it was claimed
 * for; both are null on the regular job's checkpoint.
 */
@Value
@Builder(toBuilder = true)
public class AggregationCheckpoint {
    String jobId;
    long lastProcessedTimestamp;
    long lastRunAt;
    AggregationStatus status;
    long runGeneration;
    Long rangeFrom;
    Long rangeTo;
}
