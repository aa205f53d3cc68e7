package dev.devanks.energy.rollup.store;

import dev.devanks.energy.rollup.model.EnergyBucket;
import dev.devanks.energy.rollup.model.EnergyReading;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Minute buckets and the hourly/daily rollups derived from them.
 * <p>
 * Rollups are projections that can be rebuilt at any time. A rollup that has not been built yet
 * reads as an empty result.
 */
public interface BucketStore {

    /**
     * Minute buckets with {@code from <= bucketStart < to}, ascending.
     */
    Flux<EnergyBucket> rangeBuckets(long from, long to);

    Mono<EnergyReading> firstReadingBefore(long timestamp);

    Mono<EnergyReading> firstReadingAfter(long timestamp);

    /**
     * Start of the most recent minute bucket, or empty when no bucket exists.
     */
    Mono<Long> latestBucketTimestamp();

    Flux<EnergyBucket> hourlyRollup(long from, long to);

    Flux<EnergyBucket> dailyRollup(long from, long to);

    /**
     * Inserts or replaces the bucket keyed by its start.
     */
    Mono<EnergyBucket> upsertBucket(EnergyBucket bucket);

    /**
     * Recomputes every hourly and daily rollup window overlapping {@code [from, to)}.
     */
    Mono<Void> rebuildRollups(long from, long to);

    /**
     * Recomputes every rollup window that has minute buckets.
     */
    Mono<Void> rebuildRollups();
}
