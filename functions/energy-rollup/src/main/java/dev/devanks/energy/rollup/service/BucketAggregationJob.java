package dev.devanks.energy.rollup.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.rollup.aggregation.EnergyIntegrator;
import dev.devanks.energy.rollup.cache.EnergyCache;
import dev.devanks.energy.rollup.config.EnergyRollupProperties;
import dev.devanks.energy.rollup.exception.AggregationException;
import dev.devanks.energy.rollup.exception.StaleCheckpointException;
import dev.devanks.energy.rollup.model.AggregationCheckpoint;
import dev.devanks.energy.rollup.model.AggregationStatus;
import dev.devanks.energy.rollup.model.ChannelType;
import dev.devanks.energy.rollup.model.EnergyBucket;
import dev.devanks.energy.rollup.model.EnergyReading;
import dev.devanks.energy.rollup.store.BucketStore;
import dev.devanks.energy.rollup.store.CheckpointStore;
import dev.devanks.energy.rollup.store.ReadingSource;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static dev.devanks.energy.rollup.aggregation.Minutes.MINUTE_SECONDS;
import static dev.devanks.energy.rollup.aggregation.Minutes.floorToMinute;
import static dev.devanks.energy.rollup.aggregation.Minutes.isMinuteAligned;

/**
 * Rolls raw readings up into one bucket per minute and keeps a checkpoint of the last minute done.
 * <p>
 * A run starts by claiming the checkpoint: it bumps {@code runGeneration} and marks the job
 * {@code RUNNING}. Every later checkpoint write re-reads the stored generation first, so a run that
 * was overtaken by a newer one stops with a {@link StaleCheckpointException} instead of moving the
 * checkpoint under the newer run's feet. The checkpoint only ever moves forward and never past the
 * last fully elapsed minute.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BucketAggregationJob {

    public static final String MINUTE_BUCKETS_JOB = "minute-buckets";
    public static final String BACKFILL_JOB = "backfill";

    private final ReadingSource readingSource;
    private final BucketStore bucketStore;
    private final CheckpointStore checkpointStore;
    private final EnergyCache cache;
    private final EnergyRollupProperties properties;
    private final Clock clock;

    private final AtomicBoolean latestRunning = new AtomicBoolean();
    private final AtomicBoolean backfillRunning = new AtomicBoolean();

    /**
     * Entry point for triggers. Honors {@code energy.rollup.enabled}.
     *
     * @return A Mono containing the summary of the run.
     */
    public Mono<String> run() {
        if (!properties.getRollup().isEnabled()) {
            log.info("Minute aggregation is DISABLED. Skipping run.");
            return Mono.just("Aggregation skipped: job is disabled.");
        }
        return processLatest();
    }

    /**
     * Aggregates every complete minute after the stored checkpoint, up to and including the last
     * fully elapsed minute. Concurrent calls on the same instance are skipped, not queued.
     *
     * @return A Mono containing the summary of the run; errors after claiming the checkpoint are
     * signalled as {@link AggregationException}.
     */
    public Mono<String> processLatest() {
        return Mono.defer(() -> {
            if (!latestRunning.compareAndSet(false, true)) {
                log.warn("A minute aggregation run is already in progress on this instance. Skipping.");
                return Mono.just("Aggregation skipped: a run is already in progress.");
            }
            return runLatest().doFinally(signal -> latestRunning.set(false));
        });
    }

    /**
     * Re-aggregates the minutes of {@code [from, to)} under the separate {@code backfill}
     * checkpoint. An interrupted backfill over the same range resumes after its last checkpoint.
     * Minutes that have not fully elapsed yet are left to the regular run.
     *
     * @param from inclusive start, epoch seconds.
     * @param to   exclusive end, epoch seconds.
     * @return A Mono containing the summary of the backfill.
     */
    public Mono<String> backfill(long from, long to) {
        if (from >= to) {
            return Mono.error(new IllegalArgumentException(
                    String.format("Invalid backfill range: from (%d) must be before to (%d).", from, to)));
        }
        return Mono.defer(() -> {
            if (!backfillRunning.compareAndSet(false, true)) {
                log.warn("A backfill is already in progress on this instance. Skipping.");
                return Mono.just("Backfill skipped: a backfill is already in progress.");
            }
            return runBackfill(from, to).doFinally(signal -> backfillRunning.set(false));
        });
    }

    /**
     * Computes and upserts the bucket for one minute. Writing the same minute twice yields the same
     * bucket.
     *
     * @param bucketStart minute-aligned start of the bucket.
     * @return the stored bucket, or empty when the minute has fewer than two readings.
     */
    public Mono<EnergyBucket> aggregateMinuteBucket(long bucketStart) {
        if (!isMinuteAligned(bucketStart)) {
            return Mono.error(new IllegalArgumentException("Bucket start is not minute aligned: " + bucketStart));
        }
        return readingSource.rangeQuery(bucketStart, bucketStart + MINUTE_SECONDS)
                .collectList()
                .map(EnergyIntegrator::distinctByTimestamp)
                .filter(readings -> {
                    if (readings.size() < 2) {
                        log.debug("Skipping minute {}: {} reading(s), at least 2 needed.", bucketStart, readings.size());
                        return false;
                    }
                    return true;
                })
                .map(readings -> buildBucket(bucketStart, readings))
                .flatMap(bucketStore::upsertBucket);
    }

    private Mono<String> runLatest() {
        var now = clock.instant().getEpochSecond();
        var currentMinute = floorToMinute(now);
        return checkpointStore.load(MINUTE_BUCKETS_JOB)
                .switchIfEmpty(Mono.defer(() -> seedCheckpoint(currentMinute, now)))
                .flatMap(stored -> claimLatest(stored, now))
                .flatMap(run -> execute(run, run.getStartMinute(), currentMinute));
    }

    private Mono<String> runBackfill(long from, long to) {
        var now = clock.instant().getEpochSecond();
        var firstMinute = floorToMinute(from);
        var lastMinute = ceilToMinute(to);
        var endMinute = Math.min(lastMinute, floorToMinute(now));
        if (firstMinute >= endMinute) {
            log.info("Nothing to backfill in [{}, {}): no fully elapsed minute in range.", from, to);
            return Mono.just(buildSummary(BACKFILL_JOB, 0, 0, firstMinute - MINUTE_SECONDS, "Nothing to backfill."));
        }
        log.info("Backfilling minute buckets in [{}, {}).", Instant.ofEpochSecond(firstMinute), Instant.ofEpochSecond(endMinute));
        return checkpointStore.load(BACKFILL_JOB)
                .defaultIfEmpty(newCheckpoint(BACKFILL_JOB, firstMinute - MINUTE_SECONDS, now))
                .flatMap(stored -> claimBackfill(stored, firstMinute, lastMinute, endMinute, now))
                .flatMap(run -> execute(run, run.getStartMinute(), endMinute));
    }

    /**
     * Resumes only an unfinished backfill of exactly the same minute range; any other range starts
     * over at its first minute.
     */
    private Mono<Run> claimBackfill(AggregationCheckpoint stored, long rangeFrom, long rangeTo, long endMinute, long now) {
        var last = stored.getLastProcessedTimestamp();
        var sameRange = Long.valueOf(rangeFrom).equals(stored.getRangeFrom())
                && Long.valueOf(rangeTo).equals(stored.getRangeTo());
        var resumable = sameRange
                && stored.getStatus() != AggregationStatus.COMPLETED
                && last >= rangeFrom - MINUTE_SECONDS && last < endMinute;
        var ranged = stored.toBuilder().rangeFrom(rangeFrom).rangeTo(rangeTo).build();
        if (resumable) {
            log.info("Resuming backfill of [{}, {}) after minute {}.", rangeFrom, rangeTo, last);
            return claim(ranged, last, now);
        }
        return claim(ranged, rangeFrom - MINUTE_SECONDS, now);
    }

    /**
     * Re-reads the checkpoint right before claiming it, so a claim never moves the regular job's
     * checkpoint behind what another instance stored in the meantime.
     */
    private Mono<Run> claimLatest(AggregationCheckpoint stored, long now) {
        return checkpointStore.load(MINUTE_BUCKETS_JOB)
                .defaultIfEmpty(stored)
                .flatMap(current -> claim(current,
                        Math.max(current.getLastProcessedTimestamp(), stored.getLastProcessedTimestamp()), now));
    }

    /**
     * Marks the checkpoint as taken by a new run generation.
     */
    private Mono<Run> claim(AggregationCheckpoint stored, long lastProcessed, long now) {
        var claimed = stored.toBuilder()
                .lastProcessedTimestamp(lastProcessed)
                .lastRunAt(now)
                .status(AggregationStatus.RUNNING)
                .runGeneration(stored.getRunGeneration() + 1)
                .build();
        return checkpointStore.save(claimed)
                .map(saved -> new Run(saved.getJobId(), saved.getRunGeneration(), lastProcessed + MINUTE_SECONDS))
                .doOnNext(run -> log.info("Claimed checkpoint {} with run generation {}, starting at minute {}.",
                        run.getJobId(), run.getGeneration(), run.getStartMinute()));
    }

    private Mono<String> execute(Run run, long firstMinute, long endMinute) {
        return processMinutes(run, firstMinute, endMinute)
                .flatMap(lastMinute -> complete(run, lastMinute))
                .onErrorResume(error -> fail(run, error));
    }

    /**
     * Aggregates minutes {@code [firstMinute, endMinute)} in order, writing the checkpoint after
     * every {@code checkpointInterval} minutes.
     *
     * @return the last minute processed, or {@code firstMinute - 60} when the range is empty.
     */
    @VisibleForTesting
    Mono<Long> processMinutes(Run run, long firstMinute, long endMinute) {
        var none = firstMinute - MINUTE_SECONDS;
        if (firstMinute >= endMinute) {
            log.info("No complete minute to aggregate for {} (next minute {}).", run.getJobId(), firstMinute);
            return Mono.just(none);
        }
        var minutes = (int) ((endMinute - firstMinute) / MINUTE_SECONDS);
        var rollup = properties.getRollup();
        log.info("Aggregating {} minute(s) for {} starting at {}.", minutes, run.getJobId(), Instant.ofEpochSecond(firstMinute));
        return Flux.range(0, minutes)
                .map(index -> firstMinute + index * MINUTE_SECONDS)
                .flatMapSequential(minute -> aggregateMinuteBucket(minute)
                        .doOnNext(bucket -> run.getBucketsWritten().incrementAndGet())
                        .thenReturn(minute), rollup.getConcurrency())
                .buffer(rollup.getCheckpointInterval())
                .concatMap(batch -> advance(run, lastOf(batch)))
                .last(none);
    }

    private Mono<Long> advance(Run run, long minute) {
        run.getMinutesProcessed().set((minute - run.getStartMinute()) / MINUTE_SECONDS + 1);
        return writeCheckpoint(run, minute, AggregationStatus.RUNNING)
                .thenReturn(minute);
    }

    /**
     * Writes the checkpoint if this run still owns it. The stored timestamp never moves backwards.
     */
    private Mono<AggregationCheckpoint> writeCheckpoint(Run run, long minute, AggregationStatus status) {
        return checkpointStore.load(run.getJobId())
                .switchIfEmpty(Mono.error(() -> new StaleCheckpointException(
                        "Checkpoint " + run.getJobId() + " disappeared during run generation " + run.getGeneration())))
                .flatMap(current -> {
                    if (current.getRunGeneration() != run.getGeneration()) {
                        return Mono.error(new StaleCheckpointException(run.getJobId(), run.getGeneration(), current.getRunGeneration()));
                    }
                    var updated = current.toBuilder()
                            .lastProcessedTimestamp(Math.max(current.getLastProcessedTimestamp(), minute))
                            .status(status)
                            .build();
                    return checkpointStore.save(updated);
                })
                .doOnNext(saved -> log.debug("Checkpoint {} at minute {} ({}).", saved.getJobId(),
                        saved.getLastProcessedTimestamp(), saved.getStatus()));
    }

    private Mono<String> complete(Run run, long lastMinute) {
        return writeCheckpoint(run, lastMinute, AggregationStatus.COMPLETED)
                .flatMap(saved -> invalidateCache()
                        .then(rebuildRollups(run.getStartMinute(), lastMinute + MINUTE_SECONDS))
                        .thenReturn(buildSummary(run.getJobId(), run.getMinutesProcessed().get(),
                                run.getBucketsWritten().get(), saved.getLastProcessedTimestamp(), "Success.")));
    }

    private Mono<String> fail(Run run, Throwable error) {
        if (error instanceof StaleCheckpointException) {
            log.warn("Run generation {} of {} was superseded: {}", run.getGeneration(), run.getJobId(), error.getMessage());
            return Mono.error(error);
        }
        log.error("Aggregation run generation {} of {} failed: {}", run.getGeneration(), run.getJobId(), error.getMessage(), error);
        return checkpointStore.load(run.getJobId())
                .filter(current -> current.getRunGeneration() == run.getGeneration())
                .flatMap(current -> checkpointStore.save(current.toBuilder().status(AggregationStatus.ERROR).build()))
                .onErrorResume(statusEx -> {
                    log.error("Failed to record ERROR status on checkpoint {}: {}", run.getJobId(), statusEx.getMessage());
                    error.addSuppressed(statusEx);
                    return Mono.empty();
                })
                .then(Mono.<String>error(new AggregationException(
                        "Aggregation run for " + run.getJobId() + " failed: " + error.getMessage(), error)));
    }

    private Mono<Void> invalidateCache() {
        return Mono.defer(() -> cache.invalidatePattern(EnergyQueryService.CACHE_INVALIDATION_PATTERN))
                .onErrorResume(e -> {
                    log.warn("Failed to invalidate cached aggregations: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Void> rebuildRollups(long from, long to) {
        if (from >= to) {
            return Mono.empty();
        }
        return Mono.defer(() -> bucketStore.rebuildRollups(from, to))
                .onErrorResume(e -> {
                    log.warn("Failed to rebuild rollups for [{}, {}): {}", from, to, e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * First run: start just before the earliest reading, or a lookback window before now when the
     * store is empty. Never starts at or after the current minute.
     */
    @VisibleForTesting
    Mono<AggregationCheckpoint> seedCheckpoint(long currentMinute, long now) {
        var lookbackStart = floorToMinute(currentMinute - properties.getRollup().getSeedLookback().getSeconds());
        return readingSource.earliest()
                .map(reading -> floorToMinute(reading.getTimestamp()) - MINUTE_SECONDS)
                .defaultIfEmpty(lookbackStart)
                .map(seed -> Math.min(seed, currentMinute - MINUTE_SECONDS))
                .map(seed -> newCheckpoint(MINUTE_BUCKETS_JOB, seed, now))
                .doOnNext(seed -> log.info("No checkpoint for {}. Seeding at minute {}.", seed.getJobId(),
                        seed.getLastProcessedTimestamp()));
    }

    @VisibleForTesting
    static EnergyBucket buildBucket(long bucketStart, List<EnergyReading> readings) {
        var first = readings.get(0);
        var last = readings.get(readings.size() - 1);
        return EnergyBucket.builder()
                .bucketStart(bucketStart)
                .bucketEnd(bucketStart + MINUTE_SECONDS)
                .homeKwh(EnergyIntegrator.totalEnergy(readings, ChannelType.HOME::wattsOf))
                .gridKwh(EnergyIntegrator.totalEnergy(readings, ChannelType.GRID::wattsOf))
                .carKwh(EnergyIntegrator.totalEnergy(readings, ChannelType.CAR::wattsOf))
                .solarKwh(EnergyIntegrator.totalEnergy(readings, ChannelType.SOLAR::wattsOf))
                .readingsCount(readings.size())
                .firstTimestamp(first.getTimestamp())
                .lastTimestamp(last.getTimestamp())
                .firstHome(first.getHome())
                .firstGrid(first.getGrid())
                .firstCar(first.getCar())
                .firstSolar(first.getSolar())
                .lastHome(last.getHome())
                .lastGrid(last.getGrid())
                .lastCar(last.getCar())
                .lastSolar(last.getSolar())
                .build();
    }

    private static AggregationCheckpoint newCheckpoint(String jobId, long lastProcessed, long now) {
        return AggregationCheckpoint.builder()
                .jobId(jobId)
                .lastProcessedTimestamp(lastProcessed)
                .lastRunAt(now)
                .status(AggregationStatus.COMPLETED)
                .runGeneration(0)
                .build();
    }

    private static long ceilToMinute(long timestamp) {
        return -floorToMinute(-timestamp);
    }

    private static long lastOf(List<Long> batch) {
        return batch.get(batch.size() - 1);
    }

    private String buildSummary(String jobId, long minutes, long buckets, long checkpoint, String statusMessage) {
        var resultSummary = String.format(
                "Aggregation run for %s completed. Status: %s Minutes processed: %d, Buckets written: %d, Checkpoint: %s.",
                jobId, statusMessage, minutes, buckets, Instant.ofEpochSecond(checkpoint));
        log.info(resultSummary);
        return resultSummary;
    }

    /**
     * Progress of one claimed run.
     */
    @Value
    @VisibleForTesting
    static class Run {
        String jobId;
        long generation;
        long startMinute;
        AtomicLong minutesProcessed = new AtomicLong();
        AtomicLong bucketsWritten = new AtomicLong();
    }
}
