package dev.devanks.energy.rollup.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.rollup.aggregation.EnergyIntegrator;
import dev.devanks.energy.rollup.aggregation.EnergyWindow;
import dev.devanks.energy.rollup.cache.EnergyCache;
import dev.devanks.energy.rollup.config.EnergyRollupProperties;
import dev.devanks.energy.rollup.model.AggregatedDataPoint;
import dev.devanks.energy.rollup.model.AggregatedResponse;
import dev.devanks.energy.rollup.model.ChannelType;
import dev.devanks.energy.rollup.model.EnergyAggregation;
import dev.devanks.energy.rollup.model.EnergyReading;
import dev.devanks.energy.rollup.model.GridAggregatedResponse;
import dev.devanks.energy.rollup.model.Granularity;
import dev.devanks.energy.rollup.store.BucketStore;
import dev.devanks.energy.rollup.store.ReadingSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.function.DoublePredicate;
import java.util.function.ToDoubleFunction;

import static dev.devanks.energy.rollup.aggregation.Minutes.MINUTE_SECONDS;
import static dev.devanks.energy.rollup.aggregation.Minutes.floorToMinute;

/**
 * Answers "how much energy per hour/day between two instants" for one channel.
 * <p>
 * Short ranges integrate raw readings. Longer ranges rebuild a thin sample series from the first
 * and last sample of every minute bucket, stitch raw readings in where buckets do not cover the
 * range, and integrate that series with the same integrator. Results are cached per query.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnergyQueryService {

    public static final String CACHE_KEY_PREFIX = "energy:aggregated:";
    public static final String CACHE_INVALIDATION_PATTERN = CACHE_KEY_PREFIX + "*";

    private static final DoublePredicate POSITIVE = watts -> watts > 0;

    // Grid readings are signed: positive is drawn from the grid, negative is fed into it
    private static final ToDoubleFunction<EnergyReading> GRID_CONSUMPTION = EnergyReading::getGrid;
    private static final DoublePredicate NON_NEGATIVE = watts -> watts >= 0;
    private static final ToDoubleFunction<EnergyReading> GRID_FEED_IN = reading -> reading.getGrid() < 0 ? -reading.getGrid() : 0;

    private final ReadingSource readingSource;
    private final BucketStore bucketStore;
    private final EnergyCache cache;
    private final EnergyRollupProperties properties;
    private final ZoneId zone;

    /**
     * Per-window and total energy for a channel over {@code [from, to)}.
     *
     * @param from        inclusive start, epoch seconds.
     * @param to          exclusive end, epoch seconds.
     * @param granularity hour or local day windows.
     * @param channel     the channel; {@link ChannelType#GRID} yields a {@link GridAggregatedResponse}.
     * @return A Mono containing an {@link AggregatedResponse} or a {@link GridAggregatedResponse}.
     */
    public Mono<EnergyAggregation> getAggregatedEnergyData(long from, long to, Granularity granularity, ChannelType channel) {
        if (from > to) {
            return Mono.error(new IllegalArgumentException(
                    String.format("Invalid range: from (%d) must not be after to (%d).", from, to)));
        }
        var key = cacheKey(channel, granularity, from, to);
        return cached(key)
                .switchIfEmpty(Mono.defer(() -> compute(from, to, granularity, channel)
                        .flatMap(result -> store(key, result).thenReturn(result))));
    }

    /**
     * Per-window energy read straight from the stored hourly or daily rollups. The range is widened
     * to whole windows. Empty until the rollups have been built.
     */
    public Mono<AggregatedResponse> getRollupEnergyData(long from, long to, Granularity granularity, ChannelType channel) {
        if (from > to) {
            return Mono.error(new IllegalArgumentException(
                    String.format("Invalid range: from (%d) must not be after to (%d).", from, to)));
        }
        var window = granularity.window(zone);
        var start = window.startOf(from);
        var lastStart = window.startOf(to);
        var end = lastStart == to ? to : window.endOf(lastStart);
        var rollups = granularity == Granularity.HOUR
                ? bucketStore.hourlyRollup(start, end)
                : bucketStore.dailyRollup(start, end);
        return rollups
                .map(rollup -> new AggregatedDataPoint(window.label(rollup.getBucketStart()), channel.kwhOf(rollup),
                        rollup.getBucketStart()))
                .collectList()
                .map(points -> new AggregatedResponse(points, points.stream().mapToDouble(AggregatedDataPoint::getKwh).sum()));
    }

    @VisibleForTesting
    static String cacheKey(ChannelType channel, Granularity granularity, long from, long to) {
        return CACHE_KEY_PREFIX + channel.id() + ":" + granularity.name().toLowerCase(Locale.ROOT) + ":" + from + ":" + to;
    }

    private Mono<EnergyAggregation> compute(long from, long to, Granularity granularity, ChannelType channel) {
        if (to - from >= properties.getQuery().getBucketThresholdSeconds()) {
            log.debug("Aggregating {} over [{}, {}) from minute buckets.", channel.id(), from, to);
            return bucketSeries(from, to)
                    .map(readings -> aggregate(readings, granularity, channel));
        }
        log.debug("Aggregating {} over [{}, {}) from raw readings.", channel.id(), from, to);
        return readingSource.rangeQuery(from, to)
                .collectList()
                .map(readings -> aggregate(readings, granularity, channel));
    }

    /**
     * Builds the sample series for a bucket-backed query:
     * <ul>
     *     <li>a partial first minute is read raw, anchored by the reading just before {@code from};</li>
     *     <li>full minutes up to the newest bucket contribute their first and last samples;</li>
     *     <li>full minutes after the newest bucket, not rolled up yet, are read raw;</li>
     *     <li>a partial last minute is read raw, anchored by the first reading at or after {@code to}.</li>
     * </ul>
     */
    @VisibleForTesting
    Mono<List<EnergyReading>> bucketSeries(long from, long to) {
        var firstMinute = floorToMinute(from);
        var lastMinute = floorToMinute(to);
        var partialFirst = firstMinute < from;
        var partialLast = lastMinute < to;
        var fullStart = partialFirst ? firstMinute + MINUTE_SECONDS : firstMinute;
        var fullEnd = Math.max(fullStart, lastMinute);

        return bucketStore.latestBucketTimestamp()
                .map(latest -> Math.max(fullStart, latest + MINUTE_SECONDS))
                .defaultIfEmpty(fullStart)
                .map(rawStart -> Math.min(rawStart, fullEnd))
                .flatMap(rawStart -> Flux.concat(
                                partialFirst ? leadingEdge(from, fullStart) : Flux.<EnergyReading>empty(),
                                bucketSamples(fullStart, rawStart),
                                rawStart < fullEnd ? readingSource.rangeQuery(rawStart, fullEnd) : Flux.<EnergyReading>empty(),
                                partialLast ? trailingEdge(fullEnd, to) : Flux.<EnergyReading>empty())
                        .collectList());
    }

    private Flux<EnergyReading> leadingEdge(long from, long fullStart) {
        return Flux.concat(bucketStore.firstReadingBefore(from), readingSource.rangeQuery(from, fullStart));
    }

    private Flux<EnergyReading> trailingEdge(long fullEnd, long to) {
        // a reading exactly at to is the closest anchor
        return Flux.concat(readingSource.rangeQuery(fullEnd, to), bucketStore.firstReadingAfter(to - 1));
    }

    private Flux<EnergyReading> bucketSamples(long from, long to) {
        if (from >= to) {
            return Flux.empty();
        }
        return bucketStore.rangeBuckets(from, to)
                .flatMapIterable(bucket -> List.of(bucket.firstReading(), bucket.lastReading()));
    }

    @VisibleForTesting
    EnergyAggregation aggregate(List<EnergyReading> readings, Granularity granularity, ChannelType channel) {
        var series = EnergyIntegrator.distinctByTimestamp(readings);
        var window = granularity.window(zone);
        if (channel == ChannelType.GRID) {
            return new GridAggregatedResponse(
                    aggregateChannel(series, window, GRID_CONSUMPTION, NON_NEGATIVE),
                    aggregateChannel(series, window, GRID_FEED_IN, POSITIVE));
        }
        return aggregateChannel(series, window, channel::wattsOf, POSITIVE);
    }

    private static AggregatedResponse aggregateChannel(List<EnergyReading> series, EnergyWindow window,
                                                       ToDoubleFunction<EnergyReading> extractor, DoublePredicate filter) {
        return new AggregatedResponse(
                EnergyIntegrator.groupByFixedWindow(series, window, extractor, filter),
                EnergyIntegrator.totalEnergy(series, extractor, filter));
    }

    private Mono<EnergyAggregation> cached(String key) {
        return Mono.defer(() -> cache.get(key, EnergyAggregation.class))
                .doOnNext(hit -> log.debug("Cache hit for {}", key))
                .onErrorResume(e -> {
                    log.warn("Cache read failed for {}: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Void> store(String key, EnergyAggregation result) {
        return Mono.defer(() -> cache.set(key, result, properties.getQuery().getCacheTtl()))
                .onErrorResume(e -> {
                    log.warn("Cache write failed for {}: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }
}
