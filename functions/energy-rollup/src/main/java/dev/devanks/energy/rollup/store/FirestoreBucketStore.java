package dev.devanks.energy.rollup.store;

import dev.devanks.energy.rollup.aggregation.BucketRollups;
import dev.devanks.energy.rollup.aggregation.EnergyWindow;
import dev.devanks.energy.rollup.entity.EnergyBucketEntity;
import dev.devanks.energy.rollup.mapper.BucketMapper;
import dev.devanks.energy.rollup.model.EnergyBucket;
import dev.devanks.energy.rollup.model.EnergyReading;
import dev.devanks.energy.rollup.repository.EnergyBucketRepository;
import dev.devanks.energy.rollup.repository.EnergyDailyRollupRepository;
import dev.devanks.energy.rollup.repository.EnergyHourlyRollupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.ZoneId;

import static org.springframework.data.domain.Sort.Direction.ASC;
import static org.springframework.data.domain.Sort.Direction.DESC;

@Service
@RequiredArgsConstructor
@Slf4j
public class FirestoreBucketStore implements BucketStore {

    private static final String BUCKET_START = "bucketStart";

    private final EnergyBucketRepository bucketRepository;
    private final EnergyHourlyRollupRepository hourlyRepository;
    private final EnergyDailyRollupRepository dailyRepository;
    private final ReadingSource readingSource;
    private final BucketMapper bucketMapper;
    private final ZoneId zone;

    @Override
    public Flux<EnergyBucket> rangeBuckets(long from, long to) {
        log.debug("Fetching minute buckets with bucketStart in [{}, {})", from, to);
        return bucketRepository.findByBucketStartGreaterThanEqualAndBucketStartLessThan(from, to, byBucketStart())
                .map(bucketMapper::mapToModel)
                .doOnError(e -> log.error("Error fetching buckets in [{}, {}): {}", from, to, e.getMessage(), e));
    }

    @Override
    public Mono<EnergyReading> firstReadingBefore(long timestamp) {
        return readingSource.before(timestamp);
    }

    @Override
    public Mono<EnergyReading> firstReadingAfter(long timestamp) {
        return readingSource.after(timestamp);
    }

    @Override
    public Mono<Long> latestBucketTimestamp() {
        return bucketRepository.findByBucketStartGreaterThanEqual(Long.MIN_VALUE, PageRequest.of(0, 1, Sort.by(DESC, BUCKET_START)))
                .next()
                .map(EnergyBucketEntity::getBucketStart)
                .doOnError(e -> log.error("Error fetching latest bucket timestamp: {}", e.getMessage(), e));
    }

    @Override
    public Flux<EnergyBucket> hourlyRollup(long from, long to) {
        return hourlyRepository.findByBucketStartGreaterThanEqualAndBucketStartLessThan(from, to, byBucketStart())
                .map(bucketMapper::mapToModel)
                .doOnError(e -> log.error("Error fetching hourly rollups in [{}, {}): {}", from, to, e.getMessage(), e));
    }

    @Override
    public Flux<EnergyBucket> dailyRollup(long from, long to) {
        return dailyRepository.findByBucketStartGreaterThanEqualAndBucketStartLessThan(from, to, byBucketStart())
                .map(bucketMapper::mapToModel)
                .doOnError(e -> log.error("Error fetching daily rollups in [{}, {}): {}", from, to, e.getMessage(), e));
    }

    @Override
    public Mono<EnergyBucket> upsertBucket(EnergyBucket bucket) {
        return bucketRepository.save(bucketMapper.mapToEntity(bucket))
                .map(bucketMapper::mapToModel)
                .doOnSuccess(saved -> log.debug("Upserted bucket {}", bucket.getBucketStart()))
                .doOnError(e -> log.error("Failed to upsert bucket {}: {}", bucket.getBucketStart(), e.getMessage(), e));
    }

    @Override
    public Mono<Void> rebuildRollups(long from, long to) {
        if (from >= to) {
            return Mono.empty();
        }
        var hourly = EnergyWindow.hourly(zone);
        var daily = EnergyWindow.daily(zone);
        return rebuildHourly(hourly.startOf(from), coveringEnd(hourly, to))
                .then(rebuildDaily(daily.startOf(from), coveringEnd(daily, to)));
    }

    /**
     * Walks the local days from the oldest to the newest bucket and rebuilds them one at a time, so
     * only a single day of buckets is held in memory.
     */
    @Override
    public Mono<Void> rebuildRollups() {
        var daily = EnergyWindow.daily(zone);
        return Mono.zip(earliestBucketTimestamp(), latestBucketTimestamp())
                .flatMapMany(span -> Flux.<Long, Long>generate(() -> daily.startOf(span.getT1()), (dayStart, sink) -> {
                    if (dayStart > span.getT2()) {
                        sink.complete();
                    } else {
                        sink.next(dayStart);
                    }
                    return daily.endOf(dayStart);
                }))
                .concatMap(dayStart -> rebuildRollups(dayStart, daily.endOf(dayStart)).thenReturn(dayStart))
                .count()
                .doOnNext(days -> log.info("Rebuilt hourly and daily rollups for {} day(s).", days))
                .then();
    }

    private Mono<Long> earliestBucketTimestamp() {
        return bucketRepository.findByBucketStartGreaterThanEqual(Long.MIN_VALUE, PageRequest.of(0, 1, byBucketStart()))
                .next()
                .map(EnergyBucketEntity::getBucketStart)
                .doOnError(e -> log.error("Error fetching earliest bucket timestamp: {}", e.getMessage(), e));
    }

    private Mono<Void> rebuildHourly(long from, long to) {
        return rangeBuckets(from, to)
                .collectList()
                .map(buckets -> BucketRollups.rollUp(buckets, EnergyWindow.hourly(zone)))
                .flatMapMany(rollups -> hourlyRepository.saveAll(Flux.fromIterable(rollups).map(bucketMapper::mapToHourlyEntity)))
                .count()
                .doOnNext(count -> log.debug("Rebuilt {} hourly rollups in [{}, {})", count, from, to))
                .then();
    }

    private Mono<Void> rebuildDaily(long from, long to) {
        return rangeBuckets(from, to)
                .collectList()
                .map(buckets -> BucketRollups.rollUp(buckets, EnergyWindow.daily(zone)))
                .flatMapMany(rollups -> dailyRepository.saveAll(Flux.fromIterable(rollups).map(bucketMapper::mapToDailyEntity)))
                .count()
                .doOnNext(count -> log.debug("Rebuilt {} daily rollups in [{}, {})", count, from, to))
                .then();
    }

    private static long coveringEnd(EnergyWindow window, long to) {
        return window.endOf(window.startOf(to - 1));
    }

    private static Sort byBucketStart() {
        return Sort.by(ASC, BUCKET_START);
    }
}
