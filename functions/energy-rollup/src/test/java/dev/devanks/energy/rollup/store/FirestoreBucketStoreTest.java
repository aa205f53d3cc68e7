package dev.devanks.energy.rollup.store;

import dev.devanks.energy.rollup.entity.EnergyBucketEntity;
import dev.devanks.energy.rollup.entity.EnergyDailyRollupEntity;
import dev.devanks.energy.rollup.entity.EnergyHourlyRollupEntity;
import dev.devanks.energy.rollup.mapper.BucketMapper;
import dev.devanks.energy.rollup.model.EnergyBucket;
import dev.devanks.energy.rollup.model.EnergyReading;
import dev.devanks.energy.rollup.repository.EnergyBucketRepository;
import dev.devanks.energy.rollup.repository.EnergyDailyRollupRepository;
import dev.devanks.energy.rollup.repository.EnergyHourlyRollupRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.reactivestreams.Publisher;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FirestoreBucketStore Unit Tests")
class FirestoreBucketStoreTest {

    private static final long HOUR0 = 1_699_999_200L; // 2023-11-14T22:00:00Z
    private static final long DAY0 = 1_699_920_000L;  // 2023-11-14T00:00:00Z
    private static final Sort BY_BUCKET_START = Sort.by(Sort.Direction.ASC, "bucketStart");

    @Mock
    private EnergyBucketRepository mockBucketRepository;

    @Mock
    private EnergyHourlyRollupRepository mockHourlyRepository;

    @Mock
    private EnergyDailyRollupRepository mockDailyRepository;

    @Mock
    private ReadingSource mockReadingSource;

    private final BucketMapper bucketMapper = new BucketMapper();

    private FirestoreBucketStore bucketStore;

    @BeforeEach
    void setUp() {
        bucketStore = new FirestoreBucketStore(mockBucketRepository, mockHourlyRepository, mockDailyRepository,
                mockReadingSource, bucketMapper, UTC);
    }

    private EnergyBucketEntity bucketEntity(long start, double homeKwh) {
        return bucketMapper.mapToEntity(EnergyBucket.builder()
                .bucketStart(start)
                .bucketEnd(start + 60)
                .homeKwh(homeKwh)
                .readingsCount(2)
                .firstTimestamp(start)
                .lastTimestamp(start + 30)
                .build());
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> captureHourlySaves() {
        List<T> saved = new ArrayList<>();
        when(mockHourlyRepository.saveAll(any(Publisher.class))).thenAnswer(invocation ->
                Flux.from((Publisher<T>) invocation.getArgument(0)).doOnNext(saved::add));
        return saved;
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> captureDailySaves() {
        List<T> saved = new ArrayList<>();
        when(mockDailyRepository.saveAll(any(Publisher.class))).thenAnswer(invocation ->
                Flux.from((Publisher<T>) invocation.getArgument(0)).doOnNext(saved::add));
        return saved;
    }

    @Test
    @DisplayName("upsertBucket: saves the bucket keyed by its start")
    void upsertBucket_keyedByStart() {
        // Arrange
        when(mockBucketRepository.save(any(EnergyBucketEntity.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        var bucket = bucketMapper.mapToModel(bucketEntity(HOUR0, 0.01));

        // Act & Assert
        StepVerifier.create(bucketStore.upsertBucket(bucket))
                .expectNext(bucket)
                .verifyComplete();
        var captor = ArgumentCaptor.forClass(EnergyBucketEntity.class);
        verify(mockBucketRepository).save(captor.capture());
        assertThat(captor.getValue().getId()).isEqualTo(String.valueOf(HOUR0));
    }

    @Test
    @DisplayName("latestBucketTimestamp: reads the newest bucket start, empty when there is none")
    void latestBucketTimestamp_newestOrEmpty() {
        // Arrange
        when(mockBucketRepository.findByBucketStartGreaterThanEqual(eq(Long.MIN_VALUE), any(Pageable.class)))
                .thenReturn(Flux.just(bucketEntity(HOUR0 + 600, 0)))
                .thenReturn(Flux.empty());

        // Act & Assert
        StepVerifier.create(bucketStore.latestBucketTimestamp()).expectNext(HOUR0 + 600).verifyComplete();
        StepVerifier.create(bucketStore.latestBucketTimestamp()).verifyComplete();
    }

    @Test
    @DisplayName("firstReadingBefore/After: delegate to the reading source")
    void anchors_delegateToReadingSource() {
        // Arrange
        var reading = EnergyReading.builder().timestamp(HOUR0 - 5).build();
        when(mockReadingSource.before(HOUR0)).thenReturn(Mono.just(reading));
        when(mockReadingSource.after(HOUR0)).thenReturn(Mono.empty());

        // Act & Assert
        StepVerifier.create(bucketStore.firstReadingBefore(HOUR0)).expectNext(reading).verifyComplete();
        StepVerifier.create(bucketStore.firstReadingAfter(HOUR0)).verifyComplete();
    }

    @Test
    @DisplayName("rebuildRollups(from, to): recomputes the whole hours and local days overlapping the range")
    void rebuildRollups_range_widensToWholeWindows() {
        // Arrange
        when(mockBucketRepository.findByBucketStartGreaterThanEqualAndBucketStartLessThan(HOUR0, HOUR0 + 3600, BY_BUCKET_START))
                .thenReturn(Flux.just(bucketEntity(HOUR0, 0.1), bucketEntity(HOUR0 + 60, 0.2)));
        when(mockBucketRepository.findByBucketStartGreaterThanEqualAndBucketStartLessThan(DAY0, DAY0 + 86_400, BY_BUCKET_START))
                .thenReturn(Flux.just(bucketEntity(HOUR0 - 3600, 0.5), bucketEntity(HOUR0, 0.1), bucketEntity(HOUR0 + 60, 0.2)));
        List<EnergyHourlyRollupEntity> hourly = captureHourlySaves();
        List<EnergyDailyRollupEntity> daily = captureDailySaves();

        // Act
        StepVerifier.create(bucketStore.rebuildRollups(HOUR0 + 60, HOUR0 + 120)).verifyComplete();

        // Assert
        assertThat(hourly).hasSize(1);
        assertThat(hourly.get(0).getId()).isEqualTo(String.valueOf(HOUR0));
        assertThat(hourly.get(0).getHomeKwh()).isCloseTo(0.3, within(1e-12));
        assertThat(daily).hasSize(1);
        assertThat(daily.get(0).getBucketStart()).isEqualTo(DAY0);
        assertThat(daily.get(0).getBucketEnd()).isEqualTo(DAY0 + 86_400);
        assertThat(daily.get(0).getHomeKwh()).isCloseTo(0.8, within(1e-12));
    }

    @Test
    @DisplayName("rebuildRollups(): rebuilds day by day from the oldest to the newest bucket")
    void rebuildRollups_all_walksDays() {
        // Arrange
        when(mockBucketRepository.findByBucketStartGreaterThanEqual(eq(Long.MIN_VALUE), any(Pageable.class)))
                .thenAnswer(invocation -> {
                    Pageable page = invocation.getArgument(1);
                    return page.getSort().getOrderFor("bucketStart").isAscending()
                            ? Flux.just(bucketEntity(HOUR0 - 86_400, 0.5))
                            : Flux.just(bucketEntity(HOUR0 + 60, 0.2));
                });
        when(mockBucketRepository.findByBucketStartGreaterThanEqualAndBucketStartLessThan(DAY0 - 86_400, DAY0, BY_BUCKET_START))
                .thenReturn(Flux.just(bucketEntity(HOUR0 - 86_400, 0.5)));
        when(mockBucketRepository.findByBucketStartGreaterThanEqualAndBucketStartLessThan(DAY0, DAY0 + 86_400, BY_BUCKET_START))
                .thenReturn(Flux.just(bucketEntity(HOUR0, 0.1), bucketEntity(HOUR0 + 60, 0.2)));
        List<EnergyHourlyRollupEntity> hourly = captureHourlySaves();
        List<EnergyDailyRollupEntity> daily = captureDailySaves();

        // Act
        StepVerifier.create(bucketStore.rebuildRollups()).verifyComplete();

        // Assert
        assertThat(hourly).extracting(EnergyHourlyRollupEntity::getBucketStart).containsExactly(HOUR0 - 86_400, HOUR0);
        assertThat(daily).extracting(EnergyDailyRollupEntity::getBucketStart).containsExactly(DAY0 - 86_400, DAY0);
        assertThat(daily.get(1).getHomeKwh()).isCloseTo(0.3, within(1e-12));
        verify(mockBucketRepository, never()).findAll();
    }

    @Test
    @DisplayName("rebuildRollups(): does nothing when there are no buckets")
    void rebuildRollups_all_noBuckets() {
        // Arrange
        when(mockBucketRepository.findByBucketStartGreaterThanEqual(eq(Long.MIN_VALUE), any(Pageable.class)))
                .thenReturn(Flux.empty());

        // Act & Assert
        StepVerifier.create(bucketStore.rebuildRollups()).verifyComplete();
        verify(mockHourlyRepository, never()).saveAll(any(Publisher.class));
    }

    @Test
    @DisplayName("hourlyRollup: reads stored rollups in window order")
    void hourlyRollup_readsStore() {
        // Arrange
        var rollup = EnergyHourlyRollupEntity.builder().id(String.valueOf(HOUR0)).bucketStart(HOUR0)
                .bucketEnd(HOUR0 + 3600).solarKwh(1.25).build();
        when(mockHourlyRepository.findByBucketStartGreaterThanEqualAndBucketStartLessThan(anyLong(), anyLong(), eq(BY_BUCKET_START)))
                .thenReturn(Flux.just(rollup));

        // Act & Assert
        StepVerifier.create(bucketStore.hourlyRollup(HOUR0, HOUR0 + 3600))
                .assertNext(bucket -> assertThat(bucket.getSolarKwh()).isEqualTo(1.25))
                .verifyComplete();
    }
}
