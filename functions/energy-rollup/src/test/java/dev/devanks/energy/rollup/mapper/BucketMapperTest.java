package dev.devanks.energy.rollup.mapper;

import dev.devanks.energy.rollup.model.EnergyBucket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BucketMapperTest {

    private final BucketMapper bucketMapper = new BucketMapper(); // No dependencies

    private final EnergyBucket bucket = EnergyBucket.builder()
            .bucketStart(1_699_999_980L)
            .bucketEnd(1_700_000_040L)
            .homeKwh(0.01)
            .gridKwh(-0.02)
            .carKwh(0.03)
            .solarKwh(0.04)
            .readingsCount(4)
            .firstTimestamp(1_699_999_981L)
            .lastTimestamp(1_700_000_035L)
            .firstHome(1).firstGrid(-2).firstCar(3).firstSolar(4)
            .lastHome(5).lastGrid(-6).lastCar(7).lastSolar(8)
            .build();

    @Test
    @DisplayName("mapToEntity - document id is the bucket start")
    void mapToEntity_idIsBucketStart() {
        var entity = bucketMapper.mapToEntity(bucket);

        assertThat(entity.getId()).isEqualTo("1699999980");
        assertThat(entity.getGridKwh()).isEqualTo(-0.02);
        assertThat(entity.getLastSolar()).isEqualTo(8);
        assertThat(bucketMapper.mapToModel(entity)).isEqualTo(bucket);
    }

    @Test
    @DisplayName("mapToHourlyEntity/mapToDailyEntity - rollups keep every field")
    void rollupEntities_keepFields() {
        assertThat(bucketMapper.mapToModel(bucketMapper.mapToHourlyEntity(bucket))).isEqualTo(bucket);
        assertThat(bucketMapper.mapToModel(bucketMapper.mapToDailyEntity(bucket))).isEqualTo(bucket);
        assertThat(bucketMapper.mapToDailyEntity(bucket).getId()).isEqualTo("1699999980");
    }
}
