package dev.devanks.energy.rollup.mapper;

import dev.devanks.energy.rollup.entity.EnergyBucketEntity;
import dev.devanks.energy.rollup.entity.EnergyDailyRollupEntity;
import dev.devanks.energy.rollup.entity.EnergyHourlyRollupEntity;
import dev.devanks.energy.rollup.model.EnergyBucket;
import org.springframework.stereotype.Component;

/**
 * Maps minute buckets and their hourly/daily rollups between the model and Firestore documents.
 * All three collections key documents by the window start.
 */
@Component
public class BucketMapper {

    public EnergyBucketEntity mapToEntity(EnergyBucket bucket) {
        return EnergyBucketEntity.builder()
                .id(documentId(bucket))
                .bucketStart(bucket.getBucketStart())
                .bucketEnd(bucket.getBucketEnd())
                .homeKwh(bucket.getHomeKwh())
                .gridKwh(bucket.getGridKwh())
                .carKwh(bucket.getCarKwh())
                .solarKwh(bucket.getSolarKwh())
                .readingsCount(bucket.getReadingsCount())
                .firstTimestamp(bucket.getFirstTimestamp())
                .lastTimestamp(bucket.getLastTimestamp())
                .firstHome(bucket.getFirstHome())
                .firstGrid(bucket.getFirstGrid())
                .firstCar(bucket.getFirstCar())
                .firstSolar(bucket.getFirstSolar())
                .lastHome(bucket.getLastHome())
                .lastGrid(bucket.getLastGrid())
                .lastCar(bucket.getLastCar())
                .lastSolar(bucket.getLastSolar())
                .build();
    }

    public EnergyBucket mapToModel(EnergyBucketEntity entity) {
        return EnergyBucket.builder()
                .bucketStart(entity.getBucketStart())
                .bucketEnd(entity.getBucketEnd())
                .homeKwh(entity.getHomeKwh())
                .gridKwh(entity.getGridKwh())
                .carKwh(entity.getCarKwh())
                .solarKwh(entity.getSolarKwh())
                .readingsCount(entity.getReadingsCount())
                .firstTimestamp(entity.getFirstTimestamp())
                .lastTimestamp(entity.getLastTimestamp())
                .firstHome(entity.getFirstHome())
                .firstGrid(entity.getFirstGrid())
                .firstCar(entity.getFirstCar())
                .firstSolar(entity.getFirstSolar())
                .lastHome(entity.getLastHome())
                .lastGrid(entity.getLastGrid())
                .lastCar(entity.getLastCar())
                .lastSolar(entity.getLastSolar())
                .build();
    }

    public EnergyHourlyRollupEntity mapToHourlyEntity(EnergyBucket rollup) {
        return EnergyHourlyRollupEntity.builder()
                .id(documentId(rollup))
                .bucketStart(rollup.getBucketStart())
                .bucketEnd(rollup.getBucketEnd())
                .homeKwh(rollup.getHomeKwh())
                .gridKwh(rollup.getGridKwh())
                .carKwh(rollup.getCarKwh())
                .solarKwh(rollup.getSolarKwh())
                .readingsCount(rollup.getReadingsCount())
                .firstTimestamp(rollup.getFirstTimestamp())
                .lastTimestamp(rollup.getLastTimestamp())
                .firstHome(rollup.getFirstHome())
                .firstGrid(rollup.getFirstGrid())
                .firstCar(rollup.getFirstCar())
                .firstSolar(rollup.getFirstSolar())
                .lastHome(rollup.getLastHome())
                .lastGrid(rollup.getLastGrid())
                .lastCar(rollup.getLastCar())
                .lastSolar(rollup.getLastSolar())
                .build();
    }

    public EnergyBucket mapToModel(EnergyHourlyRollupEntity entity) {
        return EnergyBucket.builder()
                .bucketStart(entity.getBucketStart())
                .bucketEnd(entity.getBucketEnd())
                .homeKwh(entity.getHomeKwh())
                .gridKwh(entity.getGridKwh())
                .carKwh(entity.getCarKwh())
                .solarKwh(entity.getSolarKwh())
                .readingsCount(entity.getReadingsCount())
                .firstTimestamp(entity.getFirstTimestamp())
                .lastTimestamp(entity.getLastTimestamp())
                .firstHome(entity.getFirstHome())
                .firstGrid(entity.getFirstGrid())
                .firstCar(entity.getFirstCar())
                .firstSolar(entity.getFirstSolar())
                .lastHome(entity.getLastHome())
                .lastGrid(entity.getLastGrid())
                .lastCar(entity.getLastCar())
                .lastSolar(entity.getLastSolar())
                .build();
    }

    public EnergyDailyRollupEntity mapToDailyEntity(EnergyBucket rollup) {
        return EnergyDailyRollupEntity.builder()
                .id(documentId(rollup))
                .bucketStart(rollup.getBucketStart())
                .bucketEnd(rollup.getBucketEnd())
                .homeKwh(rollup.getHomeKwh())
                .gridKwh(rollup.getGridKwh())
                .carKwh(rollup.getCarKwh())
                .solarKwh(rollup.getSolarKwh())
                .readingsCount(rollup.getReadingsCount())
                .firstTimestamp(rollup.getFirstTimestamp())
                .lastTimestamp(rollup.getLastTimestamp())
                .firstHome(rollup.getFirstHome())
                .firstGrid(rollup.getFirstGrid())
                .firstCar(rollup.getFirstCar())
                .firstSolar(rollup.getFirstSolar())
                .lastHome(rollup.getLastHome())
                .lastGrid(rollup.getLastGrid())
                .lastCar(rollup.getLastCar())
                .lastSolar(rollup.getLastSolar())
                .build();
    }

    public EnergyBucket mapToModel(EnergyDailyRollupEntity entity) {
        return EnergyBucket.builder()
                .bucketStart(entity.getBucketStart())
                .bucketEnd(entity.getBucketEnd())
                .homeKwh(entity.getHomeKwh())
                .gridKwh(entity.getGridKwh())
                .carKwh(entity.getCarKwh())
                .solarKwh(entity.getSolarKwh())
                .readingsCount(entity.getReadingsCount())
                .firstTimestamp(entity.getFirstTimestamp())
                .lastTimestamp(entity.getLastTimestamp())
                .firstHome(entity.getFirstHome())
                .firstGrid(entity.getFirstGrid())
                .firstCar(entity.getFirstCar())
                .firstSolar(entity.getFirstSolar())
                .lastHome(entity.getLastHome())
                .lastGrid(entity.getLastGrid())
                .lastCar(entity.getLastCar())
                .lastSolar(entity.getLastSolar())
                .build();
    }

    private static String documentId(EnergyBucket bucket) {
        return String.valueOf(bucket.getBucketStart());
    }
}
