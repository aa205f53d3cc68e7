package dev.devanks.energy.rollup.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One calendar minute of readings. The document id is the bucket start, so saving a recomputed
 * bucket replaces the previous document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "energy_buckets")
public class EnergyBucketEntity {
    @DocumentId
    private String id;

    private long bucketStart;
    private long bucketEnd;
    private double homeKwh;
    private double gridKwh;
    private double carKwh;
    private double solarKwh;
    private long readingsCount;
    private long firstTimestamp;
    private long lastTimestamp;
    private double firstHome;
    private double firstGrid;
    private double firstCar;
    private double firstSolar;
    private double lastHome;
    private double lastGrid;
    private double lastCar;
    private double lastSolar;
}
