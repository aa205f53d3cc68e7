package dev.devanks.energy.rollup.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "energy_readings")
public class EnergyReadingEntity {
    @DocumentId
    private String id;

    private long timestamp;
    private double home;
    private double grid;
    private double car;
    private double solar;
}
