package dev.devanks.energy.rollup.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import dev.devanks.energy.rollup.model.AggregationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "energy_aggregation_checkpoints")
public class AggregationCheckpointEntity {
    @DocumentId
    @NonNull
    private String id;
    private long lastProcessedTimestamp;
    private long lastRunAt;
    private AggregationStatus status;
    private long runGeneration;
    private Long rangeFrom;
    private Long rangeTo;
}
