package dev.devanks.energy.rollup.mapper;

import dev.devanks.energy.rollup.entity.AggregationCheckpointEntity;
import dev.devanks.energy.rollup.model.AggregationCheckpoint;
import org.springframework.stereotype.Component;

@Component
public class CheckpointMapper {

    public AggregationCheckpointEntity mapToEntity(AggregationCheckpoint checkpoint) {
        return AggregationCheckpointEntity.builder()
                .id(checkpoint.getJobId())
                .lastProcessedTimestamp(checkpoint.getLastProcessedTimestamp())
                .lastRunAt(checkpoint.getLastRunAt())
                .status(checkpoint.getStatus())
                .runGeneration(checkpoint.getRunGeneration())
                .rangeFrom(checkpoint.getRangeFrom())
                .rangeTo(checkpoint.getRangeTo())
                .build();
    }

    public AggregationCheckpoint mapToModel(AggregationCheckpointEntity entity) {
        return AggregationCheckpoint.builder()
                .jobId(entity.getId())
                .lastProcessedTimestamp(entity.getLastProcessedTimestamp())
                .lastRunAt(entity.getLastRunAt())
                .status(entity.getStatus())
                .runGeneration(entity.getRunGeneration())
                .rangeFrom(entity.getRangeFrom())
                .rangeTo(entity.getRangeTo())
                .build();
    }
}
