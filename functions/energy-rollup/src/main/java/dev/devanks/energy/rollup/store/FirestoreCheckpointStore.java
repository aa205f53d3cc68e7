package dev.devanks.energy.rollup.store;

import dev.devanks.energy.rollup.mapper.CheckpointMapper;
import dev.devanks.energy.rollup.model.AggregationCheckpoint;
import dev.devanks.energy.rollup.repository.AggregationCheckpointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
@Slf4j
public class FirestoreCheckpointStore implements CheckpointStore {

    private final AggregationCheckpointRepository checkpointRepository;
    private final CheckpointMapper checkpointMapper;

    @Override
    public Mono<AggregationCheckpoint> load(String jobId) {
        return checkpointRepository.findById(jobId)
                .map(checkpointMapper::mapToModel)
                .doOnError(e -> log.error("Error loading checkpoint {}: {}", jobId, e.getMessage(), e));
    }

    @Override
    public Mono<AggregationCheckpoint> save(AggregationCheckpoint checkpoint) {
        return checkpointRepository.save(checkpointMapper.mapToEntity(checkpoint))
                .map(checkpointMapper::mapToModel)
                .doOnSuccess(saved -> log.debug("Saved checkpoint: {}", saved))
                .doOnError(e -> log.error("Failed to save checkpoint {}: {}", checkpoint.getJobId(), e.getMessage(), e));
    }
}
