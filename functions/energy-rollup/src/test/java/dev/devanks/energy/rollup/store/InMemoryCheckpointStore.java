package dev.devanks.energy.rollup.store;

import dev.devanks.energy.rollup.model.AggregationCheckpoint;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Map-backed {@link CheckpointStore} that records every write in order.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, AggregationCheckpoint> checkpoints = new ConcurrentHashMap<>();
    private final List<AggregationCheckpoint> saves = new CopyOnWriteArrayList<>();

    public InMemoryCheckpointStore put(AggregationCheckpoint checkpoint) {
        checkpoints.put(checkpoint.getJobId(), checkpoint);
        return this;
    }

    public AggregationCheckpoint get(String jobId) {
        return checkpoints.get(jobId);
    }

    public List<AggregationCheckpoint> saves() {
        return saves;
    }

    @Override
    public Mono<AggregationCheckpoint> load(String jobId) {
        return Mono.fromCallable(() -> checkpoints.get(jobId));
    }

    @Override
    public Mono<AggregationCheckpoint> save(AggregationCheckpoint checkpoint) {
        return Mono.fromCallable(() -> {
            checkpoints.put(checkpoint.getJobId(), checkpoint);
            saves.add(checkpoint);
            return checkpoint;
        });
    }
}
