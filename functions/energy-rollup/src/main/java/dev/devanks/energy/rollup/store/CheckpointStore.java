package dev.devanks.energy.rollup.store;

import dev.devanks.energy.rollup.model.AggregationCheckpoint;
import reactor.core.publisher.Mono;

public interface CheckpointStore {

    Mono<AggregationCheckpoint> load(String jobId);

    Mono<AggregationCheckpoint> save(AggregationCheckpoint checkpoint);
}
