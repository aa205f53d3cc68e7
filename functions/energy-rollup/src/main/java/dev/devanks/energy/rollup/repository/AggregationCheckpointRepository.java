package dev.devanks.energy.rollup.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.rollup.entity.AggregationCheckpointEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface AggregationCheckpointRepository extends FirestoreReactiveRepository<AggregationCheckpointEntity> {
}
