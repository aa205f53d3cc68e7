package dev.devanks.energy.rollup.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.rollup.entity.EnergyDailyRollupEntity;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface EnergyDailyRollupRepository extends FirestoreReactiveRepository<EnergyDailyRollupEntity> {

    Flux<EnergyDailyRollupEntity> findByBucketStartGreaterThanEqualAndBucketStartLessThan(long from, long to, Sort sort);
}
