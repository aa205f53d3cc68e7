package dev.devanks.energy.rollup.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.rollup.entity.EnergyHourlyRollupEntity;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface EnergyHourlyRollupRepository extends FirestoreReactiveRepository<EnergyHourlyRollupEntity> {

    Flux<EnergyHourlyRollupEntity> findByBucketStartGreaterThanEqualAndBucketStartLessThan(long from, long to, Sort sort);
}
