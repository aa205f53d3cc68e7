package dev.devanks.energy.rollup.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.rollup.entity.EnergyBucketEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface EnergyBucketRepository extends FirestoreReactiveRepository<EnergyBucketEntity> {

    Flux<EnergyBucketEntity> findByBucketStartGreaterThanEqualAndBucketStartLessThan(long from, long to, Sort sort);

    Flux<EnergyBucketEntity> findByBucketStartGreaterThanEqual(long from, Pageable pageable);
}
