package dev.devanks.energy.rollup.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.rollup.entity.EnergyReadingEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface EnergyReadingRepository extends FirestoreReactiveRepository<EnergyReadingEntity> {

    Flux<EnergyReadingEntity> findByTimestampGreaterThanEqualAndTimestampLessThan(long from, long to, Sort sort);

    Flux<EnergyReadingEntity> findByTimestampLessThan(long timestamp, Pageable pageable);

    Flux<EnergyReadingEntity> findByTimestampGreaterThan(long timestamp, Pageable pageable);
}
