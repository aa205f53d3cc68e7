package dev.devanks.energy.rollup.store;

import dev.devanks.energy.rollup.mapper.ReadingMapper;
import dev.devanks.energy.rollup.model.EnergyReading;
import dev.devanks.energy.rollup.repository.EnergyReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static org.springframework.data.domain.Sort.Direction.ASC;
import static org.springframework.data.domain.Sort.Direction.DESC;

@Service
@RequiredArgsConstructor
@Slf4j
public class FirestoreReadingSource implements ReadingSource {

    private static final String TIMESTAMP = "timestamp";

    private final EnergyReadingRepository readingRepository;
    private final ReadingMapper readingMapper;

    @Override
    public Mono<EnergyReading> insert(EnergyReading reading) {
        var entity = readingMapper.mapToEntity(reading);
        return readingRepository.save(entity)
                .map(readingMapper::mapToModel)
                .doOnSuccess(saved -> log.debug("Saved reading ID: {}", entity.getId()))
                .doOnError(e -> log.error("Failed to save reading ID {}: {}", entity.getId(), e.getMessage(), e));
    }

    @Override
    public Flux<EnergyReading> rangeQuery(long from, long to) {
        log.debug("Fetching readings with timestamp in [{}, {})", from, to);
        return readingRepository.findByTimestampGreaterThanEqualAndTimestampLessThan(from, to, Sort.by(ASC, TIMESTAMP))
                .map(readingMapper::mapToModel)
                .doOnError(e -> log.error("Error fetching readings in [{}, {}): {}", from, to, e.getMessage(), e));
    }

    @Override
    public Mono<EnergyReading> before(long timestamp) {
        return readingRepository.findByTimestampLessThan(timestamp, PageRequest.of(0, 1, Sort.by(DESC, TIMESTAMP)))
                .next()
                .map(readingMapper::mapToModel)
                .doOnError(e -> log.error("Error fetching reading before {}: {}", timestamp, e.getMessage(), e));
    }

    @Override
    public Mono<EnergyReading> after(long timestamp) {
        return readingRepository.findByTimestampGreaterThan(timestamp, PageRequest.of(0, 1, Sort.by(ASC, TIMESTAMP)))
                .next()
                .map(readingMapper::mapToModel)
                .doOnError(e -> log.error("Error fetching reading after {}: {}", timestamp, e.getMessage(), e));
    }
}
