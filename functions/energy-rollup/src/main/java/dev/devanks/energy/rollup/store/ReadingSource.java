package dev.devanks.energy.rollup.store;

import dev.devanks.energy.rollup.model.EnergyReading;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only store of raw readings.
 */
public interface ReadingSource {

    Mono<EnergyReading> insert(EnergyReading reading);

    /**
     * Readings with {@code from <= timestamp < to}, ascending by timestamp.
     */
    Flux<EnergyReading> rangeQuery(long from, long to);

    /**
     * The latest reading strictly before {@code timestamp}, or empty.
     */
    Mono<EnergyReading> before(long timestamp);

    /**
     * The earliest reading strictly after {@code timestamp}, or empty.
     */
    Mono<EnergyReading> after(long timestamp);

    default Mono<EnergyReading> earliest() {
        return after(Long.MIN_VALUE);
    }
}
