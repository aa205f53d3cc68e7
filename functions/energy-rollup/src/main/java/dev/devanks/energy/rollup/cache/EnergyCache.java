package dev.devanks.energy.rollup.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key/value cache for query results. Callers treat every failure as a miss.
 * <p>
 * The Guava implementation lives in one process: when the rollup and query functions run as
 * separate instances, an invalidation from the rollup side never reaches the query side, and
 * cached results stay stale until their TTL ({@code energy.query.cache-ttl}) runs out.
 */
public interface EnergyCache {

    /**
     * @return the cached value, or empty on a miss or an expired entry.
     */
    <T> Mono<T> get(String key, Class<T> type);

    Mono<Void> set(String key, Object value, Duration ttl);

    /**
     * Removes every key matching a glob pattern, where {@code *} matches any run of characters
     * and {@code ?} a single one.
     */
    Mono<Void> invalidatePattern(String pattern);
}
