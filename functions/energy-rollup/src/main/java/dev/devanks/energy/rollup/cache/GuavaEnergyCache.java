package dev.devanks.energy.rollup.cache;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import dev.devanks.energy.rollup.config.EnergyRollupProperties;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * In-process cache backed by Guava. Each entry carries its own deadline so callers can pick a TTL
 * per key. Failures are logged and reported as a miss.
 */
@Component
@Slf4j
public class GuavaEnergyCache implements EnergyCache {

    private final Cache<String, Entry> cache;
    private final Clock clock;

    public GuavaEnergyCache(EnergyRollupProperties properties, Clock clock) {
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(properties.getCache().getMaximumSize())
                .build();
        this.clock = clock;
    }

    @Override
    public <T> Mono<T> get(String key, Class<T> type) {
        return Mono.fromCallable(() -> {
            var entry = cache.getIfPresent(key);
            if (entry == null) {
                return null;
            }
            if (!clock.instant().isBefore(entry.getExpiresAt())) {
                cache.invalidate(key);
                return null;
            }
            return type.cast(entry.getValue());
        }).onErrorResume(e -> {
            log.warn("Cache read failed for {}: {}", key, e.getMessage());
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> set(String key, Object value, Duration ttl) {
        return Mono.fromRunnable(() -> {
            cache.put(key, new Entry(value, clock.instant().plus(ttl)));
            log.debug("Cached {} for {}", key, ttl);
        }).onErrorResume(e -> {
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
            return Mono.empty();
        }).then();
    }

    @Override
    public Mono<Void> invalidatePattern(String pattern) {
        return Mono.fromRunnable(() -> {
            var matcher = globToRegex(pattern);
            var before = cache.size();
            cache.asMap().keySet().removeIf(key -> matcher.matcher(key).matches());
            log.debug("Invalidated {} cache entries matching {}", before - cache.size(), pattern);
        }).onErrorResume(e -> {
            log.warn("Cache invalidation failed for {}: {}", pattern, e.getMessage());
            return Mono.empty();
        }).then();
    }

    @VisibleForTesting
    static Pattern globToRegex(String glob) {
        var regex = new StringBuilder();
        var literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    @VisibleForTesting
    long size() {
        return cache.size();
    }

    @Value
    private static class Entry {
        Object value;
        Instant expiresAt;
    }
}
