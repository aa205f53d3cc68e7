package dev.devanks.energy.rollup.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.rollup.model.TimeRange;
import dev.devanks.energy.rollup.service.BucketAggregationJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class RollupFunction {

    static final String BACKFILL_FROM = "backfillFrom";
    static final String BACKFILL_TO = "backfillTo";

    private final BucketAggregationJob aggregationJob;
    private final Clock clock;

    /**
     * Main function bean: energyRollup. An empty payload rolls up the latest minutes; a payload with
     * 'backfillFrom' (and optionally 'backfillTo') re-aggregates that range.
     */
    @Bean
    public Function<HashMap<String, Object>, String> energyRollup() {
        return payload -> {
            log.info("energyRollup function triggered with payload: {}", payload);

            if (payload == null || payload.isEmpty() || !payload.containsKey(BACKFILL_FROM)) {
                return aggregationJob.run().block();
            }

            return backfillForGivenRange(payload);
        };
    }

    private String backfillForGivenRange(HashMap<String, Object> payload) {
        TimeRange range;
        try {
            range = parseBackfillRange(payload);
        } catch (Exception e) {
            log.error("Error processing backfill range from payload: {}. Details: {}", payload, e.getMessage(), e);
            return "Error: Invalid backfill range in payload. Use ISO-8601 instants for '" + BACKFILL_FROM
                    + "' and '" + BACKFILL_TO + "'. Details: " + e.getMessage();
        }
        return backfill(range).block();
    }

    @VisibleForTesting
    Mono<String> backfill(TimeRange range) {
        log.info("Payload-driven backfill: Requesting re-aggregation of [{}, {}).",
                Instant.ofEpochSecond(range.getFrom()), Instant.ofEpochSecond(range.getTo()));
        return aggregationJob.backfill(range.getFrom(), range.getTo());
    }

    /**
     * Reads the backfill range; a missing 'backfillTo' means now.
     */
    @VisibleForTesting
    TimeRange parseBackfillRange(Map<String, Object> payload) {
        var from = Instant.parse((String) payload.get(BACKFILL_FROM));
        var toValue = (String) payload.get(BACKFILL_TO);
        var to = toValue == null || toValue.isBlank() ? clock.instant() : Instant.parse(toValue);
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("'" + BACKFILL_FROM + "' (" + from + ") must be before '"
                    + BACKFILL_TO + "' (" + to + ")");
        }
        return new TimeRange(from.getEpochSecond(), to.getEpochSecond());
    }
}
