package dev.devanks.energy.rollup.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.energy.rollup.model.ChannelType;
import dev.devanks.energy.rollup.model.EnergyAggregation;
import dev.devanks.energy.rollup.model.EnergyQueryRequest;
import dev.devanks.energy.rollup.model.TimeRange;
import dev.devanks.energy.rollup.model.Timeframe;
import dev.devanks.energy.rollup.service.EnergyQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.ZoneId;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class EnergyQueryFunction {

    private final EnergyQueryService queryService;
    private final Clock clock;
    private final ZoneId zone;

    /**
     * Function bean: aggregatedEnergy. Invalid types or timeframes, and a range with only one of
     * 'start'/'end', are rejected with an {@link IllegalArgumentException}.
     */
    @Bean
    public Function<EnergyQueryRequest, EnergyAggregation> aggregatedEnergy() {
        return request -> {
            log.info("aggregatedEnergy function triggered with request: {}", request);
            return aggregate(request).block();
        };
    }

    @VisibleForTesting
    Mono<EnergyAggregation> aggregate(EnergyQueryRequest request) {
        var channel = ChannelType.fromId(request.getType());
        var timeframe = Timeframe.fromName(request.getTimeframe());
        var range = resolveRange(request, timeframe);
        log.debug("Resolved {} {} to [{}, {}) at {} granularity.", channel.id(), timeframe, range.getFrom(), range.getTo(),
                timeframe.granularity());
        return queryService.getAggregatedEnergyData(range.getFrom(), range.getTo(), timeframe.granularity(), channel);
    }

    private TimeRange resolveRange(EnergyQueryRequest request, Timeframe timeframe) {
        if (request.getStart() == null && request.getEnd() == null) {
            return timeframe.bounds(clock, zone);
        }
        if (request.getStart() == null || request.getEnd() == null) {
            throw new IllegalArgumentException("Both 'start' and 'end' are required for an explicit range, got start="
                    + request.getStart() + " and end=" + request.getEnd());
        }
        return new TimeRange(request.getStart(), request.getEnd());
    }
}
