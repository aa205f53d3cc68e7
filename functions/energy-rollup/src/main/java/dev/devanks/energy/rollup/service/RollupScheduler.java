package dev.devanks.energy.rollup.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "energy.rollup", name = "scheduling-enabled", havingValue = "true")
public class RollupScheduler {

    private final BucketAggregationJob aggregationJob;

    @Scheduled(cron = "${energy.rollup.schedule-cron:0 * * * * *}")
    public void triggerAggregation() {
        log.info("Scheduled minute aggregation triggered.");
        try {
            var summary = aggregationJob.run().block();
            log.info("Scheduled minute aggregation finished: {}", summary);
        } catch (RuntimeException e) {
            // the next tick resumes from the last persisted checkpoint
            log.error("Scheduled minute aggregation failed: {}", e.getMessage(), e);
            throw e;
        }
    }
}
