package dev.devanks.energy.rollup.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the in-process trigger for the minute rollup. Deployments driven by Cloud Scheduler
 * leave this off and call the {@code energyRollup} function instead.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "energy.rollup", name = "scheduling-enabled", havingValue = "true")
public class SchedulingConfig {
}
