package dev.devanks.energy.rollup.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@Slf4j
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId energyZone(EnergyRollupProperties properties) {
        var configured = properties.getZoneId();
        var zone = configured == null || configured.isBlank() ? ZoneId.systemDefault() : ZoneId.of(configured);
        log.info("Using zone {} for energy windows and pricing.", zone);
        return zone;
    }
}
