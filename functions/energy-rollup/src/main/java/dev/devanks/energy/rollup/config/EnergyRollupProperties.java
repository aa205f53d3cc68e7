package dev.devanks.energy.rollup.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "energy")
public class EnergyRollupProperties {

    /**
     * Zone used for local day windows, hour labels and time-of-day pricing. Blank means the JVM
     * default zone.
     */
    private String zoneId;

    @Data
    @Validated
    public static class RollupProperties {
        private boolean enabled = true;
        private boolean schedulingEnabled = false;
        @NotEmpty
        private String scheduleCron = "0 * * * * *";
        // Minutes between two checkpoint writes
        @Min(1)
        private int checkpointInterval = 10;
        // Minute buckets computed in parallel; checkpoints still advance in minute order
        @Min(1)
        private int concurrency = 1;
        // How far back a first run starts when no readings exist yet
        @NotNull
        private Duration seedLookback = Duration.ofHours(24);
    }

    @Data
    @Validated
    public static class QueryProperties {
        // Ranges at least this long are served from minute buckets
        @Min(60)
        private long bucketThresholdSeconds = 3600;
        @NotNull
        private Duration cacheTtl = Duration.ofMinutes(5);
    }

    @Data
    @Validated
    public static class CacheProperties {
        @Min(1)
        private long maximumSize = 10_000;
    }

    @Valid
    @NotNull
    private RollupProperties rollup = new RollupProperties();

    @Valid
    @NotNull
    private QueryProperties query = new QueryProperties();

    @Valid
    @NotNull
    private CacheProperties cache = new CacheProperties();
}
