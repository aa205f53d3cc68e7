package dev.devanks.energy.rollup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of the aggregated energy function. {@code start}/{@code end} are epoch seconds and,
 * when both are present, override the timeframe's bounds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnergyQueryRequest {
    private String type;
    private String timeframe;
    private Long start;
    private Long end;
}
