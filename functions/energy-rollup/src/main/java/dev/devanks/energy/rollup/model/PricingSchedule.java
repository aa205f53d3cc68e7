package dev.devanks.energy.rollup.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PricingSchedule {
    double producingPrice;
    @Singular
    List<ConsumingPeriod> periods;
}
