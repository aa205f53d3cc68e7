package dev.devanks.energy.rollup.service;

import dev.devanks.energy.rollup.model.AggregatedDataPoint;
import dev.devanks.energy.rollup.model.AggregatedResponse;
import dev.devanks.energy.rollup.model.ConsumingPeriod;
import dev.devanks.energy.rollup.model.PricedDataPoint;
import dev.devanks.energy.rollup.model.PricedResponse;
import dev.devanks.energy.rollup.model.PricingMode;
import dev.devanks.energy.rollup.model.PricingSchedule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.OptionalDouble;

/**
 * Turns energy into money using a time-of-day tariff for consumption and a flat price for feed-in.
 * Periods are matched against the minute of the local day; the first match wins.
 */
@Component
@RequiredArgsConstructor
public class PriceCalculator {

    private final ZoneId zone;

    /**
     * Cost of {@code kwh} drawn at {@code timestamp}. Returns 0 without a schedule or for
     * non-positive energy.
     */
    public double consumptionCost(double kwh, long timestamp, PricingSchedule schedule) {
        if (schedule == null || kwh <= 0) {
            return 0;
        }
        return kwh * consumptionPrice(timestamp, schedule).orElse(0);
    }

    /**
     * Revenue for {@code kwh} fed into the grid, at the flat producing price.
     */
    public double feedInCost(double kwh, PricingSchedule schedule) {
        if (schedule == null || kwh <= 0) {
            return 0;
        }
        return kwh * schedule.getProducingPrice();
    }

    /**
     * The unit price in force at {@code timestamp}, or empty when the schedule cannot price it.
     */
    public OptionalDouble priceAt(long timestamp, PricingMode mode, PricingSchedule schedule) {
        if (schedule == null) {
            return OptionalDouble.empty();
        }
        return mode == PricingMode.FEED_IN
                ? OptionalDouble.of(schedule.getProducingPrice())
                : consumptionPrice(timestamp, schedule);
    }

    /**
     * Prices every data point of an aggregation at the start of its window.
     */
    public PricedResponse price(AggregatedResponse response, PricingMode mode, PricingSchedule schedule) {
        var data = response.getData().stream()
                .map(point -> new PricedDataPoint(point.getLabel(), point.getKwh(), cost(point, mode, schedule),
                        point.getTimestamp()))
                .toList();
        var totalCost = data.stream().mapToDouble(PricedDataPoint::getCost).sum();
        return new PricedResponse(data, response.getTotal(), totalCost);
    }

    private double cost(AggregatedDataPoint point, PricingMode mode, PricingSchedule schedule) {
        return mode == PricingMode.FEED_IN
                ? feedInCost(point.getKwh(), schedule)
                : consumptionCost(point.getKwh(), point.getTimestamp(), schedule);
    }

    private OptionalDouble consumptionPrice(long timestamp, PricingSchedule schedule) {
        var periods = schedule.getPeriods();
        if (periods.isEmpty()) {
            return OptionalDouble.empty();
        }
        var localTime = Instant.ofEpochSecond(timestamp).atZone(zone).toLocalTime();
        var minuteOfDay = localTime.getHour() * 60 + localTime.getMinute();
        var price = periods.stream()
                .filter(period -> period.contains(minuteOfDay))
                .mapToDouble(ConsumingPeriod::getPrice)
                .findFirst()
                // uncovered minutes fall back to the first period's price
                .orElse(periods.get(0).getPrice());
        return OptionalDouble.of(price);
    }
}
