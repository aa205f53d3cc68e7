package dev.devanks.energy.rollup.model;

/**
 * How kWh are turned into money: consumption follows the time-of-day periods, feed-in the flat
 * producing price.
 */
public enum PricingMode {
    CONSUMPTION, FEED_IN
}
