package dev.devanks.energy.rollup.model;

import dev.devanks.energy.rollup.aggregation.EnergyWindow;

import java.time.ZoneId;

public enum Granularity {
    HOUR, DAY;

    public EnergyWindow window(ZoneId zone) {
        return this == HOUR ? EnergyWindow.hourly(zone) : EnergyWindow.daily(zone);
    }
}
