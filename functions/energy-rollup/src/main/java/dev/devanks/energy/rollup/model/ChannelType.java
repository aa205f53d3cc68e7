package dev.devanks.energy.rollup.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

public enum ChannelType {
    GRID("grid", EnergyReading::getGrid, EnergyBucket::getGridKwh),
    CAR("car", EnergyReading::getCar, EnergyBucket::getCarKwh),
    SOLAR("solar", EnergyReading::getSolar, EnergyBucket::getSolarKwh),
    HOME("home", EnergyReading::getHome, EnergyBucket::getHomeKwh);

    private final String id;
    private final ToDoubleFunction<EnergyReading> watts;
    private final ToDoubleFunction<EnergyBucket> kwh;

    ChannelType(String id, ToDoubleFunction<EnergyReading> watts, ToDoubleFunction<EnergyBucket> kwh) {
        this.id = id;
        this.watts = watts;
        this.kwh = kwh;
    }

    public String id() {
        return id;
    }

    public double wattsOf(EnergyReading reading) {
        return watts.applyAsDouble(reading);
    }

    public double kwhOf(EnergyBucket bucket) {
        return kwh.applyAsDouble(bucket);
    }

    public static ChannelType fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Energy type is required. Must be one of " + Arrays.toString(ids()));
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid energy type: " + value + ". Must be one of " + Arrays.toString(ids())));
    }

    private static String[] ids() {
        return Arrays.stream(values()).map(ChannelType::id).toArray(String[]::new);
    }
}
