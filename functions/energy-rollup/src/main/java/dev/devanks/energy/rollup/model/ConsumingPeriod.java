package dev.devanks.energy.rollup.model;

import lombok.Value;

/**
 * Consumption price applied between two minutes of the local day. A period whose start lies after
 * its end wraps midnight, e.g. 22:00 to 06:00.
 */
@Value
public class ConsumingPeriod {
    int startMinute;
    int endMinute;
    double price;

    public boolean contains(int minuteOfDay) {
        if (startMinute <= minuteOfDay && minuteOfDay < endMinute) {
            return true;
        }
        return startMinute > endMinute && (minuteOfDay >= startMinute || minuteOfDay < endMinute);
    }
}
