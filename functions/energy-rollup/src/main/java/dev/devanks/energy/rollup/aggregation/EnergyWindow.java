package dev.devanks.energy.rollup.aggregation;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.function.LongFunction;
import java.util.function.LongUnaryOperator;

/**
 * Fixed calendar window used to group samples and buckets. Hour windows are aligned to whole
 * epoch hours; day windows start at local midnight of the configured zone.
 */
public final class EnergyWindow {

    private static final long HOUR_SECONDS = 3600;
    private static final DateTimeFormatter DAY_LABEL = DateTimeFormatter.ofPattern("MMM d", Locale.US);

    private final LongUnaryOperator startOf;
    private final LongUnaryOperator endOf;
    private final LongFunction<String> label;

    private EnergyWindow(LongUnaryOperator startOf, LongUnaryOperator endOf, LongFunction<String> label) {
        this.startOf = startOf;
        this.endOf = endOf;
        this.label = label;
    }

    public static EnergyWindow hourly(ZoneId zone) {
        return new EnergyWindow(
                timestamp -> Math.floorDiv(timestamp, HOUR_SECONDS) * HOUR_SECONDS,
                start -> start + HOUR_SECONDS,
                start -> String.format(Locale.ROOT, "%02d:00", Instant.ofEpochSecond(start).atZone(zone).getHour()));
    }

    public static EnergyWindow daily(ZoneId zone) {
        return new EnergyWindow(
                timestamp -> localDate(timestamp, zone).atStartOfDay(zone).toEpochSecond(),
                start -> localDate(start, zone).plusDays(1).atStartOfDay(zone).toEpochSecond(),
                start -> localDate(start, zone).format(DAY_LABEL));
    }

    /**
     * Start of the window containing {@code timestamp}.
     */
    public long startOf(long timestamp) {
        return startOf.applyAsLong(timestamp);
    }

    /**
     * Exclusive end of the window starting at {@code windowStart}.
     */
    public long endOf(long windowStart) {
        return endOf.applyAsLong(windowStart);
    }

    public String label(long windowStart) {
        return label.apply(windowStart);
    }

    private static LocalDate localDate(long timestamp, ZoneId zone) {
        return Instant.ofEpochSecond(timestamp).atZone(zone).toLocalDate();
    }
}
