package dev.devanks.energy.rollup.model;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Locale;

/**
 * Named dashboard ranges. {@code day} and {@code yesterday} are charted per hour, the longer
 * ranges per local day.
 */
public enum Timeframe {
    DAY(Granularity.HOUR),
    YESTERDAY(Granularity.HOUR),
    WEEK(Granularity.DAY),
    MONTH(Granularity.DAY);

    private final Granularity granularity;

    Timeframe(Granularity granularity) {
        this.granularity = granularity;
    }

    public Granularity granularity() {
        return granularity;
    }

    public TimeRange bounds(Clock clock, ZoneId zone) {
        var now = clock.instant().getEpochSecond();
        var today = LocalDate.now(clock.withZone(zone));
        var startOfToday = startOf(today, zone);
        switch (this) {
            case DAY:
                return new TimeRange(startOfToday, now);
            case YESTERDAY:
                return new TimeRange(startOf(today.minusDays(1), zone), startOfToday);
            case WEEK:
                return new TimeRange(startOf(today.minusDays(7), zone), now);
            case MONTH:
                return new TimeRange(startOf(today.withDayOfMonth(1), zone), now);
            default:
                throw new IllegalStateException("Unhandled timeframe " + this);
        }
    }

    public static Timeframe fromName(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(timeframe -> timeframe.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid timeframe: " + value));
    }

    private static long startOf(LocalDate date, ZoneId zone) {
        return date.atStartOfDay(zone).toEpochSecond();
    }
}
