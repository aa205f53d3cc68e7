package dev.devanks.energy.rollup.aggregation;

public final class Minutes {

    public static final long MINUTE_SECONDS = 60;

    private Minutes() {
    }

    public static long floorToMinute(long timestamp) {
        return Math.floorDiv(timestamp, MINUTE_SECONDS) * MINUTE_SECONDS;
    }

    public static boolean isMinuteAligned(long timestamp) {
        return Math.floorMod(timestamp, MINUTE_SECONDS) == 0;
    }
}
