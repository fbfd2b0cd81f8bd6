package flultest.runner;

import java.util.Locale;

/**
 * Formats test durations: whole nanoseconds below 1µs, otherwise two decimals in the
 * largest unit that keeps the value below 1000 (µs, ms, s).
 */
public final class DurationFormat {

    private static final long MICRO = 1_000L;
    private static final long MILLI = 1_000_000L;
    private static final long SECOND = 1_000_000_000L;

    private DurationFormat() {}

    public static String format(long nanos) {
        if (nanos < MICRO) {
            return nanos + "ns";
        }
        if (nanos < MILLI) {
            return String.format(Locale.ROOT, "%.2fµs", nanos / (double) MICRO);
        }
        if (nanos < SECOND) {
            return String.format(Locale.ROOT, "%.2fms", nanos / (double) MILLI);
        }
        return String.format(Locale.ROOT, "%.2fs", nanos / (double) SECOND);
    }
}
