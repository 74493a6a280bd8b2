package dev.dataprep.sink;

import java.util.Locale;

public final class ByteSizes {

    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private ByteSizes() {}

    /** e.g. {@code 1536 -> "1.50 KB"}. Units step by 1024 and stop at GB. */
    public static String humanReadable(long bytes) {
        double value = Math.max(0, bytes);
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", value, UNITS[unit]);
    }
}
