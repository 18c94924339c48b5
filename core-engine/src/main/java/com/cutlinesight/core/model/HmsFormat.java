package com.cutlinesight.core.model;

/**
 * Conversions between session offsets in seconds and {@code HH:MM:SS} clock
 * strings.
 *
 * @since 1.0.0
 */
public final class HmsFormat {

    /** Clock value used when a record carries no offset. */
    public static final String ZERO = "00:00:00";

    private HmsFormat() {
        // utility class
    }

    /**
     * Render seconds as zero-padded {@code HH:MM:SS}. Negative input renders
     * as {@link #ZERO}; hours are not wrapped at 24.
     *
     * @param seconds elapsed seconds
     * @return the clock string
     */
    public static String format(long seconds) {
        long s = Math.max(0, seconds);
        long h = s / 3600;
        long m = (s % 3600) / 60;
        long sec = s % 60;
        return String.format("%02d:%02d:%02d", h, m, sec);
    }

    /**
     * Parse an {@code HH:MM:SS} string into whole seconds.
     *
     * <p>
     * The value must have exactly three colon-separated parts. An empty part
     * counts as zero and fractional parts are allowed; the sum is floored and
     * clamped to zero. Any other shape, or a non-numeric part, yields 0.
     * </p>
     *
     * @param hms the clock string; may be {@code null}
     * @return seconds since session start, never negative
     */
    public static int parse(String hms) {
        if (hms == null) {
            return 0;
        }
        String[] parts = hms.split(":", -1);
        if (parts.length != 3) {
            return 0;
        }
        double total = 0;
        double[] scale = { 3600, 60, 1 };
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].trim();
            if (part.isEmpty()) {
                continue;
            }
            double value;
            try {
                value = Double.parseDouble(part);
            } catch (NumberFormatException e) {
                return 0;
            }
            if (!Double.isFinite(value)) {
                return 0;
            }
            total += value * scale[i];
        }
        double floored = Math.floor(total);
        if (floored <= 0) {
            return 0;
        }
        return floored >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) floored;
    }
}
