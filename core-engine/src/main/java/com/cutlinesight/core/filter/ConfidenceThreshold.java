package com.cutlinesight.core.filter;

import java.util.Optional;

/**
 * Confidence thresholds offered by the event table.
 *
 * @since 1.0.0
 */
public enum ConfidenceThreshold {

    P50(0.5),
    P60(0.6),
    P70(0.7),
    P80(0.8),
    P90(0.9);

    /** Threshold applied when the caller does not choose one. */
    public static final ConfidenceThreshold DEFAULT = P70;

    private static final double TOLERANCE = 1e-9;

    private final double value;

    ConfidenceThreshold(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    /**
     * @param value a threshold such as {@code 0.8}
     * @return the matching threshold, or empty if {@code value} is not offered
     */
    public static Optional<ConfidenceThreshold> fromValue(double value) {
        for (ConfidenceThreshold threshold : values()) {
            if (Math.abs(threshold.value - value) < TOLERANCE) {
                return Optional.of(threshold);
            }
        }
        return Optional.empty();
    }

    /**
     * @param text a threshold as sent by a client, e.g. {@code "0.8"}
     * @return the matching threshold, or empty if {@code text} is not a number
     *         or not an offered value
     */
    public static Optional<ConfidenceThreshold> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return fromValue(Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
