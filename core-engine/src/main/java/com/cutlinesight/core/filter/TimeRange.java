package com.cutlinesight.core.filter;

import java.util.Optional;

/**
 * Trailing time windows selectable for the relative time-range filter.
 *
 * @since 1.0.0
 */
public enum TimeRange {

    ALL("all", 0),
    LAST_5M("5m", 5),
    LAST_10M("10m", 10),
    LAST_30M("30m", 30),
    LAST_60M("60m", 60);

    private final String selector;
    private final int minutes;

    TimeRange(String selector, int minutes) {
        this.selector = selector;
        this.minutes = minutes;
    }

    public String getSelector() {
        return selector;
    }

    /**
     * @return window length in minutes; 0 for {@link #ALL}
     */
    public int getMinutes() {
        return minutes;
    }

    /**
     * @param selector one of {@code all|5m|10m|30m|60m}
     * @return the matching range, or empty for any other value
     */
    public static Optional<TimeRange> fromSelector(String selector) {
        if (selector == null) {
            return Optional.empty();
        }
        String s = selector.trim();
        for (TimeRange range : values()) {
            if (range.selector.equals(s)) {
                return Optional.of(range);
            }
        }
        return Optional.empty();
    }
}
