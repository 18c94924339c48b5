package com.cutlinesight.core.filter;

import java.util.Objects;

/**
 * Selects the time-range filter mode for a set of view parameters.
 *
 * <p>
 * A supplied from or to bound always wins over the relative selector.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeRangeFilters {

    private TimeRangeFilters() {
        // utility class
    }

    /**
     * @param params view parameters; must not be {@code null}
     * @param parser timestamp parser for absolute mode; must not be {@code null}
     * @return the filter matching the parameters
     */
    public static TimeRangeFilter create(FilterParameters params, TimestampParser parser) {
        Objects.requireNonNull(params, "FilterParameters must not be null");
        Objects.requireNonNull(parser, "TimestampParser must not be null");
        if (params.isAbsolute()) {
            return new AbsoluteTimeRangeFilter(params.getFrom().orElse(null), params.getTo().orElse(null), parser);
        }
        return new RelativeTimeRangeFilter(params.getTimeRange());
    }
}
