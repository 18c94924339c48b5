package com.cutlinesight.core.filter;

import com.cutlinesight.core.model.DetectionEvent;

import java.util.List;
import java.util.Objects;

/**
 * Trailing-window filter over session offsets.
 *
 * <p>
 * The window ends at the largest offset present in the input, not at the
 * nominal end of the session: on a sparse event set "last 60 min" can span
 * less than an hour of real activity. {@link TimeRange#ALL} returns the input
 * unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class RelativeTimeRangeFilter implements TimeRangeFilter {

    private final TimeRange range;

    public RelativeTimeRangeFilter(TimeRange range) {
        this.range = Objects.requireNonNull(range, "TimeRange must not be null");
    }

    @Override
    public List<DetectionEvent> apply(List<DetectionEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        if (range == TimeRange.ALL) {
            return List.copyOf(events);
        }

        int maxOffset = 0;
        for (DetectionEvent event : events) {
            maxOffset = Math.max(maxOffset, event.getTimeOffset());
        }
        int minOffset = Math.max(0, maxOffset - range.getMinutes() * 60);

        final int lower = minOffset;
        final int upper = maxOffset;
        return events.stream()
                .filter(e -> e.getTimeOffset() >= lower && e.getTimeOffset() <= upper)
                .toList();
    }

    public TimeRange getRange() {
        return range;
    }

    @Override
    public String describe() {
        return range == TimeRange.ALL ? "all time" : "last " + range.getSelector();
    }
}
