package com.cutlinesight.core.filter;

import com.cutlinesight.core.model.DetectionEvent;
import com.cutlinesight.core.model.SizeCategory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Confidence and category filter behind the event table and the CSV export.
 *
 * <p>
 * Both consumers must read the output of the same filter instance so the
 * table and the download never disagree. The filter is idempotent.
 * </p>
 *
 * @since 1.0.0
 */
public class DisplayFilter {

    private final double minConfidence;
    private final SizeCategory category;

    /**
     * @param minConfidence events below this confidence are dropped
     * @param category      category to keep, or {@code null} for all
     */
    public DisplayFilter(double minConfidence, SizeCategory category) {
        this.minConfidence = minConfidence;
        this.category = category;
    }

    public static DisplayFilter from(FilterParameters params) {
        Objects.requireNonNull(params, "FilterParameters must not be null");
        return new DisplayFilter(params.getMinConfidence(), params.getCategory().orElse(null));
    }

    public List<DetectionEvent> apply(List<DetectionEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        return events.stream()
                .filter(this::accepts)
                .toList();
    }

    public boolean accepts(DetectionEvent event) {
        return event.getConfidence() >= minConfidence
                && (category == null || event.getSize() == category);
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public Optional<SizeCategory> getCategory() {
        return Optional.ofNullable(category);
    }
}
