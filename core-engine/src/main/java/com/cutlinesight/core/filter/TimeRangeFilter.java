package com.cutlinesight.core.filter;

import com.cutlinesight.core.model.DetectionEvent;

import java.util.List;

/**
 * Contract for filters that restrict the working event set to a time window.
 * <p>
 * Implementations are stateless: the same input always yields the same
 * output, and the input list is never modified. Relative order of the
 * retained events is preserved.
 * </p>
 */
public interface TimeRangeFilter {

    /**
     * @param events the session's events
     * @return a new list holding the events inside the window
     */
    List<DetectionEvent> apply(List<DetectionEvent> events);

    /**
     * @return a short description for logs, e.g. {@code last 10m}
     */
    String describe();
}
