package com.cutlinesight.core.analytics;

import com.cutlinesight.core.filter.FilterParameters;
import com.cutlinesight.core.model.DetectionEvent;
import com.cutlinesight.core.model.MinuteBucket;
import com.cutlinesight.core.model.PeakWindow;
import com.cutlinesight.core.model.Session;
import com.cutlinesight.core.model.SessionTotals;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every derived view of one session under one set of filter parameters.
 *
 * <p>
 * Built by {@link AnalyticsEngine}; immutable. When no session is available
 * the snapshot is {@linkplain #isAvailable() unavailable} and every view is
 * empty.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "available", "sessionId", "origin", "timeFilteredCount", "totals", "peak",
        "buckets", "chart", "events" })
public final class DashboardSnapshot {

    private final Session session;
    private final FilterParameters parameters;
    private final int timeFilteredCount;
    private final List<MinuteBucket> buckets;
    private final List<ChartPoint> chart;
    private final SessionTotals totals;
    private final PeakWindow peak;
    private final List<DetectionEvent> events;

    DashboardSnapshot(Session session,
            FilterParameters parameters,
            int timeFilteredCount,
            List<MinuteBucket> buckets,
            List<ChartPoint> chart,
            SessionTotals totals,
            PeakWindow peak,
            List<DetectionEvent> events) {
        this.session = session;
        this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
        this.timeFilteredCount = timeFilteredCount;
        this.buckets = List.copyOf(buckets);
        this.chart = List.copyOf(chart);
        this.totals = Objects.requireNonNull(totals, "totals must not be null");
        this.peak = Objects.requireNonNull(peak, "peak must not be null");
        this.events = List.copyOf(events);
    }

    /**
     * @param parameters the parameters the caller asked for
     * @param peakWidth  width of the (zero) peak window
     * @return the snapshot shown while no session is installed
     */
    public static DashboardSnapshot unavailable(FilterParameters parameters, int peakWidth) {
        return new DashboardSnapshot(null, parameters, 0, List.of(), List.of(),
                new SessionTotals(Map.of(), 0.0), PeakWindow.empty(peakWidth), List.of());
    }

    public boolean isAvailable() {
        return session != null;
    }

    public String getSessionId() {
        return session != null ? session.getId() : null;
    }

    public Session.Origin getOrigin() {
        return session != null ? session.getOrigin() : null;
    }

    @JsonIgnore
    public Session getSession() {
        return session;
    }

    @JsonIgnore
    public FilterParameters getParameters() {
        return parameters;
    }

    /**
     * @return number of events that survived the time-range filter
     */
    public int getTimeFilteredCount() {
        return timeFilteredCount;
    }

    public List<MinuteBucket> getBuckets() {
        return buckets;
    }

    public List<ChartPoint> getChart() {
        return chart;
    }

    public SessionTotals getTotals() {
        return totals;
    }

    public PeakWindow getPeak() {
        return peak;
    }

    /**
     * @return the display list: time-filtered, then confidence and category
     *         filtered. Feeds both the event table and the CSV export.
     */
    public List<DetectionEvent> getEvents() {
        return events;
    }

    @Override
    public String toString() {
        return "DashboardSnapshot{session=" + session + ", " + parameters
                + ", timeFiltered=" + timeFilteredCount + ", displayed=" + events.size()
                + ", peak=" + peak + '}';
    }
}
