package com.cutlinesight.core.analytics;

import com.cutlinesight.core.config.AnalyticsConfig;
import com.cutlinesight.core.filter.DisplayFilter;
import com.cutlinesight.core.filter.FilterParameters;
import com.cutlinesight.core.filter.TimeRangeFilter;
import com.cutlinesight.core.filter.TimeRangeFilters;
import com.cutlinesight.core.filter.TimestampParser;
import com.cutlinesight.core.model.DetectionEvent;
import com.cutlinesight.core.model.MinuteBucket;
import com.cutlinesight.core.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes {@link DashboardSnapshot}s.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Session.events
 *     → TimeRangeFilter
 *         → TimeBucketAggregator → totals, chart series
 *                                → SlidingWindowPeakFinder
 *         → DisplayFilter → event table / CSV
 * </pre>
 *
 * <p>
 * A snapshot is a pure function of the session and the parameters.
 * {@link #snapshot(Session, FilterParameters)} keeps the last result and
 * returns it again only for the same session instance and equal parameters;
 * any change recomputes from scratch.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsEngine.class);

    private final TimestampParser timestampParser;
    private final TimeBucketAggregator aggregator;
    private final SlidingWindowPeakFinder peakFinder;

    private DashboardSnapshot memo;

    public AnalyticsEngine(AnalyticsConfig config) {
        this(new TimestampParser(Objects.requireNonNull(config, "AnalyticsConfig must not be null")
                .getIngest().zoneId()),
                new TimeBucketAggregator(),
                new SlidingWindowPeakFinder());
    }

    public AnalyticsEngine(TimestampParser timestampParser,
            TimeBucketAggregator aggregator,
            SlidingWindowPeakFinder peakFinder) {
        this.timestampParser = Objects.requireNonNull(timestampParser, "TimestampParser must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "TimeBucketAggregator must not be null");
        this.peakFinder = Objects.requireNonNull(peakFinder, "SlidingWindowPeakFinder must not be null");
    }

    /**
     * Memoizing variant of {@link #compute(Session, FilterParameters)}.
     *
     * @param session    the current session, or empty while acquiring
     * @param parameters view parameters
     * @return the snapshot for the pair
     */
    public synchronized DashboardSnapshot snapshot(Optional<Session> session, FilterParameters parameters) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        if (session.isEmpty()) {
            return DashboardSnapshot.unavailable(parameters, peakFinder.getWidth());
        }
        return snapshot(session.get(), parameters);
    }

    public synchronized DashboardSnapshot snapshot(Session session, FilterParameters parameters) {
        if (memo != null && memo.getSession() == session && memo.getParameters().equals(parameters)) {
            return memo;
        }
        memo = compute(session, parameters);
        return memo;
    }

    /**
     * @param session    the session; must not be {@code null}
     * @param parameters view parameters; must not be {@code null}
     * @return a freshly computed snapshot
     */
    public DashboardSnapshot compute(Session session, FilterParameters parameters) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");

        TimeRangeFilter timeFilter = TimeRangeFilters.create(parameters, timestampParser);
        List<DetectionEvent> timeFiltered = timeFilter.apply(session.getEvents());

        List<MinuteBucket> buckets = aggregator.aggregate(timeFiltered);
        List<DetectionEvent> displayed = DisplayFilter.from(parameters).apply(timeFiltered);

        DashboardSnapshot snapshot = new DashboardSnapshot(
                session,
                parameters,
                timeFiltered.size(),
                buckets,
                ChartSeries.project(buckets, parameters.getChartCategory()),
                aggregator.totals(buckets),
                peakFinder.find(buckets),
                displayed);

        LOG.debug("Computed snapshot for {} ({}): {} of {} event(s) in range, {} displayed",
                session.getId(), timeFilter.describe(), timeFiltered.size(), session.size(), displayed.size());
        return snapshot;
    }
}
