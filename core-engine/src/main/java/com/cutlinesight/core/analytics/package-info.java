/**
 * Aggregation and analytics over a filtered session.
 *
 * <ul>
 * <li>{@link com.cutlinesight.core.analytics.TimeBucketAggregator}: dense
 * per-minute buckets and session totals</li>
 * <li>{@link com.cutlinesight.core.analytics.SlidingWindowPeakFinder}: busiest
 * fixed-width window</li>
 * <li>{@link com.cutlinesight.core.analytics.AnalyticsEngine}: the full
 * pipeline, producing a
 * {@link com.cutlinesight.core.analytics.DashboardSnapshot}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.cutlinesight.core.analytics;
