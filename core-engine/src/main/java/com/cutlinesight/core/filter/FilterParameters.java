package com.cutlinesight.core.filter;

import com.cutlinesight.core.model.SizeCategory;

import java.util.Objects;
import java.util.Optional;

/**
 * Caller-supplied view parameters: time range, confidence threshold and
 * category selections.
 *
 * <p>
 * Instances are immutable value objects; two instances with equal fields are
 * interchangeable, which lets them key a snapshot cache.
 * </p>
 *
 * <h3>Lenient parsing</h3>
 * <p>
 * The {@link Builder} accepts raw strings from the outer surface. An
 * unrecognized value never raises an error: it means "no filter" for that
 * parameter (all time, no confidence floor, all categories).
 * </p>
 *
 * @since 1.0.0
 */
public final class FilterParameters {

    private final TimeRange timeRange;
    private final String from;
    private final String to;
    private final double minConfidence;
    private final SizeCategory category;
    private final SizeCategory chartCategory;

    private FilterParameters(Builder b) {
        this.timeRange = b.timeRange;
        this.from = blankToNull(b.from);
        this.to = blankToNull(b.to);
        this.minConfidence = b.minConfidence;
        this.category = b.category;
        this.chartCategory = b.chartCategory;
    }

    /**
     * @return parameters with every filter at its default
     */
    public static FilterParameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder(ConfidenceThreshold.DEFAULT);
    }

    /**
     * @param defaultThreshold threshold used when none is supplied
     * @return a new builder
     */
    public static Builder builder(ConfidenceThreshold defaultThreshold) {
        return new Builder(Objects.requireNonNull(defaultThreshold, "defaultThreshold must not be null"));
    }

    /**
     * @return {@code true} when a from or to bound was supplied, which selects
     *         absolute mode regardless of {@link #getTimeRange()}
     */
    public boolean isAbsolute() {
        return from != null || to != null;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public Optional<String> getFrom() {
        return Optional.ofNullable(from);
    }

    public Optional<String> getTo() {
        return Optional.ofNullable(to);
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    /**
     * @return the category the event list is restricted to; empty for all
     */
    public Optional<SizeCategory> getCategory() {
        return Optional.ofNullable(category);
    }

    /**
     * @return the category the chart series is projected on; empty for totals
     */
    public Optional<SizeCategory> getChartCategory() {
        return Optional.ofNullable(chartCategory);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder; string setters accept raw client input.
     */
    public static class Builder {
        private TimeRange timeRange = TimeRange.ALL;
        private String from;
        private String to;
        private double minConfidence;
        private SizeCategory category;
        private SizeCategory chartCategory;

        private Builder(ConfidenceThreshold defaultThreshold) {
            this.minConfidence = defaultThreshold.getValue();
        }

        public Builder timeRange(TimeRange timeRange) {
            this.timeRange = timeRange != null ? timeRange : TimeRange.ALL;
            return this;
        }

        /**
         * @param selector {@code all|5m|10m|30m|60m}; anything else means all time
         */
        public Builder timeRange(String selector) {
            this.timeRange = TimeRange.fromSelector(selector).orElse(TimeRange.ALL);
            return this;
        }

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder to(String to) {
            this.to = to;
            return this;
        }

        public Builder confidence(ConfidenceThreshold threshold) {
            this.minConfidence = Objects.requireNonNull(threshold, "threshold must not be null").getValue();
            return this;
        }

        /**
         * @param threshold an offered threshold such as {@code "0.8"}. A blank
         *                  value keeps the default; an unrecognized value
         *                  disables confidence filtering.
         */
        public Builder confidence(String threshold) {
            if (threshold == null || threshold.isBlank()) {
                return this;
            }
            this.minConfidence = ConfidenceThreshold.parse(threshold)
                    .map(ConfidenceThreshold::getValue)
                    .orElse(0.0);
            return this;
        }

        public Builder category(SizeCategory category) {
            this.category = category;
            return this;
        }

        /**
         * @param label a category label; {@code All} or anything unrecognized
         *              selects every category
         */
        public Builder category(String label) {
            this.category = SizeCategory.fromLabel(label).orElse(null);
            return this;
        }

        public Builder chartCategory(SizeCategory category) {
            this.chartCategory = category;
            return this;
        }

        public Builder chartCategory(String label) {
            this.chartCategory = SizeCategory.fromLabel(label).orElse(null);
            return this;
        }

        public FilterParameters build() {
            return new FilterParameters(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FilterParameters that))
            return false;
        return Double.compare(minConfidence, that.minConfidence) == 0
                && timeRange == that.timeRange
                && Objects.equals(from, that.from)
                && Objects.equals(to, that.to)
                && category == that.category
                && chartCategory == that.chartCategory;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeRange, from, to, minConfidence, category, chartCategory);
    }

    @Override
    public String toString() {
        return "FilterParameters{" +
                (isAbsolute() ? "from=" + from + ", to=" + to : "range=" + timeRange.getSelector()) +
                ", minConfidence=" + minConfidence +
                ", category=" + (category != null ? category : "All") +
                ", chartCategory=" + (chartCategory != null ? chartCategory : "All") +
                '}';
    }
}
