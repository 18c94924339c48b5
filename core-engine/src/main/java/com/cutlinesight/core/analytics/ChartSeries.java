package com.cutlinesight.core.analytics;

import com.cutlinesight.core.model.MinuteBucket;
import com.cutlinesight.core.model.SizeCategory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Projects a bucket series onto the values a chart plots.
 *
 * @since 1.0.0
 */
public final class ChartSeries {

    private ChartSeries() {
        // utility class
    }

    /**
     * @param buckets  the bucket series
     * @param category category to plot; empty plots bucket totals
     * @return one point per bucket, in bucket order
     */
    public static List<ChartPoint> project(List<MinuteBucket> buckets, Optional<SizeCategory> category) {
        Objects.requireNonNull(buckets, "buckets must not be null");
        Objects.requireNonNull(category, "category must not be null");
        return buckets.stream()
                .map(b -> new ChartPoint(b.getLabel(), category.map(b::count).orElse(b.getTotal())))
                .toList();
    }
}
