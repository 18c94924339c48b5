package com.cutlinesight.core.analytics;

import com.cutlinesight.core.model.DetectionEvent;
import com.cutlinesight.core.model.MinuteBucket;
import com.cutlinesight.core.model.Session;
import com.cutlinesight.core.model.SessionTotals;
import com.cutlinesight.core.model.SizeCategory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds events into one bucket per session minute.
 *
 * <p>
 * The result always holds exactly {@link Session#BUCKET_COUNT} buckets,
 * dense and ordered by index, whatever the input size. Each event lands in
 * {@code clamp(floor(offset / 60), 0, 59)}; offsets past the session end are
 * counted in the last minute. Event order does not affect the result.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeBucketAggregator {

    private static final int CATEGORY_COUNT = SizeCategory.values().length;

    /**
     * @param events events to count; must not be {@code null}
     * @return {@value Session#BUCKET_COUNT} buckets indexed 0..59
     */
    public List<MinuteBucket> aggregate(List<DetectionEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        int[][] counts = new int[Session.BUCKET_COUNT][CATEGORY_COUNT];
        for (DetectionEvent event : events) {
            counts[bucketIndex(event.getTimeOffset())][event.getSize().ordinal()]++;
        }
        return toBuckets(counts);
    }

    /**
     * Combine two partial aggregations, e.g. from a partitioned pass.
     * Elementwise addition, so the operation is associative and commutative.
     *
     * @param left  a full bucket series
     * @param right a full bucket series
     * @return the elementwise sum
     */
    public List<MinuteBucket> merge(List<MinuteBucket> left, List<MinuteBucket> right) {
        requireFullSeries(left, "left");
        requireFullSeries(right, "right");
        int[][] counts = new int[Session.BUCKET_COUNT][CATEGORY_COUNT];
        for (int i = 0; i < Session.BUCKET_COUNT; i++) {
            for (SizeCategory category : SizeCategory.values()) {
                counts[i][category.ordinal()] = left.get(i).count(category) + right.get(i).count(category);
            }
        }
        return toBuckets(counts);
    }

    /**
     * @param buckets a bucket series
     * @return elementwise totals over all buckets plus throughput per minute
     */
    public SessionTotals totals(List<MinuteBucket> buckets) {
        Objects.requireNonNull(buckets, "buckets must not be null");
        Map<SizeCategory, Integer> sums = new EnumMap<>(SizeCategory.class);
        int total = 0;
        for (MinuteBucket bucket : buckets) {
            for (SizeCategory category : SizeCategory.values()) {
                sums.merge(category, bucket.count(category), Integer::sum);
            }
            total += bucket.getTotal();
        }
        return new SessionTotals(sums, throughput(total, Math.max(1, buckets.size())));
    }

    /**
     * @param total   event count
     * @param minutes number of minutes, {@code >= 1}
     * @return {@code total / minutes} rounded to one decimal place
     */
    public static double throughput(int total, int minutes) {
        return Math.round((double) total / minutes * 10) / 10.0;
    }

    /**
     * @param offsetSeconds session offset
     * @return the minute bucket index for the offset, clamped to 0..59
     */
    public static int bucketIndex(int offsetSeconds) {
        int index = Math.floorDiv(offsetSeconds, 60);
        return Math.min(Session.BUCKET_COUNT - 1, Math.max(0, index));
    }

    private static List<MinuteBucket> toBuckets(int[][] counts) {
        List<MinuteBucket> buckets = new ArrayList<>(Session.BUCKET_COUNT);
        for (int i = 0; i < counts.length; i++) {
            Map<SizeCategory, Integer> perCategory = new EnumMap<>(SizeCategory.class);
            for (SizeCategory category : SizeCategory.values()) {
                perCategory.put(category, counts[i][category.ordinal()]);
            }
            buckets.add(new MinuteBucket(i, perCategory));
        }
        return List.copyOf(buckets);
    }

    private static void requireFullSeries(List<MinuteBucket> buckets, String name) {
        Objects.requireNonNull(buckets, name + " must not be null");
        if (buckets.size() != Session.BUCKET_COUNT) {
            throw new IllegalArgumentException(
                    name + " must hold " + Session.BUCKET_COUNT + " buckets, got: " + buckets.size());
        }
    }
}
