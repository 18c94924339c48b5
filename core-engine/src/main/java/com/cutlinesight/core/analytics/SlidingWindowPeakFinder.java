package com.cutlinesight.core.analytics;

import com.cutlinesight.core.model.MinuteBucket;
import com.cutlinesight.core.model.PeakWindow;

import java.util.List;
import java.util.Objects;

/**
 * Finds the busiest run of {@code width} consecutive buckets.
 *
 * <p>
 * Scans every start index with a running sum. A window replaces the current
 * best only when strictly greater, so ties resolve to the lowest start, and a
 * series of zeros yields the zero window at index 0.
 * </p>
 *
 * @since 1.0.0
 */
public class SlidingWindowPeakFinder {

    public static final int DEFAULT_WIDTH = 10;

    private final int width;

    public SlidingWindowPeakFinder() {
        this(DEFAULT_WIDTH);
    }

    /**
     * @param width window width in buckets
     * @throws IllegalArgumentException if {@code width < 1}
     */
    public SlidingWindowPeakFinder(int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Peak window width must be >= 1, got: " + width);
        }
        this.width = width;
    }

    public PeakWindow find(List<MinuteBucket> buckets) {
        Objects.requireNonNull(buckets, "buckets must not be null");
        int[] totals = new int[buckets.size()];
        for (int i = 0; i < totals.length; i++) {
            totals[i] = buckets.get(i).getTotal();
        }
        return find(totals);
    }

    /**
     * @param totals per-bucket totals
     * @return the peak window; the zero window at 0 when fewer than
     *         {@code width} buckets are given
     */
    public PeakWindow find(int[] totals) {
        Objects.requireNonNull(totals, "totals must not be null");
        if (totals.length < width) {
            return PeakWindow.empty(width);
        }

        int sum = 0;
        for (int i = 0; i < width; i++) {
            sum += totals[i];
        }
        int best = Math.max(0, sum);
        int bestStart = 0;

        for (int start = 1; start + width <= totals.length; start++) {
            sum += totals[start + width - 1] - totals[start - 1];
            if (sum > best) {
                best = sum;
                bestStart = start;
            }
        }
        return new PeakWindow(bestStart, width, best);
    }

    public int getWidth() {
        return width;
    }
}
