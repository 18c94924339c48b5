package com.cutlinesight.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One fixed one-minute slot of a session.
 *
 * <p>
 * The total is derived from the per-category counts rather than stored, so
 * {@code total == sum(countsByCategory)} holds for every instance. Every
 * category is present in {@link #getCountsByCategory()}, with zero when no
 * event of that size fell into the minute.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "index", "label", "total", "countsByCategory" })
public final class MinuteBucket {

    private final int index;
    private final Map<SizeCategory, Integer> countsByCategory;
    private final int total;

    /**
     * @param index  minute index, {@code >= 0}
     * @param counts per-category counts; missing categories count as zero
     * @throws IllegalArgumentException if {@code index} or a count is negative
     */
    public MinuteBucket(int index, Map<SizeCategory, Integer> counts) {
        if (index < 0) {
            throw new IllegalArgumentException("Bucket index must be >= 0, got: " + index);
        }
        Objects.requireNonNull(counts, "counts must not be null");
        EnumMap<SizeCategory, Integer> copy = new EnumMap<>(SizeCategory.class);
        int sum = 0;
        for (SizeCategory category : SizeCategory.values()) {
            int count = counts.getOrDefault(category, 0);
            if (count < 0) {
                throw new IllegalArgumentException(
                        "Count for " + category + " in bucket " + index + " must be >= 0, got: " + count);
            }
            copy.put(category, count);
            sum += count;
        }
        this.index = index;
        this.countsByCategory = Collections.unmodifiableMap(copy);
        this.total = sum;
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return chart label of the form {@code 00:MM}
     */
    public String getLabel() {
        return minuteLabel(index);
    }

    public int getTotal() {
        return total;
    }

    public Map<SizeCategory, Integer> getCountsByCategory() {
        return countsByCategory;
    }

    public int count(SizeCategory category) {
        return countsByCategory.get(category);
    }

    /**
     * Format a minute index the way the dashboard labels its x-axis.
     *
     * @param index minute index
     * @return {@code 00:MM}, e.g. {@code 00:07}
     */
    public static String minuteLabel(int index) {
        return String.format("00:%02d", index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MinuteBucket that))
            return false;
        return index == that.index && countsByCategory.equals(that.countsByCategory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, countsByCategory);
    }

    @Override
    public String toString() {
        return "MinuteBucket{" + getLabel() + ", total=" + total + ", " + countsByCategory + '}';
    }
}
