package com.cutlinesight.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Session-wide counters: the elementwise sum of all minute buckets plus the
 * average throughput per minute.
 *
 * @since 1.0.0
 */
public final class SessionTotals {

    private final int total;
    private final Map<SizeCategory, Integer> countsByCategory;
    private final double throughputPerMinute;

    public SessionTotals(Map<SizeCategory, Integer> countsByCategory, double throughputPerMinute) {
        Objects.requireNonNull(countsByCategory, "countsByCategory must not be null");
        EnumMap<SizeCategory, Integer> copy = new EnumMap<>(SizeCategory.class);
        int sum = 0;
        for (SizeCategory category : SizeCategory.values()) {
            int count = countsByCategory.getOrDefault(category, 0);
            copy.put(category, count);
            sum += count;
        }
        this.countsByCategory = Collections.unmodifiableMap(copy);
        this.total = sum;
        this.throughputPerMinute = throughputPerMinute;
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
     * @return events per minute, rounded to one decimal place
     */
    public double getThroughputPerMinute() {
        return throughputPerMinute;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SessionTotals that))
            return false;
        return Double.compare(throughputPerMinute, that.throughputPerMinute) == 0
                && countsByCategory.equals(that.countsByCategory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(countsByCategory, throughputPerMinute);
    }

    @Override
    public String toString() {
        return "SessionTotals{total=" + total + ", " + countsByCategory
                + ", perMinute=" + throughputPerMinute + '}';
    }
}
