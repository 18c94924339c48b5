package com.cutlinesight.core.analytics;

import java.util.Objects;

/**
 * One point of the per-minute chart series.
 *
 * @since 1.0.0
 */
public final class ChartPoint {

    private final String minute;
    private final int value;

    public ChartPoint(String minute, int value) {
        this.minute = Objects.requireNonNull(minute, "minute must not be null");
        this.value = value;
    }

    /**
     * @return minute label, {@code 00:MM}
     */
    public String getMinute() {
        return minute;
    }

    public int getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChartPoint that))
            return false;
        return value == that.value && minute.equals(that.minute);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minute, value);
    }

    @Override
    public String toString() {
        return minute + "=" + value;
    }
}
