package com.cutlinesight.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * The busiest fixed-width run of consecutive minute buckets.
 *
 * <p>
 * Both indices are inclusive, so {@code endIndex - startIndex + 1} is the
 * window width.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "count", "startIndex", "endIndex", "startLabel", "endLabel" })
public final class PeakWindow {

    private final int startIndex;
    private final int endIndex;
    private final int count;

    public PeakWindow(int startIndex, int width, int count) {
        if (startIndex < 0) {
            throw new IllegalArgumentException("startIndex must be >= 0, got: " + startIndex);
        }
        if (width < 1) {
            throw new IllegalArgumentException("width must be >= 1, got: " + width);
        }
        this.startIndex = startIndex;
        this.endIndex = startIndex + width - 1;
        this.count = count;
    }

    /**
     * @param width window width in buckets
     * @return the zero window anchored at index 0
     */
    public static PeakWindow empty(int width) {
        return new PeakWindow(0, width, 0);
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    public int getCount() {
        return count;
    }

    public String getStartLabel() {
        return MinuteBucket.minuteLabel(startIndex);
    }

    public String getEndLabel() {
        return MinuteBucket.minuteLabel(endIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PeakWindow that))
            return false;
        return startIndex == that.startIndex && endIndex == that.endIndex && count == that.count;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startIndex, endIndex, count);
    }

    @Override
    public String toString() {
        return "PeakWindow{" + getStartLabel() + ".." + getEndLabel() + ", count=" + count + '}';
    }
}
