package com.cutlinesight.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;
import java.util.Optional;

/**
 * A single detection reported by the cutting-line camera.
 *
 * <p>
 * Instances are immutable. Use the {@link Builder} to construct them; the
 * builder rejects values that would break the model invariants (negative
 * offset, confidence outside {@code [0, 1]}, missing id or size).
 * </p>
 *
 * <p>
 * The absolute {@code timestamp} is kept in its raw string form because
 * the feed supplies it in several formats. It is only interpreted by the
 * absolute time-range filter.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "id", "time", "timeOffset", "size", "confidence", "source", "timestamp" })
public final class DetectionEvent {

    private final String id;
    private final int timeOffset;
    private final String timestamp;
    private final SizeCategory size;
    private final double confidence;
    private final String source;

    private DetectionEvent(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.size = Objects.requireNonNull(builder.size, "size must not be null");
        this.source = builder.source != null ? builder.source : "";
        this.timestamp = builder.timestamp;

        if (builder.timeOffset < 0) {
            throw new IllegalArgumentException(
                    "timeOffset must be >= 0 for event '" + id + "', got: " + builder.timeOffset);
        }
        if (!(builder.confidence >= 0.0 && builder.confidence <= 1.0)) {
            throw new IllegalArgumentException(
                    "confidence must be in [0, 1] for event '" + id + "', got: " + builder.confidence);
        }
        this.timeOffset = builder.timeOffset;
        this.confidence = builder.confidence;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DetectionEvent}.
     *
     * <p>
     * {@code id} and {@code size} are required.
     * </p>
     */
    public static class Builder {
        private String id;
        private int timeOffset;
        private String timestamp;
        private SizeCategory size;
        private double confidence;
        private String source;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timeOffset(int timeOffset) {
            this.timeOffset = timeOffset;
            return this;
        }

        public Builder timestamp(String timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder size(SizeCategory size) {
            this.size = size;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        /**
         * @return a new {@link DetectionEvent}
         * @throws NullPointerException     if {@code id} or {@code size} is missing
         * @throws IllegalArgumentException if offset or confidence is out of range
         */
        public DetectionEvent build() {
            return new DetectionEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    /**
     * @return elapsed seconds since session start
     */
    public int getTimeOffset() {
        return timeOffset;
    }

    /**
     * @return the offset rendered as {@code HH:MM:SS}
     */
    public String getTime() {
        return HmsFormat.format(timeOffset);
    }

    /**
     * @return the raw absolute timestamp, or {@code null} when the feed did not
     *         supply one
     */
    public String getTimestamp() {
        return timestamp;
    }

    public Optional<String> absoluteTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public SizeCategory getSize() {
        return size;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getSource() {
        return source;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionEvent that))
            return false;
        return timeOffset == that.timeOffset
                && Double.compare(confidence, that.confidence) == 0
                && Objects.equals(id, that.id)
                && Objects.equals(timestamp, that.timestamp)
                && size == that.size
                && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timeOffset, timestamp, size, confidence, source);
    }

    @Override
    public String toString() {
        return "DetectionEvent{" +
                "id='" + id + '\'' +
                ", time=" + getTime() +
                ", size=" + size +
                ", confidence=" + confidence +
                ", source='" + source + '\'' +
                (timestamp != null ? ", timestamp='" + timestamp + '\'' : "") +
                '}';
    }
}
