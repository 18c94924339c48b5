package com.cutlinesight.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionEvent} and {@link MinuteBucket}.
 */
class DetectionEventTest {

    @Test
    @DisplayName("Should render the offset as HH:MM:SS")
    void shouldRenderTime() {
        DetectionEvent event = DetectionEvent.builder()
                .id("EVT-0001").timeOffset(125).size(SizeCategory.LARGE).confidence(0.8).source("cam")
                .build();

        assertThat(event.getTime()).isEqualTo("00:02:05");
        assertThat(event.absoluteTimestamp()).isEmpty();
    }

    @Test
    @DisplayName("Should reject confidence outside [0, 1]")
    void shouldRejectConfidenceOutOfRange() {
        assertThatThrownBy(() -> DetectionEvent.builder()
                .id("x").size(SizeCategory.XL).confidence(1.2).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confidence");
    }

    @Test
    @DisplayName("Should reject a negative offset")
    void shouldRejectNegativeOffset() {
        assertThatThrownBy(() -> DetectionEvent.builder()
                .id("x").size(SizeCategory.XL).timeOffset(-1).confidence(0.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeOffset");
    }

    @Test
    @DisplayName("Should require a size")
    void shouldRequireSize() {
        assertThatThrownBy(() -> DetectionEvent.builder().id("x").confidence(0.5).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Bucket total should always equal the sum of its category counts")
    void bucketTotalIsDerived() {
        MinuteBucket bucket = new MinuteBucket(7, Map.of(SizeCategory.SMALL, 2, SizeCategory.XL, 3));

        assertThat(bucket.getTotal()).isEqualTo(5);
        assertThat(bucket.getCountsByCategory()).containsEntry(SizeCategory.MEDIUM, 0).hasSize(4);
        assertThat(bucket.getLabel()).isEqualTo("00:07");
    }

    @Test
    @DisplayName("Category labels should match case-sensitively")
    void categoryLabelsAreCaseSensitive() {
        assertThat(SizeCategory.fromLabel("Medium")).contains(SizeCategory.MEDIUM);
        assertThat(SizeCategory.fromLabel("medium")).isEmpty();
        assertThat(SizeCategory.fromLabel("Huge")).isEmpty();
    }
}
