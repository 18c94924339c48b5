package com.cutlinesight.core.filter;

import com.cutlinesight.core.model.DetectionEvent;
import com.cutlinesight.core.model.SizeCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the relative and absolute {@link TimeRangeFilter}s.
 */
class TimeRangeFilterTest {

    private static DetectionEvent event(String id, int offset, String timestamp) {
        return DetectionEvent.builder()
                .id(id).timeOffset(offset).size(SizeCategory.MEDIUM).confidence(0.8).source("cam")
                .timestamp(timestamp)
                .build();
    }

    @Nested
    @DisplayName("Relative mode")
    class Relative {

        private final List<DetectionEvent> events = List.of(
                event("a", 0, null),
                event("b", 1000, null),
                event("c", 1500, null),
                event("d", 1800, null));

        @Test
        @DisplayName("Should anchor the window on the largest offset present")
        void shouldAnchorOnMaxOffset() {
            List<DetectionEvent> result = new RelativeTimeRangeFilter(TimeRange.LAST_5M).apply(events);

            assertThat(result).extracting(DetectionEvent::getId).containsExactly("c", "d");
        }

        @Test
        @DisplayName("Window lower bound should be inclusive")
        void lowerBoundShouldBeInclusive() {
            List<DetectionEvent> result = new RelativeTimeRangeFilter(TimeRange.LAST_10M)
                    .apply(List.of(event("x", 600, null), event("y", 1200, null), event("z", 599, null)));

            assertThat(result).extracting(DetectionEvent::getId).containsExactly("x", "y");
        }

        @Test
        @DisplayName("ALL should keep every event")
        void allShouldKeepEverything() {
            assertThat(new RelativeTimeRangeFilter(TimeRange.ALL).apply(events)).isEqualTo(events);
        }

        @Test
        @DisplayName("Should return empty for empty input")
        void shouldHandleEmptyInput() {
            assertThat(new RelativeTimeRangeFilter(TimeRange.LAST_30M).apply(List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Absolute mode")
    class Absolute {

        private final List<DetectionEvent> events = List.of(
                event("early", 0, "2024-01-01T09:59:00Z"),
                event("inside", 60, "2024-01-01T10:05:00Z"),
                event("late", 120, "2024-01-01T10:11:00Z"),
                event("none", 180, null),
                event("garbage", 240, "not a date"));

        @Test
        @DisplayName("Should keep only events inside the inclusive window")
        void shouldKeepEventsInWindow() {
            TimeRangeFilter filter = new AbsoluteTimeRangeFilter(
                    "2024-01-01T10:00", "2024-01-01T10:10", TimestampParser.utc());

            assertThat(filter.apply(events)).extracting(DetectionEvent::getId).containsExactly("inside");
        }

        @Test
        @DisplayName("Bounds should be inclusive")
        void boundsShouldBeInclusive() {
            TimeRangeFilter filter = new AbsoluteTimeRangeFilter(
                    "2024-01-01T09:59:00Z", "2024-01-01T10:11:00Z", TimestampParser.utc());

            assertThat(filter.apply(events)).extracting(DetectionEvent::getId)
                    .containsExactly("early", "inside", "late");
        }

        @Test
        @DisplayName("A single or unparseable bound should leave that side open")
        void missingBoundShouldBeOpen() {
            AbsoluteTimeRangeFilter onlyFrom = new AbsoluteTimeRangeFilter(
                    "2024-01-01T10:00:00Z", "whenever", TimestampParser.utc());

            assertThat(onlyFrom.getTo()).isEmpty();
            assertThat(onlyFrom.apply(events)).extracting(DetectionEvent::getId)
                    .containsExactly("inside", "late");
        }

        @Test
        @DisplayName("Events without a parseable timestamp never pass")
        void eventsWithoutTimestampNeverPass() {
            TimeRangeFilter filter = new AbsoluteTimeRangeFilter(null, null, TimestampParser.utc());

            assertThat(filter.apply(events)).extracting(DetectionEvent::getId)
                    .containsExactly("early", "inside", "late");
        }
    }

    @Test
    @DisplayName("Factory should prefer absolute mode when a bound is given")
    void factoryShouldPreferAbsolute() {
        FilterParameters absolute = FilterParameters.builder().timeRange("5m").to("2024-01-01").build();
        FilterParameters relative = FilterParameters.builder().timeRange("30m").from("  ").build();

        assertThat(TimeRangeFilters.create(absolute, TimestampParser.utc()))
                .isInstanceOf(AbsoluteTimeRangeFilter.class);
        assertThat(TimeRangeFilters.create(relative, TimestampParser.utc()))
                .isInstanceOfSatisfying(RelativeTimeRangeFilter.class,
                        f -> assertThat(f.getRange()).isEqualTo(TimeRange.LAST_30M));
    }
}
