package com.cutlinesight.core.ingest;

import com.cutlinesight.core.config.AnalyticsConfig;
import com.cutlinesight.core.model.DetectionEvent;
import com.cutlinesight.core.model.Session;
import com.cutlinesight.core.model.SizeCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link SyntheticEventGenerator}.
 */
class SyntheticEventGeneratorTest {

    private final SyntheticEventGenerator generator = new SyntheticEventGenerator();

    @Test
    @DisplayName("Should produce the known sequence for the demo session")
    void shouldMatchGoldenSequence() {
        List<DetectionEvent> events = generator.generate("demo:events");

        assertThat(events).hasSize(220);
        assertThat(events.subList(0, 5))
                .extracting(DetectionEvent::getId, DetectionEvent::getTimeOffset,
                        DetectionEvent::getSize, DetectionEvent::getConfidence)
                .containsExactly(
                        tuple("EVT-0001", 0, SizeCategory.LARGE, 0.989),
                        tuple("EVT-0002", 16, SizeCategory.LARGE, 0.802),
                        tuple("EVT-0003", 32, SizeCategory.MEDIUM, 0.731),
                        tuple("EVT-0004", 49, SizeCategory.LARGE, 0.918),
                        tuple("EVT-0005", 65, SizeCategory.LARGE, 0.98));

        DetectionEvent last = events.get(219);
        assertThat(last.getId()).isEqualTo("EVT-0220");
        assertThat(last.getTimeOffset()).isEqualTo(3583);
        assertThat(last.getSize()).isEqualTo(SizeCategory.MEDIUM);
        assertThat(last.getConfidence()).isEqualTo(0.785);
    }

    @Test
    @DisplayName("Should produce the known category distribution")
    void shouldMatchGoldenDistribution() {
        Map<SizeCategory, Long> counts = generator.generate("demo:events").stream()
                .collect(Collectors.groupingBy(DetectionEvent::getSize, Collectors.counting()));

        assertThat(counts).containsEntry(SizeCategory.LARGE, 78L)
                .containsEntry(SizeCategory.MEDIUM, 72L)
                .containsEntry(SizeCategory.SMALL, 57L)
                .containsEntry(SizeCategory.XL, 13L);
    }

    @Test
    @DisplayName("Same session id should yield identical sessions, different ids different ones")
    void shouldBeDeterministicPerSession() {
        Session first = generator.generateSession("cutting-table.mp4");
        Session second = generator.generateSession("cutting-table.mp4");
        Session other = generator.generateSession("demo");

        assertThat(first.getEvents()).isEqualTo(second.getEvents());
        assertThat(first.getOrigin()).isEqualTo(Session.Origin.SYNTHETIC);
        assertThat(first.getEvents().get(0).getConfidence()).isEqualTo(0.753);
        assertThat(other.getEvents()).isNotEqualTo(first.getEvents());
    }

    @Test
    @DisplayName("Blank session id should fall back to the demo seed")
    void shouldDefaultBlankSessionId() {
        assertThat(SyntheticEventGenerator.seedFor(" ")).isEqualTo("demo:events");
        assertThat(generator.generateSession(null).getId()).isEqualTo("demo");
    }

    @Test
    @DisplayName("Offsets should be non-decreasing and inside the session, confidences within bounds")
    void shouldRespectBounds() {
        List<DetectionEvent> events = generator.generate("any:seed");

        int previous = -1;
        for (DetectionEvent event : events) {
            assertThat(event.getTimeOffset()).isGreaterThanOrEqualTo(previous).isLessThan(Session.DURATION_SECONDS);
            assertThat(event.getConfidence()).isBetween(0.72, 0.99);
            assertThat(event.getSource()).isEqualTo("Cutting Table 1");
            previous = event.getTimeOffset();
        }
    }

    @Test
    @DisplayName("Weighted pick should walk cumulative weights and fall back to the last category")
    void shouldPickByCumulativeWeight() {
        assertThat(generator.pick(0.0)).isEqualTo(SizeCategory.SMALL);
        assertThat(generator.pick(0.22)).isEqualTo(SizeCategory.SMALL);
        assertThat(generator.pick(0.2201)).isEqualTo(SizeCategory.MEDIUM);
        assertThat(generator.pick(0.91)).isEqualTo(SizeCategory.XL);
        assertThat(generator.pick(1.5)).isEqualTo(SizeCategory.XL);
    }

    @Test
    @DisplayName("Should honour configured count and weights")
    void shouldHonourConfiguration() {
        AnalyticsConfig config = AnalyticsConfig.defaults();
        config.getSynthetic().setEventCount(30);
        config.getSynthetic().setWeights(Map.of("Medium", 1.0));

        List<DetectionEvent> events = new SyntheticEventGenerator(config).generate("x");

        assertThat(events).hasSize(30)
                .extracting(DetectionEvent::getSize)
                .containsOnly(SizeCategory.MEDIUM);
        assertThat(events).extracting(DetectionEvent::getTimeOffset)
                .contains(0, 120, 3480);
    }
}
