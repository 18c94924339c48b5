package com.cutlinesight.core.analytics;

import com.cutlinesight.core.config.AnalyticsConfig;
import com.cutlinesight.core.filter.FilterParameters;
import com.cutlinesight.core.ingest.EventValidator;
import com.cutlinesight.core.ingest.RawEventRecord;
import com.cutlinesight.core.ingest.SyntheticEventGenerator;
import com.cutlinesight.core.model.DetectionEvent;
import com.cutlinesight.core.model.Session;
import com.cutlinesight.core.model.SizeCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalyticsEngine}.
 */
class AnalyticsEngineTest {

    private AnalyticsEngine engine;
    private Session demo;

    @BeforeEach
    void setUp() {
        engine = new AnalyticsEngine(AnalyticsConfig.defaults());
        demo = new SyntheticEventGenerator().generateSession("demo");
    }

    @Test
    @DisplayName("Should compute every view of the demo session")
    void shouldComputeDemoSnapshot() {
        DashboardSnapshot snapshot = engine.snapshot(demo, FilterParameters.defaults());

        assertThat(snapshot.isAvailable()).isTrue();
        assertThat(snapshot.getOrigin()).isEqualTo(Session.Origin.SYNTHETIC);
        assertThat(snapshot.getTimeFilteredCount()).isEqualTo(220);
        assertThat(snapshot.getBuckets()).hasSize(60);
        assertThat(snapshot.getChart()).hasSize(60);
        assertThat(snapshot.getChart().get(0).getValue()).isEqualTo(4);
        assertThat(snapshot.getTotals().getTotal()).isEqualTo(220);
        assertThat(snapshot.getPeak().getStartIndex()).isZero();
        assertThat(snapshot.getPeak().getCount()).isEqualTo(37);
        assertThat(snapshot.getEvents()).hasSize(220);
    }

    @Test
    @DisplayName("Display filter should narrow the event list but not the aggregates")
    void displayFilterShouldNotAffectAggregates() {
        FilterParameters params = FilterParameters.builder().confidence("0.9").category("Large").build();

        DashboardSnapshot snapshot = engine.snapshot(demo, params);

        assertThat(snapshot.getTotals().getTotal()).isEqualTo(220);
        assertThat(snapshot.getEvents()).hasSize(27)
                .allSatisfy(e -> {
                    assertThat(e.getSize()).isEqualTo(SizeCategory.LARGE);
                    assertThat(e.getConfidence()).isGreaterThanOrEqualTo(0.9);
                });
    }

    @Test
    @DisplayName("Time filter should drive both aggregates and events")
    void timeFilterShouldDriveEverything() {
        DashboardSnapshot snapshot = engine.snapshot(demo, FilterParameters.builder().timeRange("5m").build());

        assertThat(snapshot.getTimeFilteredCount()).isEqualTo(19);
        assertThat(snapshot.getTotals().getTotal()).isEqualTo(19);
        assertThat(snapshot.getBuckets().subList(0, 54)).allSatisfy(b -> assertThat(b.getTotal()).isZero());
    }

    @Test
    @DisplayName("Chart should project onto the selected category")
    void chartShouldProjectCategory() {
        DashboardSnapshot snapshot = engine.snapshot(demo, FilterParameters.builder().chartCategory("XL").build());

        int sum = snapshot.getChart().stream().mapToInt(ChartPoint::getValue).sum();
        assertThat(sum).isEqualTo(13);
        assertThat(snapshot.getChart().get(3).getMinute()).isEqualTo("00:03");
    }

    @Test
    @DisplayName("Should memoize for the same session and equal parameters only")
    void shouldMemoize() {
        DashboardSnapshot first = engine.snapshot(demo, FilterParameters.builder().timeRange("10m").build());
        DashboardSnapshot again = engine.snapshot(demo, FilterParameters.builder().timeRange("10m").build());
        DashboardSnapshot otherParams = engine.snapshot(demo, FilterParameters.defaults());
        Session sameEvents = new Session(demo.getId(), demo.getOrigin(), demo.getEvents());
        DashboardSnapshot otherSession = engine.snapshot(sameEvents, FilterParameters.defaults());

        assertThat(again).isSameAs(first);
        assertThat(otherParams).isNotSameAs(first);
        assertThat(otherSession).isNotSameAs(otherParams);
    }

    @Test
    @DisplayName("Should return the unavailable snapshot while no session is installed")
    void shouldReturnUnavailableSnapshot() {
        DashboardSnapshot snapshot = engine.snapshot(Optional.empty(), FilterParameters.defaults());

        assertThat(snapshot.isAvailable()).isFalse();
        assertThat(snapshot.getSessionId()).isNull();
        assertThat(snapshot.getEvents()).isEmpty();
        assertThat(snapshot.getPeak().getCount()).isZero();
    }

    @Test
    @DisplayName("Records with invalid sizes never reach any view")
    void invalidRecordsNeverReachViews() {
        List<DetectionEvent> events = new EventValidator().validate(List.of(
                RawEventRecord.of("id", "ok", "time", "00:00:05", "size", "Small", "confidence", 0.95),
                RawEventRecord.of("id", "bad", "time", "00:00:06", "size", "Huge", "confidence", 0.95)));
        Session session = new Session("feed", Session.Origin.FEED, events);

        DashboardSnapshot snapshot = engine.compute(session, FilterParameters.defaults());

        assertThat(snapshot.getTotals().getTotal()).isEqualTo(1);
        assertThat(snapshot.getBuckets().get(0).getTotal()).isEqualTo(1);
        assertThat(snapshot.getEvents()).extracting(DetectionEvent::getId).containsExactly("ok");
    }
}
