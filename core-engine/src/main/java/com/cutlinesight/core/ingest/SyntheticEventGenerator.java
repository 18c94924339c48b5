package com.cutlinesight.core.ingest;

import com.cutlinesight.core.config.AnalyticsConfig;
import com.cutlinesight.core.model.DetectionEvent;
import com.cutlinesight.core.model.Session;
import com.cutlinesight.core.model.SizeCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic fallback producer used when no real event feed is available.
 *
 * <p>
 * Events are spread evenly over the session: event {@code i} of {@code n}
 * sits at {@code floor(i / n * 3600)} seconds. Each event consumes two draws
 * from a {@link SeededRandom} seeded with {@code <sessionId>:events}: one
 * for the weighted category pick, one for the confidence
 * ({@code base + draw * spread}, clamped to {@code [0, 1]}, three decimals).
 * </p>
 *
 * <p>
 * The generator never repairs feed data. It only replaces a feed that is
 * missing altogether.
 * </p>
 *
 * @since 1.0.0
 */
public class SyntheticEventGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticEventGenerator.class);

    /** Session id used when the caller supplies a blank one. */
    public static final String DEFAULT_SESSION_ID = "demo";

    private final int eventCount;
    private final double confidenceBase;
    private final double confidenceSpread;
    private final EnumMap<SizeCategory, Double> weights;
    private final String source;

    public SyntheticEventGenerator(AnalyticsConfig config) {
        Objects.requireNonNull(config, "AnalyticsConfig must not be null");
        AnalyticsConfig.SyntheticSettings settings = config.getSynthetic();
        this.eventCount = settings.getEventCount();
        this.confidenceBase = settings.getConfidenceBase();
        this.confidenceSpread = settings.getConfidenceSpread();
        this.weights = settings.categoryWeights();
        this.source = config.getIngest().getDefaultSource();
    }

    public SyntheticEventGenerator() {
        this(AnalyticsConfig.defaults());
    }

    /**
     * @param sessionId session identifier; blank means {@value #DEFAULT_SESSION_ID}
     * @return the seed string for that session
     */
    public static String seedFor(String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION_ID : sessionId;
        return id + ":events";
    }

    /**
     * @param sessionId session identifier; blank means {@value #DEFAULT_SESSION_ID}
     * @return a synthetic session, identical for identical ids
     */
    public Session generateSession(String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION_ID : sessionId;
        return new Session(id, Session.Origin.SYNTHETIC, generate(seedFor(id)));
    }

    /**
     * @param seed the seed string
     * @return {@code eventCount} events in offset order
     */
    public List<DetectionEvent> generate(String seed) {
        Objects.requireNonNull(seed, "seed must not be null");
        SeededRandom rng = SeededRandom.fromString(seed);
        List<DetectionEvent> events = new ArrayList<>(eventCount);

        for (int i = 0; i < eventCount; i++) {
            int offset = (int) Math.floor((double) i / eventCount * Session.DURATION_SECONDS);
            SizeCategory size = pick(rng.nextDouble());
            double confidence = Math.min(1.0, Math.max(0.0, confidenceBase + rng.nextDouble() * confidenceSpread));

            events.add(DetectionEvent.builder()
                    .id(EventValidator.formatId(i + 1))
                    .timeOffset(offset)
                    .size(size)
                    .confidence(Math.round(confidence * 1000) / 1000.0)
                    .source(source)
                    .build());
        }

        LOG.debug("Generated {} synthetic event(s) for seed '{}'", events.size(), seed);
        return events;
    }

    /**
     * Weighted categorical pick: the first category whose cumulative weight
     * reaches {@code draw}. The last category is returned when floating-point
     * rounding leaves the cumulative sum just below the draw.
     */
    SizeCategory pick(double draw) {
        double acc = 0;
        SizeCategory last = SizeCategory.values()[SizeCategory.values().length - 1];
        for (Map.Entry<SizeCategory, Double> entry : weights.entrySet()) {
            acc += entry.getValue();
            if (draw <= acc) {
                return entry.getKey();
            }
        }
        return last;
    }
}
