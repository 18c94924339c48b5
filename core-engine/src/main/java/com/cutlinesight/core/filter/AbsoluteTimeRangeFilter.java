package com.cutlinesight.core.filter;

import com.cutlinesight.core.model.DetectionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Inclusive datetime-window filter over the events' absolute timestamps.
 *
 * <p>
 * Only events whose own timestamp parses can pass; this filter never falls
 * back to session offsets. A bound that is absent or fails to parse leaves
 * that side of the window open.
 * </p>
 *
 * @since 1.0.0
 */
public class AbsoluteTimeRangeFilter implements TimeRangeFilter {

    private static final Logger LOG = LoggerFactory.getLogger(AbsoluteTimeRangeFilter.class);

    private final TimestampParser parser;
    private final Instant from;
    private final Instant to;

    /**
     * @param fromText lower bound text; may be {@code null}
     * @param toText   upper bound text; may be {@code null}
     * @param parser   parser shared with event timestamps
     */
    public AbsoluteTimeRangeFilter(String fromText, String toText, TimestampParser parser) {
        this.parser = Objects.requireNonNull(parser, "TimestampParser must not be null");
        this.from = parseBound("from", fromText);
        this.to = parseBound("to", toText);
    }

    @Override
    public List<DetectionEvent> apply(List<DetectionEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        return events.stream()
                .filter(this::inWindow)
                .toList();
    }

    private boolean inWindow(DetectionEvent event) {
        Optional<Instant> ts = event.absoluteTimestamp().flatMap(parser::parse);
        if (ts.isEmpty()) {
            return false;
        }
        Instant t = ts.get();
        if (from != null && t.isBefore(from)) {
            return false;
        }
        return to == null || !t.isAfter(to);
    }

    private Instant parseBound(String name, String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Optional<Instant> parsed = parser.parse(text);
        if (parsed.isEmpty()) {
            LOG.debug("Ignoring unparseable '{}' bound: {}", name, text);
            return null;
        }
        return parsed.get();
    }

    public Optional<Instant> getFrom() {
        return Optional.ofNullable(from);
    }

    public Optional<Instant> getTo() {
        return Optional.ofNullable(to);
    }

    @Override
    public String describe() {
        return "between " + (from != null ? from : "-inf") + " and " + (to != null ? to : "+inf");
    }
}
