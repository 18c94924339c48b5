package com.cutlinesight.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One bounded snapshot of detection events.
 *
 * <p>
 * A session is created once per acquisition, real or synthetic, and never
 * changes afterwards. Re-ingestion replaces it with a new instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class Session {

    public static final int DURATION_MINUTES = 60;
    public static final int DURATION_SECONDS = DURATION_MINUTES * 60;

    /** One bucket per minute of the session. */
    public static final int BUCKET_COUNT = DURATION_MINUTES;

    /** Where the events of a session came from. */
    public enum Origin {
        FEED,
        SYNTHETIC
    }

    private final String id;
    private final Origin origin;
    private final List<DetectionEvent> events;

    public Session(String id, Origin origin, List<DetectionEvent> events) {
        this.id = Objects.requireNonNull(id, "Session id must not be null");
        this.origin = Objects.requireNonNull(origin, "Session origin must not be null");
        this.events = List.copyOf(Objects.requireNonNull(events, "Session events must not be null"));
    }

    public String getId() {
        return id;
    }

    public Origin getOrigin() {
        return origin;
    }

    /**
     * @return unmodifiable list of events in feed order
     */
    public List<DetectionEvent> getEvents() {
        return events;
    }

    public int size() {
        return events.size();
    }

    @Override
    public String toString() {
        return "Session{id='" + id + "', origin=" + origin + ", events=" + events.size() + '}';
    }
}
