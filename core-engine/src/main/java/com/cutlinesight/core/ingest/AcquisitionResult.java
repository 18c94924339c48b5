package com.cutlinesight.core.ingest;

import com.cutlinesight.core.model.Session;

import java.util.Objects;

/**
 * Outcome of one session acquisition attempt: either a session built from the
 * feed, or the reason the feed could not be used.
 *
 * @since 1.0.0
 */
public abstract class AcquisitionResult {

    private AcquisitionResult() {
    }

    public static AcquisitionResult acquired(Session session) {
        return new Acquired(session);
    }

    public static AcquisitionResult unavailable(String reason) {
        return new Unavailable(reason);
    }

    /** The feed delivered at least one valid event. */
    public static final class Acquired extends AcquisitionResult {
        private final Session session;

        private Acquired(Session session) {
            this.session = Objects.requireNonNull(session, "session must not be null");
        }

        public Session getSession() {
            return session;
        }

        @Override
        public String toString() {
            return "Acquired{" + session + '}';
        }
    }

    /** The feed was unreachable, malformed or empty. */
    public static final class Unavailable extends AcquisitionResult {
        private final String reason;

        private Unavailable(String reason) {
            this.reason = reason != null ? reason : "unknown";
        }

        public String getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return "Unavailable{reason='" + reason + "'}";
        }
    }
}
