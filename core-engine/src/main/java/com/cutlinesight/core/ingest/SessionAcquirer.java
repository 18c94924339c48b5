package com.cutlinesight.core.ingest;

import com.cutlinesight.core.model.DetectionEvent;
import com.cutlinesight.core.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Acquires sessions from an {@link EventFeed} and publishes the current one.
 *
 * <h3>Staleness guard</h3>
 * <p>
 * Every call to {@link #acquire()} takes the next id from a monotonic
 * counter and clears the current session. A completed attempt is installed
 * only if its id is still the latest issued, so when requests overlap the
 * last one requested wins, whatever order the responses arrive in.
 * </p>
 *
 * <h3>Fallback</h3>
 * <p>
 * An {@link AcquisitionResult.Unavailable} result is always replaced by a
 * synthetic session. Feed failures never propagate to the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class SessionAcquirer {

    private static final Logger LOG = LoggerFactory.getLogger(SessionAcquirer.class);

    private final EventFeed feed;
    private final EventValidator validator;
    private final SyntheticEventGenerator generator;
    private final String sessionId;

    private final AtomicLong requestCounter = new AtomicLong();
    private final AtomicReference<Slot> slot = new AtomicReference<>(new Slot(0, null));

    public SessionAcquirer(EventFeed feed,
            EventValidator validator,
            SyntheticEventGenerator generator,
            String sessionId) {
        this.feed = Objects.requireNonNull(feed, "EventFeed must not be null");
        this.validator = Objects.requireNonNull(validator, "EventValidator must not be null");
        this.generator = Objects.requireNonNull(generator, "SyntheticEventGenerator must not be null");
        this.sessionId = sessionId == null || sessionId.isBlank()
                ? SyntheticEventGenerator.DEFAULT_SESSION_ID
                : sessionId;
    }

    /**
     * Start a new acquisition. The current session is cleared immediately.
     *
     * @return a future completing with the installed session, or empty if a
     *         newer acquisition superseded this one before it completed
     */
    public CompletableFuture<Optional<Session>> acquire() {
        long requestId = requestCounter.incrementAndGet();
        slot.updateAndGet(s -> s.requestId > requestId ? s : new Slot(requestId, null));
        LOG.info("Acquisition #{} started from {}", requestId, feed.describe());

        CompletableFuture<List<RawEventRecord>> fetch;
        try {
            fetch = feed.fetchRecords();
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }

        return fetch
                .thenApply(this::toResult)
                .exceptionally(e -> AcquisitionResult.unavailable(describe(e)))
                .thenApply(result -> install(requestId, resolve(result)));
    }

    /**
     * @return the installed session; empty while an acquisition is outstanding
     */
    public Optional<Session> current() {
        return Optional.ofNullable(slot.get().session);
    }

    /**
     * @return id of the most recently issued acquisition, 0 before the first
     */
    public long latestRequestId() {
        return requestCounter.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    AcquisitionResult toResult(List<RawEventRecord> records) {
        if (records == null || records.isEmpty()) {
            return AcquisitionResult.unavailable("feed returned no records");
        }
        List<DetectionEvent> events = validator.validate(records);
        if (events.isEmpty()) {
            return AcquisitionResult.unavailable("none of " + records.size() + " feed record(s) were valid");
        }
        return AcquisitionResult.acquired(new Session(sessionId, Session.Origin.FEED, events));
    }

    private Session resolve(AcquisitionResult result) {
        if (result instanceof AcquisitionResult.Acquired acquired) {
            return acquired.getSession();
        }
        String reason = ((AcquisitionResult.Unavailable) result).getReason();
        LOG.warn("Event feed unavailable ({}), using synthetic events for session '{}'", reason, sessionId);
        return generator.generateSession(sessionId);
    }

    private Optional<Session> install(long requestId, Session session) {
        Slot installed = slot.updateAndGet(s -> s.requestId == requestId ? new Slot(requestId, session) : s);
        if (installed.requestId != requestId) {
            LOG.debug("Discarding stale acquisition #{} (latest is #{})", requestId, installed.requestId);
            return Optional.empty();
        }
        LOG.info("Installed session {} from acquisition #{}", session, requestId);
        return Optional.of(session);
    }

    private static String describe(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    /** Latest request id paired with the session it installed, if any. */
    private static final class Slot {
        private final long requestId;
        private final Session session;

        private Slot(long requestId, Session session) {
            this.requestId = requestId;
            this.session = session;
        }
    }
}
