package com.cutlinesight.core.ingest;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Source of raw detection records for one session.
 * <p>
 * Fetching is asynchronous and may fail. A failed future, or a
 * {@link FeedUnavailableException} thrown directly, means the feed is
 * unavailable; {@link SessionAcquirer} then substitutes synthetic data.
 * </p>
 */
public interface EventFeed {

    /**
     * @return a future completing with the feed's records in order; list
     *         entries may be {@code null} for items that were not JSON objects
     */
    CompletableFuture<List<RawEventRecord>> fetchRecords();

    /**
     * @return a short description of where the records come from, for logs
     */
    String describe();
}
