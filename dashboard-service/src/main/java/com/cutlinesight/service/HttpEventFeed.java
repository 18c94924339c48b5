package com.cutlinesight.service;

import com.cutlinesight.core.ingest.EventFeed;
import com.cutlinesight.core.ingest.FeedUnavailableException;
import com.cutlinesight.core.ingest.RawEventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link EventFeed} backed by an HTTP GET of a JSON feed document.
 *
 * <p>
 * Non-2xx responses, transport errors and timeouts complete the returned
 * future exceptionally; the body is parsed by {@link FeedPayloadParser}.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpEventFeed implements EventFeed {

    private static final Logger LOG = LoggerFactory.getLogger(HttpEventFeed.class);

    private final HttpClient client;
    private final URI uri;
    private final Duration timeout;
    private final FeedPayloadParser parser;

    public HttpEventFeed(HttpClient client, URI uri, Duration timeout, FeedPayloadParser parser) {
        this.client = Objects.requireNonNull(client, "HttpClient must not be null");
        this.uri = Objects.requireNonNull(uri, "uri must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.parser = Objects.requireNonNull(parser, "FeedPayloadParser must not be null");
    }

    /**
     * @param config service configuration supplying URI and timeout
     * @return a feed with its own HTTP client
     */
    public static HttpEventFeed fromConfig(ServiceConfig config) {
        Duration timeout = Duration.ofMillis(config.getFeedTimeoutMs());
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new HttpEventFeed(client, config.feedUri(), timeout, new FeedPayloadParser());
    }

    @Override
    public CompletableFuture<List<RawEventRecord>> fetchRecords() {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        LOG.debug("Fetching feed {}", uri);
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(this::handle);
    }

    private List<RawEventRecord> handle(HttpResponse<byte[]> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new FeedUnavailableException("HTTP " + status + " from " + uri);
        }
        return parser.parse(response.body());
    }

    @Override
    public String describe() {
        return "GET " + uri;
    }
}
