package com.cutlinesight.service;

import com.cutlinesight.core.ingest.FeedUnavailableException;
import com.cutlinesight.core.ingest.RawEventRecord;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests {@link HttpEventFeed} against a local stub server.
 */
class HttpEventFeedTest {

    private HttpServer stub;
    private String base;

    @BeforeEach
    void setUp() throws IOException {
        stub = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        stub.createContext("/demo/pizza-events.json", exchange -> {
            byte[] body = "{\"events\":[{\"size\":\"Medium\",\"time\":\"00:02:00\"}]}"
                    .getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        stub.createContext("/demo/pizza-events-gone.json", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        stub.start();
        base = "http://localhost:" + stub.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        stub.stop(0);
    }

    private HttpEventFeed feed(String locationId) {
        return new HttpEventFeed(HttpClient.newHttpClient(), FeedLocator.resolve(base, locationId),
                Duration.ofSeconds(5), new FeedPayloadParser());
    }

    @Test
    @DisplayName("Should fetch and parse the feed document")
    void shouldFetchRecords() {
        List<RawEventRecord> records = feed(null).fetchRecords().join();

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getTextField("size")).contains("Medium");
    }

    @Test
    @DisplayName("Should fail the future on a non-2xx response")
    void shouldFailOnHttpError() {
        HttpEventFeed feed = feed("gone");

        assertThatThrownBy(() -> feed.fetchRecords().join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(FeedUnavailableException.class)
                .hasMessageContaining("HTTP 404");
    }

    @Test
    @DisplayName("Should fail the future when the server is unreachable")
    void shouldFailWhenUnreachable() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        HttpEventFeed feed = new HttpEventFeed(HttpClient.newHttpClient(),
                URI.create("http://localhost:" + closedPort + "/x.json"),
                Duration.ofSeconds(2), new FeedPayloadParser());

        assertThatThrownBy(() -> feed.fetchRecords().join())
                .isInstanceOf(CompletionException.class);
    }
}
