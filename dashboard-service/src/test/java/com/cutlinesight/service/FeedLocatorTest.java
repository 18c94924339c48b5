package com.cutlinesight.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FeedLocator}.
 */
class FeedLocatorTest {

    @Test
    @DisplayName("Should select the default feed without a location")
    void shouldSelectDefaultFeed() {
        assertThat(FeedLocator.path(null)).isEqualTo("/demo/pizza-events.json");
        assertThat(FeedLocator.path(" ")).isEqualTo("/demo/pizza-events.json");
        assertThat(FeedLocator.path("all")).isEqualTo("/demo/pizza-events.json");
    }

    @Test
    @DisplayName("Should select the per-location feed")
    void shouldSelectLocationFeed() {
        assertThat(FeedLocator.path("khi-7")).isEqualTo("/demo/pizza-events-khi-7.json");
    }

    @Test
    @DisplayName("Should join base and path with exactly one slash")
    void shouldJoinWithOneSlash() {
        assertThat(FeedLocator.resolve("http://host:3000//", "x"))
                .isEqualTo(URI.create("http://host:3000/demo/pizza-events-x.json"));
        assertThat(FeedLocator.resolve("http://host/app", null))
                .isEqualTo(URI.create("http://host/app/demo/pizza-events.json"));
    }
}
