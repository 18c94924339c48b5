package com.cutlinesight.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should use defaults when no variables are set")
    void shouldUseDefaults() {
        ServiceConfig config = ServiceConfig.fromEnvironment(name -> null);

        assertThat(config.getFeedBaseUrl()).isEqualTo("http://localhost:3000");
        assertThat(config.getFeedLocationId()).isEmpty();
        assertThat(config.getFeedTimeoutMs()).isEqualTo(5000);
        assertThat(config.getSessionId()).isEqualTo("cutting-table.mp4");
        assertThat(config.getHttpPort()).isEqualTo(8080);
        assertThat(config.getAnalyticsConfigPath()).isEmpty();
        assertThat(config.feedUri()).isEqualTo(URI.create("http://localhost:3000/demo/pizza-events.json"));
    }

    @Test
    @DisplayName("Should read overrides and ignore blank values")
    void shouldReadOverrides() {
        Map<String, String> env = Map.of(
                "FEED_BASE_URL", "https://feeds.example.com/",
                "FEED_LOCATION_ID", "lhr-02",
                "FEED_TIMEOUT_MS", "250",
                "SESSION_ID", "  ",
                "HTTP_PORT", "9090");

        ServiceConfig config = ServiceConfig.fromEnvironment(env::get);

        assertThat(config.getFeedTimeoutMs()).isEqualTo(250);
        assertThat(config.getHttpPort()).isEqualTo(9090);
        assertThat(config.getSessionId()).isEqualTo("cutting-table.mp4");
        assertThat(config.feedUri())
                .isEqualTo(URI.create("https://feeds.example.com/demo/pizza-events-lhr-02.json"));
    }

    @Test
    @DisplayName("Should reject a non-numeric port")
    void shouldRejectNonNumericPort() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of("HTTP_PORT", "eighty")::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("eighty");
    }

    @Test
    @DisplayName("Builder should validate ranges and URL scheme")
    void builderShouldValidate() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().httpPort(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("httpPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().feedTimeoutMs(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("feedTimeoutMs");
        assertThatThrownBy(() -> new ServiceConfig.Builder().feedBaseUrl("ftp://host").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("http(s)");
        assertThatThrownBy(() -> new ServiceConfig.Builder().sessionId("").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sessionId");
    }
}
