package com.cutlinesight.service;

import java.net.URI;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration for the dashboard service.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service runs unchanged in a container, under a process manager or from a
 * shell.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><td>{@code FEED_BASE_URL}</td><td>{@code http://localhost:3000}</td></tr>
 * <tr><td>{@code FEED_LOCATION_ID}</td><td>empty (default feed)</td></tr>
 * <tr><td>{@code FEED_TIMEOUT_MS}</td><td>{@code 5000}</td></tr>
 * <tr><td>{@code SESSION_ID}</td><td>{@code cutting-table.mp4}</td></tr>
 * <tr><td>{@code HTTP_PORT}</td><td>{@code 8080}</td></tr>
 * <tr><td>{@code ANALYTICS_CONFIG_PATH}</td><td>empty (classpath defaults)</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Feed
    // ---------------------------------------------------------------
    private final String feedBaseUrl;
    private final String feedLocationId;
    private final long feedTimeoutMs;

    // ---------------------------------------------------------------
    // Session / HTTP
    // ---------------------------------------------------------------
    private final String sessionId;
    private final int httpPort;

    // ---------------------------------------------------------------
    // Analytics
    // ---------------------------------------------------------------
    private final String analyticsConfigPath;

    private ServiceConfig(Builder b) {
        this.feedBaseUrl = b.feedBaseUrl;
        this.feedLocationId = b.feedLocationId;
        this.feedTimeoutMs = b.feedTimeoutMs;
        this.sessionId = b.sessionId;
        this.httpPort = b.httpPort;
        this.analyticsConfigPath = b.analyticsConfigPath;
    }

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ServiceConfig fromEnvironment(UnaryOperator<String> env) {
        try {
            return new Builder()
                    .feedBaseUrl(value(env, "FEED_BASE_URL", "http://localhost:3000"))
                    .feedLocationId(value(env, "FEED_LOCATION_ID", ""))
                    .feedTimeoutMs(Long.parseLong(value(env, "FEED_TIMEOUT_MS", "5000")))
                    .sessionId(value(env, "SESSION_ID", "cutting-table.mp4"))
                    .httpPort(Integer.parseInt(value(env, "HTTP_PORT", "8080")))
                    .analyticsConfigPath(value(env, "ANALYTICS_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return absolute URI of the feed document for the configured location
     */
    public URI feedUri() {
        return FeedLocator.resolve(feedBaseUrl, feedLocationId);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getFeedBaseUrl() {
        return feedBaseUrl;
    }

    public String getFeedLocationId() {
        return feedLocationId;
    }

    public long getFeedTimeoutMs() {
        return feedTimeoutMs;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public String getAnalyticsConfigPath() {
        return analyticsConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} requires an absolute http(s) base URL, a positive
     * timeout, a non-blank session id and a port in [1, 65535].
     * </p>
     */
    public static class Builder {
        private String feedBaseUrl = "http://localhost:3000";
        private String feedLocationId = "";
        private long feedTimeoutMs = 5_000;
        private String sessionId = "cutting-table.mp4";
        private int httpPort = 8080;
        private String analyticsConfigPath = "";

        public Builder feedBaseUrl(String v) {
            this.feedBaseUrl = v;
            return this;
        }

        public Builder feedLocationId(String v) {
            this.feedLocationId = v != null ? v.trim() : "";
            return this;
        }

        public Builder feedTimeoutMs(long v) {
            this.feedTimeoutMs = v;
            return this;
        }

        public Builder sessionId(String v) {
            this.sessionId = v;
            return this;
        }

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder analyticsConfigPath(String v) {
            this.analyticsConfigPath = v != null ? v.trim() : "";
            return this;
        }

        /**
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(feedBaseUrl, "feedBaseUrl required");
            requireNonBlank(sessionId, "sessionId");

            URI base;
            try {
                base = URI.create(feedBaseUrl.trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("feedBaseUrl is not a valid URI: " + feedBaseUrl, e);
            }
            if (!"http".equalsIgnoreCase(base.getScheme()) && !"https".equalsIgnoreCase(base.getScheme())) {
                throw new IllegalArgumentException("feedBaseUrl must be an http(s) URL, got: " + feedBaseUrl);
            }
            if (feedTimeoutMs < 1) {
                throw new IllegalArgumentException("feedTimeoutMs must be >= 1, got: " + feedTimeoutMs);
            }
            if (httpPort < 1 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [1, 65535], got: " + httpPort);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(UnaryOperator<String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "feedBaseUrl='" + feedBaseUrl + '\'' +
                ", feedLocationId='" + feedLocationId + '\'' +
                ", feedTimeoutMs=" + feedTimeoutMs +
                ", sessionId='" + sessionId + '\'' +
                ", httpPort=" + httpPort +
                ", analyticsConfigPath='" + analyticsConfigPath + '\'' +
                '}';
    }
}
