package com.cutlinesight.service;

import java.net.URI;
import java.util.Objects;

/**
 * Maps a location id to the feed document served for it.
 *
 * @since 1.0.0
 */
public final class FeedLocator {

    static final String DEFAULT_PATH = "/demo/pizza-events.json";

    private FeedLocator() {
        // utility class
    }

    /**
     * @param locationId site id; blank or {@code all} selects the default feed
     * @return the feed path, always starting with {@code /}
     */
    public static String path(String locationId) {
        if (locationId == null || locationId.isBlank() || "all".equalsIgnoreCase(locationId.trim())) {
            return DEFAULT_PATH;
        }
        return "/demo/pizza-events-" + locationId.trim() + ".json";
    }

    /**
     * @param baseUrl    server root, with or without trailing slashes
     * @param locationId site id, see {@link #path(String)}
     * @return the absolute feed URI
     */
    public static URI resolve(String baseUrl, String locationId) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        String base = baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path(locationId));
    }
}
