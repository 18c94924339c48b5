package com.cutlinesight.service;

import com.cutlinesight.core.ingest.FeedUnavailableException;
import com.cutlinesight.core.ingest.RawEventRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts a raw feed document into {@link RawEventRecord}s.
 *
 * <p>
 * The document must be a JSON object whose {@code events} member is an
 * array. Anything else makes the whole feed unavailable. Array elements
 * that are not objects are kept as {@code null} placeholders so ids derived
 * from feed positions stay stable; the validator drops them.
 * </p>
 */
public class FeedPayloadParser {

    private static final Logger LOG = LoggerFactory.getLogger(FeedPayloadParser.class);

    static final String EVENTS_FIELD = "events";

    private final ObjectMapper mapper;

    public FeedPayloadParser() {
        this.mapper = new ObjectMapper();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param body the response body
     * @return records in document order, {@code null} for non-object elements
     * @throws FeedUnavailableException if the body is empty, not JSON, or has
     *                                  no {@code events} array
     */
    public List<RawEventRecord> parse(byte[] body) {
        if (body == null || body.length == 0) {
            throw new FeedUnavailableException("feed returned an empty body");
        }

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new FeedUnavailableException("feed document is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FeedUnavailableException("feed document is not a JSON object");
        }

        JsonNode events = root.get(EVENTS_FIELD);
        if (events == null || !events.isArray()) {
            throw new FeedUnavailableException("feed document has no '" + EVENTS_FIELD + "' array");
        }

        List<RawEventRecord> records = new ArrayList<>(events.size());
        for (JsonNode node : events) {
            records.add(node.isObject() ? mapper.convertValue(node, RawEventRecord.class) : null);
        }
        LOG.debug("Parsed {} record(s) from feed document", records.size());
        return records;
    }
}
