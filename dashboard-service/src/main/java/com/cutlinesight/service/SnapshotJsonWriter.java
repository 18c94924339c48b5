package com.cutlinesight.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Serializes dashboard snapshots and status bodies to JSON.
 *
 * <p>
 * Dates are written as ISO-8601 strings and enums (including map keys) by
 * their {@code toString()}, so categories appear as {@code Small},
 * {@code Medium} and so on.
 * </p>
 */
public class SnapshotJsonWriter {

    private final ObjectMapper mapper;

    public SnapshotJsonWriter() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.mapper.configure(SerializationFeature.WRITE_ENUMS_USING_TO_STRING, true);
    }

    /**
     * @param value snapshot or any other response body
     * @return UTF-8 JSON
     * @throws IllegalStateException if {@code value} cannot be serialized
     */
    public byte[] write(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
