package com.cutlinesight.core.ingest;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loosely-typed detection record as delivered by the feed.
 *
 * <p>
 * Feed records are free-form JSON objects: fields may be missing, mistyped
 * or named differently from one producer to the next. This class keeps them
 * as a {@link Map} and lets {@link EventValidator} query individual fields
 * with type coercion.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawEventRecord {

    /** Every key-value pair of the original JSON object. */
    private final Map<String, Object> fields = new LinkedHashMap<>();

    public RawEventRecord() {
    }

    /**
     * @param fields initial field values; copied
     */
    public RawEventRecord(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        fields.forEach(this::setField);
    }

    /**
     * Convenience factory for tests and generators.
     *
     * @param keyValues alternating keys and values
     * @return a new record
     */
    public static RawEventRecord of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        RawEventRecord record = new RawEventRecord();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.setField(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return record;
    }

    /**
     * Set a field value. Called by Jackson for every JSON property.
     *
     * @param key   the JSON key; must not be {@code null}
     * @param value the JSON value
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * @return unmodifiable view of all fields
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Retrieve a numeric field, coercing string-encoded numbers.
     *
     * @param fieldName the JSON key
     * @return the value as a {@code double}, or empty if absent or not numeric
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * @param fieldName the JSON key
     * @return the string form of the value, or empty if absent or blank
     */
    public Optional<String> getTextField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw == null) {
            return Optional.empty();
        }
        String s = raw.toString();
        return s.isBlank() ? Optional.empty() : Optional.of(s);
    }

    /**
     * Resolve an aliased field. The first alias carrying a non-null value
     * decides; later aliases are not consulted even when that value is blank.
     *
     * @param fieldNames aliases, tried in order
     * @return the text of the first present alias, or empty if none is
     *         present or the present one is blank
     */
    public Optional<String> getFirstTextField(String... fieldNames) {
        for (String name : fieldNames) {
            if (fields.get(name) != null) {
                return getTextField(name);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawEventRecord that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "RawEventRecord" + fields;
    }
}
