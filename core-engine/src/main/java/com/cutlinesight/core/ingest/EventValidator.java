package com.cutlinesight.core.ingest;

import com.cutlinesight.core.config.AnalyticsConfig;
import com.cutlinesight.core.model.DetectionEvent;
import com.cutlinesight.core.model.HmsFormat;
import com.cutlinesight.core.model.SizeCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalizes raw feed records into {@link DetectionEvent}s.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>{@code size} must be exactly one of {@code Small}, {@code Medium},
 * {@code Large}, {@code XL}; otherwise the record is dropped</li>
 * <li>{@code time} ({@code HH:MM:SS}) defaults to {@code 00:00:00}</li>
 * <li>{@code confidence} defaults when missing or non-finite and is clamped
 * to {@code [0, 1]}</li>
 * <li>{@code source} defaults to the configured label</li>
 * <li>{@code id} defaults to {@code EVT-} plus the 1-based position, padded
 * to four digits</li>
 * <li>the absolute timestamp is read from {@code timestamp},
 * {@code datetime} or {@code dateTime}, first match wins</li>
 * </ul>
 *
 * <p>
 * Dropped records are not reported; the validator never throws for bad
 * input data.
 * </p>
 *
 * @since 1.0.0
 */
public class EventValidator {

    private static final Logger LOG = LoggerFactory.getLogger(EventValidator.class);

    static final String[] TIMESTAMP_ALIASES = { "timestamp", "datetime", "dateTime" };

    private final String defaultSource;
    private final double defaultConfidence;

    public EventValidator(AnalyticsConfig.IngestSettings settings) {
        Objects.requireNonNull(settings, "IngestSettings must not be null");
        this.defaultSource = settings.getDefaultSource();
        this.defaultConfidence = settings.getDefaultConfidence();
    }

    public EventValidator() {
        this(new AnalyticsConfig.IngestSettings());
    }

    /**
     * @param records raw records in feed order; {@code null} entries are
     *                dropped
     * @return valid events in feed order
     */
    public List<DetectionEvent> validate(List<RawEventRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        List<DetectionEvent> events = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            normalize(records.get(i), i + 1).ifPresent(events::add);
        }
        if (events.size() < records.size()) {
            LOG.debug("Dropped {} of {} feed record(s) during validation",
                    records.size() - events.size(), records.size());
        }
        return events;
    }

    /**
     * @param record   the raw record; may be {@code null}
     * @param position 1-based position in the feed, used for generated ids
     * @return the normalized event, or empty if the record is invalid
     */
    public Optional<DetectionEvent> normalize(RawEventRecord record, int position) {
        if (record == null) {
            LOG.trace("Record #{} is null, dropped", position);
            return Optional.empty();
        }

        Optional<SizeCategory> size = record.getField("size")
                .map(Object::toString)
                .flatMap(SizeCategory::fromLabel);
        if (size.isEmpty()) {
            LOG.trace("Record #{} has unknown size {}, dropped", position, record.getField("size").orElse(null));
            return Optional.empty();
        }

        int offset = HmsFormat.parse(record.getTextField("time").orElse(HmsFormat.ZERO));

        double confidence = record.getNumericField("confidence")
                .filter(Double::isFinite)
                .orElse(defaultConfidence);

        return Optional.of(DetectionEvent.builder()
                .id(record.getTextField("id").orElseGet(() -> formatId(position)))
                .timeOffset(offset)
                .size(size.get())
                .confidence(Math.min(1.0, Math.max(0.0, confidence)))
                .source(record.getTextField("source").orElse(defaultSource))
                .timestamp(record.getFirstTextField(TIMESTAMP_ALIASES).orElse(null))
                .build());
    }

    /**
     * @param position 1-based position
     * @return {@code EVT-0001} style id
     */
    public static String formatId(int position) {
        return String.format("EVT-%04d", position);
    }
}
