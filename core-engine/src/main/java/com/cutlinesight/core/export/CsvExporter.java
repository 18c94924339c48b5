package com.cutlinesight.core.export;

import com.cutlinesight.core.model.DetectionEvent;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Serializes the display list to CSV.
 *
 * <h3>Format</h3>
 * <ul>
 * <li>header {@code time,size,confidence,source,id}</li>
 * <li>one row per event, in list order; no re-sorting</li>
 * <li>every field quoted, embedded quotes doubled (RFC 4180)</li>
 * <li>{@code time} as {@code HH:MM:SS}; {@code confidence} as the raw number
 * in its shortest plain form ({@code 0.9}, not {@code 90%})</li>
 * <li>records separated by {@code \n}; no newline after the last one</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class CsvExporter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvExporter.class);

    public static final List<String> HEADER = List.of("time", "size", "confidence", "source", "id");

    static final String RECORD_SEPARATOR = "\n";

    private static final CSVFormat FORMAT = CSVFormat.RFC4180.builder()
            .setQuoteMode(QuoteMode.ALL)
            .setRecordSeparator(RECORD_SEPARATOR)
            .build();

    /**
     * @param events the display list
     * @return the CSV document
     */
    public String export(List<DetectionEvent> events) {
        StringBuilder sb = new StringBuilder();
        try {
            write(events, sb);
        } catch (IOException e) {
            // StringBuilder never throws
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    /**
     * @param events the display list; must not be {@code null}
     * @param out    destination; not closed
     * @throws IOException if {@code out} fails
     */
    public void write(List<DetectionEvent> events, Appendable out) throws IOException {
        Objects.requireNonNull(events, "events must not be null");
        Objects.requireNonNull(out, "out must not be null");

        out.append(String.join(",", HEADER));
        for (DetectionEvent event : events) {
            out.append(RECORD_SEPARATOR).append(FORMAT.format(
                    event.getTime(),
                    event.getSize().getLabel(),
                    formatConfidence(event.getConfidence()),
                    event.getSource(),
                    event.getId()));
        }
        LOG.debug("Exported {} event(s) to CSV", events.size());
    }

    /**
     * @param confidence a confidence value
     * @return shortest plain decimal form, e.g. {@code 0.9}, {@code 1}
     */
    static String formatConfidence(double confidence) {
        return BigDecimal.valueOf(confidence).stripTrailingZeros().toPlainString();
    }

    /**
     * @param date export date
     * @return download file name, e.g. {@code detections-2024-01-31.csv}
     */
    public static String fileName(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return "detections-" + date + ".csv";
    }
}
