package com.cutlinesight.core.config;

import com.cutlinesight.core.filter.ConfidenceThreshold;
import com.cutlinesight.core.model.SizeCategory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level POJO for the analytics YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional, defaults shown):
 * </p>
 *
 * <pre>
 * ingest:
 *   defaultSource: Cutting Table 1
 *   defaultConfidence: 0.9
 *   timestampZone: UTC
 * synthetic:
 *   eventCount: 220
 *   confidenceBase: 0.72
 *   confidenceSpread: 0.27
 *   weights: { Small: 0.22, Medium: 0.38, Large: 0.31, XL: 0.09 }
 * display:
 *   defaultConfidenceThreshold: 0.7
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsConfig {

    private IngestSettings ingest = new IngestSettings();
    private SyntheticSettings synthetic = new SyntheticSettings();
    private DisplaySettings display = new DisplaySettings();

    /**
     * @return a configuration holding only built-in defaults
     */
    public static AnalyticsConfig defaults() {
        return new AnalyticsConfig();
    }

    /**
     * Validate every section and report all problems at once.
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        ingest.collectErrors(errors);
        synthetic.collectErrors(errors);
        display.collectErrors(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analytics configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public IngestSettings getIngest() {
        return ingest;
    }

    public void setIngest(IngestSettings ingest) {
        this.ingest = ingest != null ? ingest : new IngestSettings();
    }

    public SyntheticSettings getSynthetic() {
        return synthetic;
    }

    public void setSynthetic(SyntheticSettings synthetic) {
        this.synthetic = synthetic != null ? synthetic : new SyntheticSettings();
    }

    public DisplaySettings getDisplay() {
        return display;
    }

    public void setDisplay(DisplaySettings display) {
        this.display = display != null ? display : new DisplaySettings();
    }

    @Override
    public String toString() {
        return "AnalyticsConfig{ingest=" + ingest + ", synthetic=" + synthetic + ", display=" + display + '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** Defaults applied while normalizing raw feed records. */
    public static class IngestSettings {

        private String defaultSource = "Cutting Table 1";
        private double defaultConfidence = 0.9;
        /** Zone for timestamps that carry no offset. */
        private String timestampZone = "UTC";

        void collectErrors(List<String> errors) {
            if (defaultSource == null || defaultSource.isBlank()) {
                errors.add("ingest.defaultSource must not be blank");
            }
            if (!(defaultConfidence >= 0.0 && defaultConfidence <= 1.0)) {
                errors.add("ingest.defaultConfidence must be in [0, 1], got: " + defaultConfidence);
            }
            try {
                ZoneId.of(timestampZone);
            } catch (DateTimeException | NullPointerException e) {
                errors.add("ingest.timestampZone is not a valid zone id: '" + timestampZone + "'");
            }
        }

        public ZoneId zoneId() {
            return ZoneId.of(timestampZone);
        }

        public String getDefaultSource() {
            return defaultSource;
        }

        public void setDefaultSource(String defaultSource) {
            this.defaultSource = defaultSource;
        }

        public double getDefaultConfidence() {
            return defaultConfidence;
        }

        public void setDefaultConfidence(double defaultConfidence) {
            this.defaultConfidence = defaultConfidence;
        }

        public String getTimestampZone() {
            return timestampZone;
        }

        public void setTimestampZone(String timestampZone) {
            this.timestampZone = timestampZone;
        }

        @Override
        public String toString() {
            return "{defaultSource='" + defaultSource + "', defaultConfidence=" + defaultConfidence
                    + ", timestampZone=" + timestampZone + '}';
        }
    }

    /** Parameters of the deterministic fallback generator. */
    public static class SyntheticSettings {

        private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

        private int eventCount = 220;
        private double confidenceBase = 0.72;
        private double confidenceSpread = 0.27;
        private Map<String, Number> weights = defaultWeights();

        private static Map<String, Number> defaultWeights() {
            Map<String, Number> w = new LinkedHashMap<>();
            w.put("Small", 0.22);
            w.put("Medium", 0.38);
            w.put("Large", 0.31);
            w.put("XL", 0.09);
            return w;
        }

        void collectErrors(List<String> errors) {
            if (eventCount < 0) {
                errors.add("synthetic.eventCount must be >= 0, got: " + eventCount);
            }
            if (confidenceSpread < 0) {
                errors.add("synthetic.confidenceSpread must be >= 0, got: " + confidenceSpread);
            }
            if (weights == null || weights.isEmpty()) {
                errors.add("synthetic.weights must name at least one category");
                return;
            }
            double sum = 0;
            for (Map.Entry<String, Number> entry : weights.entrySet()) {
                if (SizeCategory.fromLabel(entry.getKey()).isEmpty()) {
                    errors.add("synthetic.weights has unknown category '" + entry.getKey()
                            + "'. Supported: Small, Medium, Large, XL");
                }
                if (entry.getValue() == null || entry.getValue().doubleValue() < 0) {
                    errors.add("synthetic.weights." + entry.getKey() + " must be >= 0");
                } else {
                    sum += entry.getValue().doubleValue();
                }
            }
            if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
                errors.add("synthetic.weights must sum to 1, got: " + sum);
            }
        }

        /**
         * @return weights keyed by category in declaration order; categories
         *         missing from the YAML weigh zero
         */
        public EnumMap<SizeCategory, Double> categoryWeights() {
            EnumMap<SizeCategory, Double> result = new EnumMap<>(SizeCategory.class);
            for (SizeCategory category : SizeCategory.values()) {
                Number w = weights != null ? weights.get(category.getLabel()) : null;
                result.put(category, w != null ? w.doubleValue() : 0.0);
            }
            return result;
        }

        public int getEventCount() {
            return eventCount;
        }

        public void setEventCount(int eventCount) {
            this.eventCount = eventCount;
        }

        public double getConfidenceBase() {
            return confidenceBase;
        }

        public void setConfidenceBase(double confidenceBase) {
            this.confidenceBase = confidenceBase;
        }

        public double getConfidenceSpread() {
            return confidenceSpread;
        }

        public void setConfidenceSpread(double confidenceSpread) {
            this.confidenceSpread = confidenceSpread;
        }

        public Map<String, Number> getWeights() {
            return weights;
        }

        public void setWeights(Map<String, Number> weights) {
            this.weights = weights != null ? new LinkedHashMap<>(weights) : null;
        }

        @Override
        public String toString() {
            return "{eventCount=" + eventCount + ", confidenceBase=" + confidenceBase
                    + ", confidenceSpread=" + confidenceSpread + ", weights=" + weights + '}';
        }
    }

    /** Defaults for the event table and export. */
    public static class DisplaySettings {

        private double defaultConfidenceThreshold = ConfidenceThreshold.DEFAULT.getValue();

        void collectErrors(List<String> errors) {
            if (ConfidenceThreshold.fromValue(defaultConfidenceThreshold).isEmpty()) {
                errors.add("display.defaultConfidenceThreshold must be one of 0.5, 0.6, 0.7, 0.8, 0.9, got: "
                        + defaultConfidenceThreshold);
            }
        }

        public ConfidenceThreshold defaultThreshold() {
            return ConfidenceThreshold.fromValue(defaultConfidenceThreshold)
                    .orElse(ConfidenceThreshold.DEFAULT);
        }

        public double getDefaultConfidenceThreshold() {
            return defaultConfidenceThreshold;
        }

        public void setDefaultConfidenceThreshold(double defaultConfidenceThreshold) {
            this.defaultConfidenceThreshold = defaultConfidenceThreshold;
        }

        @Override
        public String toString() {
            return "{defaultConfidenceThreshold=" + defaultConfidenceThreshold + '}';
        }
    }
}
