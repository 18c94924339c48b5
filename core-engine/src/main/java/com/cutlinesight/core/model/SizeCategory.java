package com.cutlinesight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed set of item size classes reported by the cutting-line camera.
 *
 * <p>
 * Declaration order matters: it is the order in which weighted sampling walks
 * the categories and the column order of every per-category breakdown.
 * </p>
 *
 * @since 1.0.0
 */
public enum SizeCategory {

    SMALL("Small"),
    MEDIUM("Medium"),
    LARGE("Large"),
    XL("XL");

    private final String label;

    SizeCategory(String label) {
        this.label = label;
    }

    /**
     * @return the wire label, e.g. {@code "Medium"}
     */
    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Resolve a category from its wire label. Matching is case-sensitive:
     * {@code "small"} is not a category.
     *
     * @param label the label to look up; may be {@code null}
     * @return the category, or empty if the label is not one of the four
     */
    public static Optional<SizeCategory> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (SizeCategory category : values()) {
            if (category.label.equals(label)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
