package com.phillippitts.summarizer.domain;

import java.util.Locale;

/**
 * Confidence label attached to a summary and to each project breakdown.
 */
public enum Confidence {
    HIGH, MEDIUM, LOW;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of a model-supplied label; anything unrecognised becomes {@link #MEDIUM}.
     */
    public static Confidence fromLabel(String label) {
        if (label == null) {
            return MEDIUM;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "high" -> HIGH;
            case "low" -> LOW;
            default -> MEDIUM;
        };
    }
}
