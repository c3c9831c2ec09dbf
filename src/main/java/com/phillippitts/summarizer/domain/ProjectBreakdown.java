package com.phillippitts.summarizer.domain;

import java.util.List;
import java.util.Objects;

/**
 * Time spent on one project within a session.
 *
 * @param name project name
 * @param timeMinutes estimated minutes
 * @param activities concrete activity descriptions (already quality-filtered)
 * @param confidence model confidence for this breakdown
 */
public record ProjectBreakdown(String name, int timeMinutes, List<String> activities, Confidence confidence) {

    public ProjectBreakdown {
        name = Objects.requireNonNullElse(name, "");
        activities = activities == null ? List.of() : List.copyOf(activities);
        confidence = Objects.requireNonNullElse(confidence, Confidence.MEDIUM);
    }
}
