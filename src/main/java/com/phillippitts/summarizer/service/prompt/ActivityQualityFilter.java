package com.phillippitts.summarizer.service.prompt;

import java.util.List;
import java.util.Locale;

/**
 * Heuristic rejection of generated activity descriptions that carry no information
 * ("Reviewed documentation", "Edited files in /src", ...).
 *
 * <p>Advisory only. The phrase lists are the tuning surface.
 */
public final class ActivityQualityFilter {

    static final int MIN_WORDS = 4;

    static final List<String> GENERIC_PHRASES = List.of(
            "reviewed documentation",
            "tested functionalities",
            "coding and development",
            "browser activity",
            "web browsing",
            "worked on project",
            "made changes",
            "updated code",
            "code editing",
            "various activities",
            "general development",
            "development work",
            "coding session",
            "programming tasks",
            "software development"
    );

    static final List<String> FILE_TEMPLATE_PREFIXES = List.of(
            "edited files in ",
            "modified files in ",
            "changed files in ",
            "updated files in "
    );

    static final List<String> GENERIC_ENDINGS = List.of(
            " in the browser",
            " in browser",
            " in chrome",
            " in google chrome",
            " in firefox",
            " and more",
            " etc",
            " etc."
    );

    /** Any of these rescues "tested ... in google chrome". */
    static final List<String> BROWSER_TEST_SPECIFICS = List.of("bug", "feature", "component", "page");

    /** Any of these rescues "... demo". */
    static final List<String> DEMO_VERBS = List.of(
            "built", "created", "tested", "fixed", "implemented", "reviewed", "presented");

    private ActivityQualityFilter() {
        // Utility class - prevent instantiation
    }

    /**
     * @return true when the activity should be dropped from a project breakdown
     */
    public static boolean isLowInformation(String activity) {
        if (activity == null) {
            return true;
        }
        String trimmed = activity.trim();
        if (trimmed.isEmpty() || trimmed.split("\\s+").length < MIN_WORDS) {
            return true;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);

        for (String phrase : GENERIC_PHRASES) {
            if (lower.equals(phrase) || lower.startsWith(phrase + " ")) {
                return true;
            }
        }
        for (String prefix : FILE_TEMPLATE_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        for (String ending : GENERIC_ENDINGS) {
            if (lower.endsWith(ending)) {
                return true;
            }
        }
        if (lower.contains("tested") && lower.contains("in google chrome") && !containsAny(lower, BROWSER_TEST_SPECIFICS)) {
            return true;
        }
        return lower.endsWith(" demo") && !containsAny(lower, DEMO_VERBS);
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
