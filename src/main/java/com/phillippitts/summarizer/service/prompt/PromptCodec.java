package com.phillippitts.summarizer.service.prompt;

import com.phillippitts.summarizer.domain.Confidence;
import com.phillippitts.summarizer.domain.FocusEvent;
import com.phillippitts.summarizer.domain.ProjectBreakdown;
import com.phillippitts.summarizer.domain.SessionContext;
import com.phillippitts.summarizer.domain.SummaryResult;
import com.phillippitts.summarizer.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a {@link SessionContext} into a prompt and a model's reply into a {@link SummaryResult}.
 *
 * <p>Both directions are pure. {@link #parseResponse(String)} never throws: a reply that does not
 * contain a decodable JSON object degrades to a plain-text summary.
 */
public class PromptCodec {

    private static final Logger LOG = LogManager.getLogger(PromptCodec.class);

    static final int MAX_WINDOWS_PER_APP = 5;
    static final int FALLBACK_SUMMARY_MAX_CHARS = 200;
    static final String FALLBACK_TAG = "general";
    static final String EMPTY_REPLY_SUMMARY = "No summary was generated for this session.";

    private static final String HEADER = "Analyze this work session and provide a detailed summary.\n\n";

    static final String RESPONSE_INSTRUCTIONS = """
            Respond in this exact JSON format:
            {
              "summary": "2-3 sentences describing what was accomplished.",
              "explanation": "A paragraph explaining the work themes.",
              "projects": [
                {
                  "name": "Project Name",
                  "timeMinutes": 45,
                  "activities": ["Did X to achieve Y", "Fixed bug in Z component"],
                  "confidence": "high"
                }
              ],
              "tags": ["tag1", "tag2"],
              "confidence": "high"
            }

            PROJECT DETECTION:
            - Identify distinct projects from git repos, file paths, window titles, domains
            - Use the bare project name: "Atlas" not "Atlas Development"
            - Research or learning ABOUT a project belongs TO that project
            - Only use a "Research" project for truly unrelated learning
            - Time estimates should sum to session duration

            ACTIVITY QUALITY - CRITICAL:
            Each activity MUST describe a concrete action with context. Pattern: "[Action verb] [specific thing] [optional: why/result]"

            GOOD ACTIVITIES (include these):
            - "Implemented pan/zoom controls for timeline visualization"
            - "Fixed cross-midnight date filtering bug in reports"
            - "Debugged summary generation - model was inventing project names"
            - "Compared retry strategies for the upload client"

            BAD ACTIVITIES (NEVER include these):
            - "Edited files in /path/to/project" (obviously files were edited)
            - "Reviewed documentation" (which docs? why?)
            - "Tested functionalities" (which functionality?)
            - "Coding and development", "Worked on project", "Made changes", "Updated code"
            - "Browser activity" or "web browsing"
            - Any activity that just restates the project name
            - Any activity under 5 words

            INFER SPECIFICS FROM CONTEXT:
            - Window title "timeline.tsx - VS Code" + git commit "fix zoom" -> "Fixed zoom behavior in timeline component"
            - Browser on "localhost:8000/demo" + focus on the demo project -> "Tested demo application locally"

            If you cannot infer a specific activity, OMIT IT rather than writing something generic.
            """;

    /**
     * Builds the prompt. Sections appear in a fixed order and empty sections are omitted.
     */
    public String buildPrompt(SessionContext ctx) {
        StringBuilder sb = new StringBuilder(HEADER);

        sb.append("Session Duration: ").append(TimeUtils.formatHoursMinutes(ctx.durationSeconds())).append('\n');
        sb.append("Screenshots: ").append(ctx.screenshotCount()).append("\n\n");

        appendApplicationActivity(sb, ctx.focusEvents());
        appendMeetings(sb, ctx.focusEvents());
        appendList(sb, "GIT COMMITS", ctx.gitCommits());
        appendList(sb, "SHELL COMMANDS", ctx.shellCommands());
        appendList(sb, "FILE ACTIVITY", ctx.fileEvents());
        appendList(sb, "BROWSER ACTIVITY", ctx.browserVisits());

        sb.append(RESPONSE_INSTRUCTIONS);
        return sb.toString();
    }

    /**
     * Decodes the span from the first '{' to the last '}' of the reply.
     */
    public SummaryResult parseResponse(String raw) {
        String text = raw == null ? "" : raw;
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            try {
                return decode(new JSONObject(text.substring(start, end + 1)));
            } catch (JSONException e) {
                LOG.debug("Reply is not valid JSON, using plain-text fallback: {}", e.getMessage());
            }
        }
        return fallback(text);
    }

    private static SummaryResult decode(JSONObject json) {
        List<ProjectBreakdown> projects = new ArrayList<>();
        JSONArray projectArray = json.optJSONArray("projects");
        if (projectArray != null) {
            for (int i = 0; i < projectArray.length(); i++) {
                JSONObject p = projectArray.optJSONObject(i);
                if (p == null) {
                    continue;
                }
                List<String> activities = new ArrayList<>();
                for (String activity : strings(p.optJSONArray("activities"))) {
                    if (!ActivityQualityFilter.isLowInformation(activity)) {
                        activities.add(activity);
                    }
                }
                projects.add(new ProjectBreakdown(
                        p.optString("name", ""),
                        p.optInt("timeMinutes", 0),
                        activities,
                        Confidence.fromLabel(p.optString("confidence", null))));
            }
        }
        return new SummaryResult(
                json.optString("summary", ""),
                json.optString("explanation", ""),
                strings(json.optJSONArray("tags")),
                Confidence.fromLabel(json.optString("confidence", null)),
                projects,
                "",
                0);
    }

    private static SummaryResult fallback(String raw) {
        String summary = raw.trim();
        if (summary.isEmpty()) {
            summary = EMPTY_REPLY_SUMMARY;
        } else if (summary.length() > FALLBACK_SUMMARY_MAX_CHARS) {
            summary = summary.substring(0, FALLBACK_SUMMARY_MAX_CHARS) + "...";
        }
        return new SummaryResult(summary, "", List.of(FALLBACK_TAG), Confidence.MEDIUM, List.of(), "", 0);
    }

    private static List<String> strings(JSONArray array) {
        List<String> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        for (int i = 0; i < array.length(); i++) {
            Object value = array.opt(i);
            if (value instanceof String s) {
                values.add(s);
            }
        }
        return values;
    }

    private static void appendApplicationActivity(StringBuilder sb, List<FocusEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        sb.append("=== APPLICATION ACTIVITY ===\n");

        // Insertion order is first-seen order; the stable sort keeps it for equal durations.
        Map<String, Map<String, Double>> windowsByApp = new LinkedHashMap<>();
        Map<String, Double> appTotals = new LinkedHashMap<>();
        for (FocusEvent evt : events) {
            windowsByApp.computeIfAbsent(evt.appName(), k -> new LinkedHashMap<>())
                    .merge(evt.windowTitle(), evt.durationSeconds(), Double::sum);
            appTotals.merge(evt.appName(), evt.durationSeconds(), Double::sum);
        }

        for (Map.Entry<String, Double> app : byDurationDescending(appTotals)) {
            int appMinutes = TimeUtils.wholeMinutes(app.getValue());
            if (appMinutes < 1) {
                continue;
            }
            sb.append('\n').append(app.getKey()).append(" (").append(appMinutes).append("m):\n");

            List<Map.Entry<String, Double>> windows = byDurationDescending(windowsByApp.get(app.getKey()));
            for (int i = 0; i < windows.size() && i < MAX_WINDOWS_PER_APP; i++) {
                int minutes = TimeUtils.wholeMinutes(windows.get(i).getValue());
                if (minutes >= 1) {
                    sb.append("  - ").append(windows.get(i).getKey()).append(" (").append(minutes).append("m)\n");
                }
            }
            if (windows.size() > MAX_WINDOWS_PER_APP) {
                sb.append("  ... and ").append(windows.size() - MAX_WINDOWS_PER_APP).append(" more windows\n");
            }
        }
        sb.append('\n');
    }

    private static void appendMeetings(StringBuilder sb, List<FocusEvent> events) {
        List<String> lines = new ArrayList<>();
        for (FocusEvent evt : events) {
            int minutes = TimeUtils.wholeMinutes(evt.durationSeconds());
            if (minutes >= 1 && isMeetingTitle(evt.windowTitle())) {
                lines.add("- " + evt.windowTitle() + " (" + minutes + "m)");
            }
        }
        if (lines.isEmpty()) {
            return;
        }
        sb.append("=== MEETINGS DETECTED ===\n");
        lines.forEach(line -> sb.append(line).append('\n'));
        sb.append('\n');
    }

    static boolean isMeetingTitle(String windowTitle) {
        String lower = windowTitle.toLowerCase(Locale.ROOT);
        return lower.contains("huddle")
                || lower.contains("zoom meeting")
                || lower.contains("meet.google.com")
                || (lower.contains("teams") && lower.contains("meeting"));
    }

    private static void appendList(StringBuilder sb, String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append("=== ").append(title).append(" ===\n");
        for (String item : items) {
            sb.append("- ").append(item).append('\n');
        }
        sb.append('\n');
    }

    private static List<Map.Entry<String, Double>> byDurationDescending(Map<String, Double> durations) {
        List<Map.Entry<String, Double>> entries = new ArrayList<>(durations.entrySet());
        entries.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));
        return entries;
    }
}
