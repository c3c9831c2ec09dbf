package com.phillippitts.summarizer.presentation.controller;

import com.phillippitts.summarizer.domain.ProjectBreakdown;
import com.phillippitts.summarizer.domain.SummaryResult;

import java.util.List;

/**
 * Wire form of a {@link SummaryResult}; confidence values are lower-case labels.
 */
public record SummaryResponse(
        String summary,
        String explanation,
        List<String> tags,
        String confidence,
        List<Project> projects,
        String modelUsed,
        long inferenceMs
) {

    public record Project(String name, int timeMinutes, List<String> activities, String confidence) {
    }

    public static SummaryResponse from(SummaryResult result) {
        List<Project> projects = result.projects().stream()
                .map(SummaryResponse::project)
                .toList();
        return new SummaryResponse(result.summary(), result.explanation(), result.tags(),
                result.confidence().label(), projects, result.modelUsed(), result.inferenceMs());
    }

    private static Project project(ProjectBreakdown p) {
        return new Project(p.name(), p.timeMinutes(), p.activities(), p.confidence().label());
    }
}
