package com.phillippitts.summarizer.presentation.controller;

import com.phillippitts.summarizer.domain.FocusEvent;
import com.phillippitts.summarizer.domain.SessionContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;

/**
 * Request body of {@code POST /api/v1/summaries}. Missing lists are treated as empty; null elements are rejected.
 */
public record SummaryRequest(
        Instant startTime,
        Instant endTime,
        @PositiveOrZero long durationSeconds,
        @PositiveOrZero int screenshotCount,
        List<@Valid @NotNull Focus> focusEvents,
        List<@NotNull String> shellCommands,
        List<@NotNull String> gitCommits,
        List<@NotNull String> fileEvents,
        List<@NotNull String> browserVisits
) {

    public record Focus(@NotBlank String appName, String windowTitle, @PositiveOrZero double durationSeconds) {
    }

    public SessionContext toSessionContext() {
        List<FocusEvent> focus = focusEvents == null
                ? List.of()
                : focusEvents.stream()
                        .map(f -> new FocusEvent(f.appName(), f.windowTitle(), f.durationSeconds()))
                        .toList();
        return new SessionContext(startTime, endTime, durationSeconds, screenshotCount, focus,
                shellCommands, gitCommits, fileEvents, browserVisits);
    }
}
