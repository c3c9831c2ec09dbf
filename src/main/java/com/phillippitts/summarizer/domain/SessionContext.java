package com.phillippitts.summarizer.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable input aggregate describing one tracked work session.
 * Supplied wholesale by the caller; this subsystem never mutates or persists it.
 *
 * @param startTime session start (may be null when unknown)
 * @param endTime session end (may be null when unknown)
 * @param durationSeconds total session length in seconds
 * @param screenshotCount number of screenshots captured during the session
 * @param focusEvents window-focus intervals
 * @param shellCommands raw shell command strings
 * @param gitCommits commit subject lines
 * @param fileEvents file-change descriptors
 * @param browserVisits browser visit descriptors
 */
public record SessionContext(
        Instant startTime,
        Instant endTime,
        long durationSeconds,
        int screenshotCount,
        List<FocusEvent> focusEvents,
        List<String> shellCommands,
        List<String> gitCommits,
        List<String> fileEvents,
        List<String> browserVisits
) {

    public SessionContext {
        focusEvents = copy(focusEvents);
        shellCommands = copy(shellCommands);
        gitCommits = copy(gitCommits);
        fileEvents = copy(fileEvents);
        browserVisits = copy(browserVisits);
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must not be negative: " + durationSeconds);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    /**
     * Mutable builder; {@link #build()} snapshots the collected values.
     */
    public static final class Builder {
        private Instant startTime;
        private Instant endTime;
        private long durationSeconds;
        private int screenshotCount;
        private final List<FocusEvent> focusEvents = new ArrayList<>();
        private final List<String> shellCommands = new ArrayList<>();
        private final List<String> gitCommits = new ArrayList<>();
        private final List<String> fileEvents = new ArrayList<>();
        private final List<String> browserVisits = new ArrayList<>();

        private Builder() {
        }

        public Builder timeRange(Instant start, Instant end) {
            this.startTime = start;
            this.endTime = end;
            if (start != null && end != null && !end.isBefore(start)) {
                this.durationSeconds = end.getEpochSecond() - start.getEpochSecond();
            }
            return this;
        }

        public Builder durationSeconds(long durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder screenshotCount(int screenshotCount) {
            this.screenshotCount = screenshotCount;
            return this;
        }

        public Builder focus(String appName, String windowTitle, double durationSeconds) {
            this.focusEvents.add(new FocusEvent(appName, windowTitle, durationSeconds));
            return this;
        }

        public Builder shellCommand(String command) {
            this.shellCommands.add(command);
            return this;
        }

        public Builder gitCommit(String subject) {
            this.gitCommits.add(subject);
            return this;
        }

        public Builder fileEvent(String descriptor) {
            this.fileEvents.add(descriptor);
            return this;
        }

        public Builder browserVisit(String descriptor) {
            this.browserVisits.add(descriptor);
            return this;
        }

        public SessionContext build() {
            return new SessionContext(startTime, endTime, durationSeconds, screenshotCount,
                    focusEvents, shellCommands, gitCommits, fileEvents, browserVisits);
        }
    }
}
