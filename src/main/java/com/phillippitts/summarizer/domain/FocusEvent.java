package com.phillippitts.summarizer.domain;

import java.util.Objects;

/**
 * One window-focus interval supplied by the capture pipeline.
 *
 * @param appName application name, e.g. "Editor"
 * @param windowTitle window title at the time of focus
 * @param durationSeconds focused time in seconds
 */
public record FocusEvent(String appName, String windowTitle, double durationSeconds) {

    public FocusEvent {
        appName = Objects.requireNonNullElse(appName, "");
        windowTitle = Objects.requireNonNullElse(windowTitle, "");
        if (durationSeconds < 0) {
            durationSeconds = 0;
        }
    }
}
