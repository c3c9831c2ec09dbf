package com.phillippitts.summarizer.service.backend;

/**
 * One progress line of a model pull.
 *
 * @param percent completed/total as a whole percentage, 0 when the total is unknown
 */
public record PullProgress(String status, String digest, long total, long completed, int percent) {

    static PullProgress of(String status, String digest, long total, long completed) {
        int percent = total > 0 ? (int) ((double) completed / total * 100) : 0;
        return new PullProgress(status, digest, total, completed, percent);
    }
}
