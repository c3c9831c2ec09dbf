package com.phillippitts.summarizer.service.bundled;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Drains a process stream for its whole lifetime and keeps only the most recent lines.
 *
 * <p>A long-running server writes to stderr continuously; reading it prevents the child from
 * blocking on a full pipe. The retained tail (bounded by {@code maxChars}) is what ends up in
 * error messages when the server dies during startup.
 */
final class StderrTail implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StderrTail.class);

    private final InputStream inputStream;
    private final String name;
    private final int maxChars;
    private final Deque<String> lines = new ArrayDeque<>();
    private int retainedChars;
    private volatile Thread thread;

    private StderrTail(InputStream inputStream, String name, int maxChars) {
        this.inputStream = inputStream;
        this.name = name;
        this.maxChars = maxChars;
    }

    /**
     * Starts a daemon thread draining {@code inputStream}.
     */
    static StderrTail start(InputStream inputStream, String name, int maxChars) {
        StderrTail tail = new StderrTail(inputStream, name, maxChars);
        Thread thread = new Thread(tail, name);
        thread.setDaemon(true);
        thread.start();
        tail.thread = thread;
        return tail;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                LOG.trace("[{}] {}", name, line);
                append(line);
            }
        } catch (IOException e) {
            LOG.debug("Stream reader '{}' stopped: {}", name, e.toString());
        }
    }

    private synchronized void append(String line) {
        String kept = line.length() > maxChars ? line.substring(line.length() - maxChars) : line;
        lines.addLast(kept);
        retainedChars += kept.length() + 1;
        while (retainedChars > maxChars && lines.size() > 1) {
            retainedChars -= lines.removeFirst().length() + 1;
        }
    }

    synchronized String snapshot() {
        return String.join("\n", lines);
    }

    /**
     * Waits briefly for the reader to reach end of stream.
     */
    void join(long millis) {
        Thread t = thread;
        if (t == null) {
            return;
        }
        try {
            t.join(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
