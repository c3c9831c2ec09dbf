package com.phillippitts.summarizer.service.bundled;

/**
 * Handle to the server the manager is responsible for.
 *
 * @param pid OS process id, or {@code -1} for an adopted server
 * @param managedByUs whether this manager spawned the process
 * @param process the spawned process, {@code null} when adopted
 */
record ManagedProcess(long pid, boolean managedByUs, Process process) {

    static ManagedProcess adopted() {
        return new ManagedProcess(-1, false, null);
    }

    static ManagedProcess spawned(Process process) {
        return new ManagedProcess(pidOf(process), true, process);
    }

    boolean running() {
        return process == null || process.isAlive();
    }

    private static long pidOf(Process process) {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return -1;
        }
    }
}
