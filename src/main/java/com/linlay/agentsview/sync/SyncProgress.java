package com.linlay.agentsview.sync;

/**
 * Snapshot handed to the progress sink after discovery and after each processed file.
 */
public record SyncProgress(
        Phase phase,
        int sessionsTotal,
        int sessionsDone,
        int synced,
        int skipped,
        int messagesIndexed
) {

    public enum Phase {
        DISCOVERING,
        SYNCING,
        DONE
    }

    /**
     * Completion in percent, {@code 0} while the total is unknown or zero.
     */
    public double percent() {
        if (sessionsTotal <= 0) {
            return 0;
        }
        return sessionsDone * 100.0 / sessionsTotal;
    }
}
