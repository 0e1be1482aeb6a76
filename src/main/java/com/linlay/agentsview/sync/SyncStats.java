package com.linlay.agentsview.sync;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate outcome of a sync pass. Failed files count towards neither synced nor skipped.
 */
public final class SyncStats {

    private int totalSessions;
    private int synced;
    private int skipped;
    private int messagesIndexed;
    private final List<Failure> failures = new ArrayList<>();

    public void setTotalSessions(int totalSessions) {
        this.totalSessions = totalSessions;
    }

    public void recordSkip() {
        skipped++;
    }

    public void recordSynced(int messageCount) {
        synced++;
        messagesIndexed += Math.max(0, messageCount);
    }

    public void recordFailure(String path, String reason) {
        failures.add(new Failure(path, reason));
    }

    public int totalSessions() {
        return totalSessions;
    }

    public int synced() {
        return synced;
    }

    public int skipped() {
        return skipped;
    }

    public int failed() {
        return failures.size();
    }

    public int messagesIndexed() {
        return messagesIndexed;
    }

    public List<Failure> failures() {
        return List.copyOf(failures);
    }

    @Override
    public String toString() {
        return "SyncStats{total=" + totalSessions
                + ", synced=" + synced
                + ", skipped=" + skipped
                + ", failed=" + failures.size()
                + ", messages=" + messagesIndexed
                + '}';
    }

    public record Failure(String path, String reason) {
    }
}
