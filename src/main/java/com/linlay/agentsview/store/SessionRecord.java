package com.linlay.agentsview.store;

import com.linlay.agentsview.model.AgentType;
import com.linlay.agentsview.model.TokenUsage;

import java.time.Instant;
import java.util.List;

/**
 * Persisted identity row of a session. {@code messageCount == 0} marks a tombstone: the
 * file was parsed but yielded nothing, and is only reparsed once its content changes.
 */
public record SessionRecord(
        String id,
        String project,
        String machine,
        AgentType agent,
        String firstMessage,
        Instant startedAt,
        Instant endedAt,
        int messageCount,
        int userMessageCount,
        String parentSessionId,
        TokenUsage tokenUsage,
        List<String> mcpServers,
        String filePath,
        long fileSize,
        long fileMtime,
        String fileHash
) {

    public SessionRecord {
        tokenUsage = tokenUsage == null ? TokenUsage.ZERO : tokenUsage;
        mcpServers = mcpServers == null ? List.of() : List.copyOf(mcpServers);
    }

    public SessionRecord withProject(String newProject) {
        return new SessionRecord(id, newProject, machine, agent, firstMessage, startedAt, endedAt,
                messageCount, userMessageCount, parentSessionId, tokenUsage, mcpServers,
                filePath, fileSize, fileMtime, fileHash);
    }

    public boolean isTombstone() {
        return messageCount == 0;
    }
}
