package com.linlay.agentsview.model;

import java.time.Instant;

/**
 * Session-level metadata produced by a parser. Counts are those of the raw parse; the
 * sync engine recomputes them after pairing and filtering.
 */
public record ParsedSession(
        String id,
        String project,
        String machine,
        AgentType agent,
        String parentSessionId,
        String firstMessage,
        Instant startedAt,
        Instant endedAt,
        int messageCount,
        int userMessageCount,
        TokenUsage tokenUsage
) {

    public ParsedSession {
        tokenUsage = tokenUsage == null ? TokenUsage.ZERO : tokenUsage;
    }
}
