package com.linlay.agentsview.model;

import java.time.Instant;
import java.util.List;

/**
 * One normalized message. {@code content} is a single text blob where thinking and tool
 * blocks are rendered as bracketed markup such as {@code [Thinking]} or {@code [Bash]}.
 * {@code timestamp} is {@code null} when the source record had no parseable time.
 */
public record ParsedMessage(
        int ordinal,
        MessageRole role,
        String content,
        Instant timestamp,
        boolean hasThinking,
        boolean hasToolUse,
        int contentLength,
        List<ToolCall> toolCalls,
        List<ToolResult> toolResults
) {

    public ParsedMessage {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    }

    public static ParsedMessage of(int ordinal, MessageRole role, String content, Instant timestamp) {
        String safe = content == null ? "" : content;
        return new ParsedMessage(ordinal, role, safe, timestamp, false, false, safe.length(), List.of(), List.of());
    }

    public ParsedMessage withOrdinal(int newOrdinal) {
        return new ParsedMessage(newOrdinal, role, content, timestamp, hasThinking, hasToolUse,
                contentLength, toolCalls, toolResults);
    }

    public ParsedMessage withToolCalls(List<ToolCall> newToolCalls) {
        return new ParsedMessage(ordinal, role, content, timestamp, hasThinking, hasToolUse,
                contentLength, newToolCalls, toolResults);
    }

    public ParsedMessage withToolResults(List<ToolResult> newToolResults) {
        return new ParsedMessage(ordinal, role, content, timestamp, hasThinking, hasToolUse,
                contentLength, toolCalls, newToolResults);
    }
}
