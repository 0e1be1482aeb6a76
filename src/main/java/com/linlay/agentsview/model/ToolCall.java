package com.linlay.agentsview.model;

/**
 * A tool invocation made by the assistant. The result fields stay empty until pairing
 * finds a tool result with the same {@code toolUseId}.
 */
public record ToolCall(
        String toolUseId,
        String toolName,
        String category,
        String inputJson,
        int resultContentLength,
        String resultContent
) {

    public ToolCall {
        resultContent = resultContent == null ? "" : resultContent;
    }

    public static ToolCall pending(String toolUseId, String toolName, String category, String inputJson) {
        return new ToolCall(toolUseId, toolName, category, inputJson, 0, "");
    }

    public ToolCall withResult(ToolResult result) {
        return new ToolCall(toolUseId, toolName, category, inputJson, result.contentLength(), result.content());
    }
}
