package com.linlay.agentsview.model;

public record ToolResult(
        String toolUseId,
        int contentLength,
        String content
) {

    public ToolResult {
        content = content == null ? "" : content;
    }

    public static ToolResult of(String toolUseId, String content) {
        String safe = content == null ? "" : content;
        return new ToolResult(toolUseId, safe.length(), safe);
    }
}
