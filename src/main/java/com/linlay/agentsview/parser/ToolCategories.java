package com.linlay.agentsview.parser;

import org.springframework.util.StringUtils;

import java.util.Map;

public final class ToolCategories {

    public static final String MCP_PREFIX = "mcp__";
    private static final String MCP_SEPARATOR = "__";
    private static final String OTHER = "Other";

    private static final Map<String, String> CATEGORIES = Map.ofEntries(
            Map.entry("Read", "Read"),
            Map.entry("Edit", "Edit"),
            Map.entry("MultiEdit", "Edit"),
            Map.entry("NotebookEdit", "Edit"),
            Map.entry("Write", "Write"),
            Map.entry("Bash", "Bash"),
            Map.entry("Grep", "Grep"),
            Map.entry("Glob", "Glob"),
            Map.entry("Task", "Task"),
            Map.entry("Agent", "Task"),
            Map.entry("TodoWrite", "Todo"),
            Map.entry("WebFetch", "Web"),
            Map.entry("WebSearch", "Web")
    );

    private ToolCategories() {
    }

    public static String categorize(String toolName) {
        if (!StringUtils.hasText(toolName)) {
            return OTHER;
        }
        String mcpServer = mcpServerName(toolName);
        if (mcpServer != null) {
            return mcpServer;
        }
        return CATEGORIES.getOrDefault(toolName, OTHER);
    }

    /**
     * @return {@code <server>} for a tool named {@code mcp__<server>__<operation>}, otherwise {@code null}
     */
    public static String mcpServerName(String toolName) {
        if (toolName == null || !toolName.startsWith(MCP_PREFIX)) {
            return null;
        }
        String rest = toolName.substring(MCP_PREFIX.length());
        int separator = rest.indexOf(MCP_SEPARATOR);
        if (separator <= 0) {
            return null;
        }
        if (rest.substring(separator + MCP_SEPARATOR.length()).isEmpty()) {
            return null;
        }
        return rest.substring(0, separator);
    }
}
