package com.linlay.agentsview.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentsview.model.ToolCall;
import com.linlay.agentsview.model.ToolResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flattens a message content node (plain string or block array) into the canonical text
 * form. Thinking and tool blocks become bracketed pseudo-markup so consumers can split the
 * text without parsing JSON again.
 */
public final class ContentRenderer {

    private static final Map<String, String> TODO_ICONS = Map.of(
            "completed", "✓",
            "in_progress", "→",
            "pending", "○"
    );
    private static final String DEFAULT_TODO_ICON = "○";

    private ContentRenderer() {
    }

    public static RenderedContent render(JsonNode content) {
        if (content == null || content.isMissingNode() || content.isNull()) {
            return RenderedContent.EMPTY;
        }
        if (content.isTextual()) {
            return new RenderedContent(content.asText(), false, false, List.of(), List.of());
        }
        if (!content.isArray()) {
            return RenderedContent.EMPTY;
        }

        List<String> parts = new ArrayList<>();
        List<ToolCall> toolCalls = new ArrayList<>();
        List<ToolResult> toolResults = new ArrayList<>();
        boolean hasThinking = false;
        boolean hasToolUse = false;
        for (JsonNode block : content) {
            String type = text(block, "type");
            switch (type) {
                case "text", "input_text", "output_text" -> {
                    String text = text(block, "text");
                    if (!text.isEmpty()) {
                        parts.add(text);
                    }
                }
                case "thinking" -> {
                    String thinking = text(block, "thinking");
                    if (!thinking.isEmpty()) {
                        hasThinking = true;
                        parts.add("[Thinking]\n" + thinking);
                    }
                }
                case "tool_use" -> {
                    hasToolUse = true;
                    parts.add(formatToolUse(block));
                    String name = text(block, "name");
                    JsonNode input = block.path("input");
                    toolCalls.add(ToolCall.pending(
                            text(block, "id"),
                            name,
                            ToolCategories.categorize(name),
                            input.isMissingNode() ? "" : input.toString()
                    ));
                }
                case "tool_result" -> toolResults.add(ToolResult.of(
                        text(block, "tool_use_id"),
                        toolResultText(block.path("content"))
                ));
                default -> {
                    // unknown block types carry no renderable text
                }
            }
        }
        return new RenderedContent(String.join("\n", parts), hasThinking, hasToolUse, toolCalls, toolResults);
    }

    static String formatToolUse(JsonNode block) {
        String name = text(block, "name");
        JsonNode input = block.path("input");
        return switch (name) {
            case "AskUserQuestion" -> formatAskUserQuestion(name, input);
            case "TodoWrite" -> formatTodoWrite(input);
            case "EnterPlanMode" -> "[Entering Plan Mode]";
            case "ExitPlanMode" -> "[Exiting Plan Mode]";
            case "Read" -> "[Read: " + text(input, "file_path") + "]";
            case "Glob" -> "[Glob: " + text(input, "pattern") + " in " + orDefault(text(input, "path"), ".") + "]";
            case "Grep" -> "[Grep: " + text(input, "pattern") + "]";
            case "Edit" -> "[Edit: " + text(input, "file_path") + "]";
            case "Write" -> "[Write: " + text(input, "file_path") + "]";
            case "Bash" -> formatBash(input);
            case "Task" -> "[Task: " + text(input, "description") + " (" + text(input, "subagent_type") + ")]";
            default -> "[Tool: " + name + "]";
        };
    }

    private static String formatAskUserQuestion(String name, JsonNode input) {
        List<String> lines = new ArrayList<>();
        lines.add("[Question: " + name + "]");
        for (JsonNode question : input.path("questions")) {
            lines.add("  " + text(question, "question"));
            for (JsonNode option : question.path("options")) {
                lines.add("    - " + text(option, "label") + ": " + text(option, "description"));
            }
        }
        return String.join("\n", lines);
    }

    private static String formatTodoWrite(JsonNode input) {
        List<String> lines = new ArrayList<>();
        lines.add("[Todo List]");
        for (JsonNode todo : input.path("todos")) {
            String icon = TODO_ICONS.getOrDefault(text(todo, "status"), DEFAULT_TODO_ICON);
            lines.add("  " + icon + " " + text(todo, "content"));
        }
        return String.join("\n", lines);
    }

    private static String formatBash(JsonNode input) {
        String command = text(input, "command");
        String description = text(input, "description");
        if (!description.isEmpty()) {
            return "[Bash: " + description + "]\n$ " + command;
        }
        return "[Bash]\n$ " + command;
    }

    private static String toolResultText(JsonNode content) {
        if (content.isTextual()) {
            return content.asText();
        }
        if (!content.isArray()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode block : content) {
            if ("text".equals(text(block, "type"))) {
                parts.add(text(block, "text"));
            }
        }
        return String.join("\n", parts);
    }

    static String text(JsonNode node, String field) {
        if (node == null) {
            return "";
        }
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : "";
    }

    private static String orDefault(String value, String fallback) {
        return value.isEmpty() ? fallback : value;
    }

    public record RenderedContent(
            String text,
            boolean hasThinking,
            boolean hasToolUse,
            List<ToolCall> toolCalls,
            List<ToolResult> toolResults
    ) {
        static final RenderedContent EMPTY = new RenderedContent("", false, false, List.of(), List.of());

        public RenderedContent {
            toolCalls = List.copyOf(toolCalls);
            toolResults = List.copyOf(toolResults);
        }
    }
}
