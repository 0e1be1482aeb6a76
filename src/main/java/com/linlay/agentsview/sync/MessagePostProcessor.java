package com.linlay.agentsview.sync;

import com.linlay.agentsview.model.MessageRole;
import com.linlay.agentsview.model.ParsedMessage;
import com.linlay.agentsview.model.ToolCall;
import com.linlay.agentsview.model.ToolResult;
import com.linlay.agentsview.parser.ToolCategories;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Post-parse pass over a message list: pairs tool results with their calls, drops the
 * user placeholders that only carried tool output, and renumbers ordinals 0..N-1.
 */
public final class MessagePostProcessor {

    private MessagePostProcessor() {
    }

    public static List<ParsedMessage> pairAndFilter(List<ParsedMessage> messages) {
        return reorder(filterEmptyMessages(pairToolResults(messages)));
    }

    /**
     * Copies each result onto the earlier call with the same ID. Results stay on their own
     * message as well; a result without a matching call is left alone, and a call without a
     * result keeps a zero length.
     */
    public static List<ParsedMessage> pairToolResults(List<ParsedMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<ParsedMessage> paired = new ArrayList<>(messages);
        // tool use id -> {message index, call index}
        Map<String, int[]> callIndex = new HashMap<>();
        for (int i = 0; i < paired.size(); i++) {
            ParsedMessage message = paired.get(i);
            List<ToolCall> calls = message.toolCalls();
            for (int j = 0; j < calls.size(); j++) {
                String id = calls.get(j).toolUseId();
                if (id != null && !id.isEmpty()) {
                    callIndex.put(id, new int[]{i, j});
                }
            }
            for (ToolResult result : message.toolResults()) {
                int[] location = callIndex.remove(result.toolUseId());
                if (location == null) {
                    continue;
                }
                ParsedMessage owner = paired.get(location[0]);
                List<ToolCall> updated = new ArrayList<>(owner.toolCalls());
                updated.set(location[1], updated.get(location[1]).withResult(result));
                paired.set(location[0], owner.withToolCalls(updated));
            }
        }
        return paired;
    }

    /**
     * Drops user messages whose trimmed content is empty and which carry at least one tool
     * result. Empty user messages without results and all assistant messages are kept.
     */
    public static List<ParsedMessage> filterEmptyMessages(List<ParsedMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<ParsedMessage> kept = new ArrayList<>(messages.size());
        for (ParsedMessage message : messages) {
            boolean placeholder = message.role() == MessageRole.USER
                    && message.content().isBlank()
                    && !message.toolResults().isEmpty();
            if (!placeholder) {
                kept.add(message);
            }
        }
        return kept;
    }

    public static List<ParsedMessage> reorder(List<ParsedMessage> messages) {
        List<ParsedMessage> ordered = new ArrayList<>(messages.size());
        for (int i = 0; i < messages.size(); i++) {
            ParsedMessage message = messages.get(i);
            ordered.add(message.ordinal() == i ? message : message.withOrdinal(i));
        }
        return List.copyOf(ordered);
    }

    public static MessageCounts postFilterCounts(List<ParsedMessage> messages) {
        if (messages == null) {
            return new MessageCounts(0, 0);
        }
        int user = 0;
        for (ParsedMessage message : messages) {
            if (message.role() == MessageRole.USER) {
                user++;
            }
        }
        return new MessageCounts(messages.size(), user);
    }

    /**
     * Distinct MCP server names used by the session, sorted.
     */
    public static List<String> extractMcpServers(List<ParsedMessage> messages) {
        Set<String> servers = new TreeSet<>();
        if (messages != null) {
            for (ParsedMessage message : messages) {
                for (ToolCall call : message.toolCalls()) {
                    String server = ToolCategories.mcpServerName(call.toolName());
                    if (server != null) {
                        servers.add(server);
                    }
                }
            }
        }
        return List.copyOf(servers);
    }

    public record MessageCounts(int total, int user) {
    }
}
