package com.linlay.agentsview.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentsview.model.AgentType;
import com.linlay.agentsview.model.MessageRole;
import com.linlay.agentsview.model.ParseResult;
import com.linlay.agentsview.model.ParsedMessage;
import com.linlay.agentsview.model.ParsedSession;
import com.linlay.agentsview.model.TokenUsage;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Codex rollout files ({@code YYYY/MM/DD/rollout-<timestamp>-<uuid>.jsonl}).
 * The grammar is {@code session_meta} for identity and {@code response_item} for messages
 * whose content blocks are {@code input_text} / {@code output_text}.
 */
@Component
public class CodexSessionParser {

    public static final String SESSION_ID_PREFIX = "codex:";

    private static final Pattern ROLLOUT_UUID_PATTERN = Pattern.compile(
            "^rollout-.*-([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})$"
    );

    private static final List<String> INJECTED_USER_PREFIXES = List.of(
            "<environment_context>",
            "<user_instructions>",
            "# AGENTS.md instructions"
    );

    private final JsonlReader jsonlReader;

    public CodexSessionParser(ObjectMapper objectMapper) {
        this.jsonlReader = new JsonlReader(objectMapper);
    }

    public ParseResult parse(Path file, String machine) throws IOException {
        ParseState state = new ParseState();
        jsonlReader.forEachRecord(file, state::accept);

        List<ParsedMessage> messages = state.messages;
        int userCount = (int) messages.stream().filter(message -> message.role() == MessageRole.USER).count();
        ParsedSession session = new ParsedSession(
                sessionId(state.metaId, file),
                ProjectIdentity.projectFromCwd(state.cwd),
                machine,
                AgentType.CODEX,
                null,
                state.firstMessage == null ? "" : state.firstMessage,
                state.startedAt,
                state.endedAt,
                messages.size(),
                userCount,
                TokenUsage.ZERO
        );
        return new ParseResult(session, messages);
    }

    /**
     * Resolves the session ID without a full parse by reading up to the first
     * {@code session_meta} record. Agrees with {@link #parse} for the same file.
     */
    public String peekSessionId(Path file) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                JsonNode record = jsonlReader.parseLine(line);
                if (record != null && "session_meta".equals(ContentRenderer.text(record, "type"))) {
                    return sessionId(ContentRenderer.text(record.path("payload"), "id"), file);
                }
            }
        }
        return sessionId(null, file);
    }

    /**
     * Extracts the trailing UUID of a rollout filename; returns an empty string when the
     * name does not end in a UUID.
     */
    public static String extractUuidFromRollout(String filename) {
        if (filename == null) {
            return "";
        }
        String stem = filename.endsWith(".jsonl") ? filename.substring(0, filename.length() - ".jsonl".length()) : filename;
        Matcher matcher = ROLLOUT_UUID_PATTERN.matcher(stem);
        return matcher.matches() ? matcher.group(1) : "";
    }

    private static String sessionId(String metaId, Path file) {
        if (StringUtils.hasText(metaId)) {
            return SESSION_ID_PREFIX + metaId.trim();
        }
        String filename = file.getFileName().toString();
        String uuid = extractUuidFromRollout(filename);
        if (!uuid.isEmpty()) {
            return SESSION_ID_PREFIX + uuid;
        }
        return SESSION_ID_PREFIX + ClaudeSessionParser.sessionIdFromFile(file);
    }

    static String extractText(JsonNode content) {
        if (content.isTextual()) {
            return content.asText();
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode block : content) {
            String type = ContentRenderer.text(block, "type");
            if ("input_text".equals(type) || "output_text".equals(type) || "text".equals(type)) {
                String text = ContentRenderer.text(block, "text");
                if (!text.isEmpty()) {
                    parts.add(text);
                }
            }
        }
        return String.join("\n", parts);
    }

    static MessageRole resolveRole(String rawRole, JsonNode content, String originator) {
        if (StringUtils.hasText(rawRole)) {
            return switch (rawRole.trim()) {
                case "user" -> MessageRole.USER;
                case "assistant" -> MessageRole.ASSISTANT;
                case "system", "developer" -> MessageRole.SYSTEM;
                default -> null;
            };
        }
        for (JsonNode block : content) {
            String type = ContentRenderer.text(block, "type");
            if ("input_text".equals(type)) {
                return MessageRole.USER;
            }
            if ("output_text".equals(type)) {
                return MessageRole.ASSISTANT;
            }
        }
        MessageRole hinted = MessageRole.fromValue(originator);
        return hinted == MessageRole.SYSTEM ? null : hinted;
    }

    static boolean isInjectedUserContent(String content) {
        String trimmed = content.trim();
        for (String prefix : INJECTED_USER_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static final class ParseState {
        private final List<ParsedMessage> messages = new ArrayList<>();
        private String metaId;
        private String cwd;
        private String originator;
        private String firstMessage;
        private Instant startedAt;
        private Instant endedAt;

        private void accept(JsonNode record) {
            String type = ContentRenderer.text(record, "type");
            JsonNode payload = record.path("payload");
            if ("session_meta".equals(type)) {
                acceptMeta(payload);
            } else if ("response_item".equals(type)) {
                acceptResponseItem(payload, TimestampParser.parse(ContentRenderer.text(record, "timestamp")));
            }
        }

        private void acceptMeta(JsonNode payload) {
            if (metaId != null) {
                return;
            }
            metaId = ContentRenderer.text(payload, "id");
            cwd = ContentRenderer.text(payload, "cwd");
            originator = ContentRenderer.text(payload, "originator");
        }

        private void acceptResponseItem(JsonNode payload, Instant timestamp) {
            String payloadType = ContentRenderer.text(payload, "type");
            if (StringUtils.hasText(payloadType) && !"message".equals(payloadType)) {
                return;
            }
            JsonNode content = payload.path("content");
            String text = extractText(content);
            if (text.isBlank()) {
                return;
            }
            MessageRole role = resolveRole(ContentRenderer.text(payload, "role"), content, originator);
            if (role == null) {
                return;
            }
            if (role == MessageRole.USER && isInjectedUserContent(text)) {
                role = MessageRole.SYSTEM;
            }
            if (role == MessageRole.USER && firstMessage == null) {
                firstMessage = ClaudeSessionParser.truncateFirstMessage(text);
            }
            messages.add(ParsedMessage.of(messages.size(), role, text, timestamp));
            if (timestamp != null) {
                if (startedAt == null || timestamp.isBefore(startedAt)) {
                    startedAt = timestamp;
                }
                if (endedAt == null || timestamp.isAfter(endedAt)) {
                    endedAt = timestamp;
                }
            }
        }
    }
}
