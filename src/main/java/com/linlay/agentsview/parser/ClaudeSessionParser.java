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

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Claude Code session transcripts ({@code <project-dir>/<session-id>.jsonl}).
 * <p>
 * Only {@code user} and {@code assistant} records become messages. User records that are
 * injected by the tool rather than typed by a person (meta records, compaction summaries,
 * command and notification payloads) are classified as {@link MessageRole#SYSTEM}.
 */
@Component
public class ClaudeSessionParser {

    public static final int FIRST_MESSAGE_MAX_CHARS = 300;
    private static final String ELLIPSIS = "...";
    private static final String PLAN_CONTINUATION_PREFIX = "Implement the following plan";
    private static final Pattern TRANSCRIPT_REF_PATTERN = Pattern.compile("[/\\\\]([A-Za-z0-9_-]+)\\.jsonl");

    private static final List<String> SYSTEM_CONTENT_PREFIXES = List.of(
            "This session is being continued from a previous conversation",
            "[Request interrupted by user",
            "<task-notification>",
            "<command-message>",
            "<command-name>",
            "<local-command-",
            "Stop hook feedback:"
    );

    private final JsonlReader jsonlReader;

    public ClaudeSessionParser(ObjectMapper objectMapper) {
        this.jsonlReader = new JsonlReader(objectMapper);
    }

    public ParseResult parse(Path file, String project, String machine) throws IOException {
        String sessionId = sessionIdFromFile(file);
        ParseState state = new ParseState(sessionId);
        jsonlReader.forEachRecord(file, state::accept);

        List<ParsedMessage> messages = state.messages;
        int userCount = (int) messages.stream().filter(message -> message.role() == MessageRole.USER).count();
        ParsedSession session = new ParsedSession(
                sessionId,
                project == null ? "" : project,
                machine,
                AgentType.CLAUDE,
                state.resolveParent(),
                state.firstMessage == null ? "" : state.firstMessage,
                state.startedAt,
                state.endedAt,
                messages.size(),
                userCount,
                state.totalUsage()
        );
        return new ParseResult(session, messages);
    }

    public static String sessionIdFromFile(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".jsonl") ? name.substring(0, name.length() - ".jsonl".length()) : name;
    }

    static boolean isSystemUserRecord(JsonNode record, String content) {
        if (record.path("isMeta").asBoolean(false) || record.path("isCompactSummary").asBoolean(false)) {
            return true;
        }
        String trimmed = content.trim();
        for (String prefix : SYSTEM_CONTENT_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    static String truncateFirstMessage(String content) {
        if (content.length() <= FIRST_MESSAGE_MAX_CHARS) {
            return content;
        }
        return content.substring(0, FIRST_MESSAGE_MAX_CHARS) + ELLIPSIS;
    }

    static String transcriptReference(String content) {
        if (content == null || !content.startsWith(PLAN_CONTINUATION_PREFIX)) {
            return null;
        }
        Matcher matcher = TRANSCRIPT_REF_PATTERN.matcher(content);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static final class ParseState {
        private final String sessionId;
        private final List<ParsedMessage> messages = new ArrayList<>();
        // streaming writes repeat a message id; the last snapshot per id wins
        private final Map<String, TokenUsage> usageByMessageId = new LinkedHashMap<>();
        private String sessionIdParent;
        private boolean sessionIdChecked;
        private String transcriptParent;
        private String firstMessage;
        private Instant startedAt;
        private Instant endedAt;
        private int recordIndex;

        private ParseState(String sessionId) {
            this.sessionId = sessionId;
        }

        private void accept(JsonNode record) {
            recordIndex++;
            String type = ContentRenderer.text(record, "type");
            if ("user".equals(type)) {
                acceptUser(record);
            } else if ("assistant".equals(type)) {
                acceptAssistant(record);
            }
        }

        private void acceptUser(JsonNode record) {
            String recordSessionId = ContentRenderer.text(record, "sessionId");
            if (!sessionIdChecked && StringUtils.hasText(recordSessionId)) {
                sessionIdChecked = true;
                if (!recordSessionId.equals(sessionId)) {
                    sessionIdParent = recordSessionId;
                }
            }

            ContentRenderer.RenderedContent rendered = ContentRenderer.render(record.path("message").path("content"));
            if (rendered.text().isBlank() && rendered.toolResults().isEmpty()) {
                return;
            }

            MessageRole role = isSystemUserRecord(record, rendered.text()) ? MessageRole.SYSTEM : MessageRole.USER;
            if (role == MessageRole.USER && firstMessage == null && !rendered.text().isBlank()) {
                firstMessage = truncateFirstMessage(rendered.text());
                transcriptParent = transcriptReference(rendered.text());
            }
            addMessage(role, rendered, timestampOf(record));
        }

        private void acceptAssistant(JsonNode record) {
            JsonNode message = record.path("message");
            JsonNode usage = message.path("usage");
            if (usage.isObject()) {
                String messageId = ContentRenderer.text(message, "id");
                String key = StringUtils.hasText(messageId) ? messageId : "record-" + recordIndex;
                usageByMessageId.put(key, new TokenUsage(
                        usage.path("input_tokens").asLong(0),
                        usage.path("output_tokens").asLong(0),
                        usage.path("cache_creation_input_tokens").asLong(0),
                        usage.path("cache_read_input_tokens").asLong(0)
                ));
            }

            ContentRenderer.RenderedContent rendered = ContentRenderer.render(message.path("content"));
            if (rendered.text().isBlank() && rendered.toolCalls().isEmpty()) {
                return;
            }
            addMessage(MessageRole.ASSISTANT, rendered, timestampOf(record));
        }

        private void addMessage(MessageRole role, ContentRenderer.RenderedContent rendered, Instant timestamp) {
            messages.add(new ParsedMessage(
                    messages.size(),
                    role,
                    rendered.text(),
                    timestamp,
                    rendered.hasThinking(),
                    rendered.hasToolUse(),
                    rendered.text().length(),
                    rendered.toolCalls(),
                    rendered.toolResults()
            ));
            if (timestamp != null) {
                if (startedAt == null || timestamp.isBefore(startedAt)) {
                    startedAt = timestamp;
                }
                if (endedAt == null || timestamp.isAfter(endedAt)) {
                    endedAt = timestamp;
                }
            }
        }

        private Instant timestampOf(JsonNode record) {
            String raw = ContentRenderer.text(record, "timestamp");
            if (!StringUtils.hasText(raw)) {
                raw = ContentRenderer.text(record.path("snapshot"), "timestamp");
            }
            return TimestampParser.parse(raw);
        }

        private String resolveParent() {
            if (sessionIdParent != null) {
                return sessionIdParent;
            }
            if (transcriptParent != null && !transcriptParent.equals(sessionId)) {
                return transcriptParent;
            }
            return null;
        }

        private TokenUsage totalUsage() {
            TokenUsage total = TokenUsage.ZERO;
            for (TokenUsage usage : usageByMessageId.values()) {
                total = total.plus(usage);
            }
            return total;
        }
    }
}
