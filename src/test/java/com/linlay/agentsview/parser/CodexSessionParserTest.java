package com.linlay.agentsview.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentsview.model.AgentType;
import com.linlay.agentsview.model.MessageRole;
import com.linlay.agentsview.model.ParseResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CodexSessionParserTest {

    private static final String UUID = "0194c5a2-1b2c-7d3e-8f40-123456789abc";
    private static final String ROLLOUT_NAME = "rollout-2024-01-15T10-30-00-" + UUID + ".jsonl";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CodexSessionParser parser = new CodexSessionParser(objectMapper);

    @Test
    void shouldParseMetaAndMessages() throws Exception {
        Path file = write(ROLLOUT_NAME,
                meta("meta-id-1", "/Users/wesm/code/my-app", "codex_cli_rs"),
                message("user", "input_text", "Add a flag", "2024-01-15T10:30:01Z"),
                message("assistant", "output_text", "Done.", "2024-01-15T10:30:05Z")
        );

        ParseResult result = parser.parse(file, "local");

        assertThat(result.session().id()).isEqualTo("codex:meta-id-1");
        assertThat(result.session().project()).isEqualTo("my_app");
        assertThat(result.session().agent()).isEqualTo(AgentType.CODEX);
        assertThat(result.session().machine()).isEqualTo("local");
        assertThat(result.session().firstMessage()).isEqualTo("Add a flag");
        assertThat(result.session().messageCount()).isEqualTo(2);
        assertThat(result.session().userMessageCount()).isEqualTo(1);
        assertThat(result.session().startedAt()).isEqualTo(Instant.parse("2024-01-15T10:30:01Z"));
        assertThat(result.session().endedAt()).isEqualTo(Instant.parse("2024-01-15T10:30:05Z"));
        assertThat(result.messages().get(0).role()).isEqualTo(MessageRole.USER);
        assertThat(result.messages().get(1).role()).isEqualTo(MessageRole.ASSISTANT);
        assertThat(result.messages().get(1).ordinal()).isEqualTo(1);
    }

    @Test
    void missingMetaIdShouldFallBackToFilenameUuid() throws Exception {
        Path file = write(ROLLOUT_NAME, message("user", "input_text", "hi", "2024-01-15T10:30:01Z"));

        assertThat(parser.parse(file, "local").session().id()).isEqualTo("codex:" + UUID);
        assertThat(parser.peekSessionId(file)).isEqualTo("codex:" + UUID);
    }

    @Test
    void nonRolloutNameShouldFallBackToStem() throws Exception {
        Path file = write("notes.jsonl", message("user", "input_text", "hi", "2024-01-15T10:30:01Z"));

        assertThat(parser.parse(file, "local").session().id()).isEqualTo("codex:notes");
    }

    @Test
    void peekSessionIdShouldAgreeWithFullParse() throws Exception {
        Path file = write(ROLLOUT_NAME,
                message("user", "input_text", "before meta", "2024-01-15T10:30:00Z"),
                meta("meta-id-2", "/tmp/x", "codex_cli_rs")
        );

        assertThat(parser.peekSessionId(file)).isEqualTo(parser.parse(file, "local").session().id());
        assertThat(parser.peekSessionId(file)).isEqualTo("codex:meta-id-2");
    }

    @Test
    void injectedWrappersAndDeveloperMessagesShouldBeSystem() throws Exception {
        Path file = write(ROLLOUT_NAME,
                meta("meta-id-3", "/work/demo", "codex_cli_rs"),
                message("user", "input_text", "<environment_context>\n  <cwd>/work/demo</cwd>\n</environment_context>", "2024-01-15T10:30:00Z"),
                message("user", "input_text", "<user_instructions>be brief</user_instructions>", "2024-01-15T10:30:00Z"),
                message("user", "input_text", "# AGENTS.md instructions for /work/demo", "2024-01-15T10:30:00Z"),
                message("developer", "input_text", "sandbox policy", "2024-01-15T10:30:00Z"),
                message("user", "input_text", "real prompt", "2024-01-15T10:30:01Z")
        );

        ParseResult result = parser.parse(file, "local");

        assertThat(result.messages()).hasSize(5);
        assertThat(result.messages().subList(0, 4))
                .allSatisfy(message -> assertThat(message.role()).isEqualTo(MessageRole.SYSTEM));
        assertThat(result.messages().get(4).role()).isEqualTo(MessageRole.USER);
        assertThat(result.session().userMessageCount()).isEqualTo(1);
        assertThat(result.session().firstMessage()).isEqualTo("real prompt");
    }

    @Test
    void missingRoleShouldBeInferredFromBlockType() throws Exception {
        Path file = write(ROLLOUT_NAME,
                json(Map.of("type", "response_item", "timestamp", "2024-01-15T10:30:00Z",
                        "payload", Map.of("type", "message", "content",
                                new Object[]{Map.of("type", "output_text", "text", "inferred reply")}))),
                json(Map.of("type", "response_item", "timestamp", "2024-01-15T10:30:00Z",
                        "payload", Map.of("type", "function_call", "name", "shell", "arguments", "{}")))
        );

        ParseResult result = parser.parse(file, "local");

        assertThat(result.messages()).singleElement()
                .satisfies(message -> assertThat(message.role()).isEqualTo(MessageRole.ASSISTANT));
    }

    @Test
    void shouldSkipBlankAndMalformedLines() throws Exception {
        Path file = tempDir.resolve(ROLLOUT_NAME);
        Files.writeString(file, meta("meta-id-4", "/a/b", "codex_cli_rs") + "\n"
                + "{broken\n"
                + "\n"
                + message("user", "input_text", "   ", "2024-01-15T10:30:00Z") + "\n"
                + message("assistant", "output_text", "kept", "2024-01-15T10:30:01Z"));

        ParseResult result = parser.parse(file, "local");

        assertThat(result.messages()).singleElement()
                .satisfies(message -> assertThat(message.content()).isEqualTo("kept"));
    }

    @Test
    void extractUuidShouldAnchorAtEndOfName() {
        assertThat(CodexSessionParser.extractUuidFromRollout("rollout-20240115-" + UUID + ".jsonl")).isEqualTo(UUID);
        assertThat(CodexSessionParser.extractUuidFromRollout("rollout-20240115-" + UUID)).isEqualTo(UUID);
        assertThat(CodexSessionParser.extractUuidFromRollout("rollout-20240115-" + UUID + "-suffix.jsonl")).isEmpty();
        assertThat(CodexSessionParser.extractUuidFromRollout("session-" + UUID + ".jsonl")).isEmpty();
        assertThat(CodexSessionParser.extractUuidFromRollout("rollout-no-uuid.jsonl")).isEmpty();
        assertThat(CodexSessionParser.extractUuidFromRollout(null)).isEmpty();
    }

    private Path write(String name, String... records) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, String.join("\n", records) + "\n");
        return file;
    }

    private String meta(String id, String cwd, String originator) throws IOException {
        return json(Map.of("type", "session_meta", "timestamp", "2024-01-15T10:30:00Z",
                "payload", Map.of("id", id, "cwd", cwd, "originator", originator)));
    }

    private String message(String role, String blockType, String text, String timestamp) throws IOException {
        return json(Map.of("type", "response_item", "timestamp", timestamp,
                "payload", Map.of("type", "message", "role", role,
                        "content", new Object[]{Map.of("type", blockType, "text", text)})));
    }

    private String json(Object value) throws IOException {
        return objectMapper.writeValueAsString(value);
    }
}
