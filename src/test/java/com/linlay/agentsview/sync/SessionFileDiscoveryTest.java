package com.linlay.agentsview.sync;

import com.linlay.agentsview.model.AgentType;
import com.linlay.agentsview.model.DiscoveredFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionFileDiscoveryTest {

    private static final String UUID = "0194c5a2-1b2c-7d3e-8f40-123456789abc";

    @TempDir
    Path tempDir;

    @Test
    void claudeDiscoveryShouldSkipSubagentAndNonJsonlFiles() throws IOException {
        Path root = tempDir.resolve("projects");
        touch(root.resolve("-Users-wesm-code-zeta/s2.jsonl"));
        touch(root.resolve("-Users-wesm-code-alpha/s1.jsonl"));
        touch(root.resolve("-Users-wesm-code-alpha/agent-123.jsonl"));
        touch(root.resolve("-Users-wesm-code-alpha/notes.txt"));
        touch(root.resolve("stray.jsonl"));

        List<DiscoveredFile> files = SessionFileDiscovery.discoverClaudeProjects(root);

        assertThat(files).extracting(file -> file.path().getFileName().toString()).containsExactly("s1.jsonl", "s2.jsonl");
        assertThat(files).extracting(DiscoveredFile::projectHint)
                .containsExactly("-Users-wesm-code-alpha", "-Users-wesm-code-zeta");
        assertThat(files).allSatisfy(file -> assertThat(file.agent()).isEqualTo(AgentType.CLAUDE));
    }

    @Test
    void codexDiscoveryShouldOnlyWalkNumericDateDirectories() throws IOException {
        Path root = tempDir.resolve("sessions");
        touch(root.resolve("2024/01/16/rollout-b.jsonl"));
        touch(root.resolve("2024/01/15/rollout-a.jsonl"));
        touch(root.resolve("2024/01/15/readme.md"));
        touch(root.resolve("2024/archive/15/rollout-x.jsonl"));
        touch(root.resolve("tmp/01/15/rollout-y.jsonl"));
        touch(root.resolve("2024/01/rollout-too-shallow.jsonl"));

        List<DiscoveredFile> files = SessionFileDiscovery.discoverCodexSessions(root);

        assertThat(files).extracting(file -> root.relativize(file.path()).toString().replace('\\', '/'))
                .containsExactly("2024/01/15/rollout-a.jsonl", "2024/01/16/rollout-b.jsonl");
        assertThat(files).allSatisfy(file -> {
            assertThat(file.agent()).isEqualTo(AgentType.CODEX);
            assertThat(file.projectHint()).isNull();
        });
    }

    @Test
    void filesWithEmptyStemShouldNotBeDiscovered() throws IOException {
        Path claudeRoot = tempDir.resolve("projects");
        touch(claudeRoot.resolve("-Users-x-code-app/.jsonl"));
        touch(claudeRoot.resolve("-Users-x-code-app/real.jsonl"));
        Path codexRoot = tempDir.resolve("sessions");
        touch(codexRoot.resolve("2024/01/15/.jsonl"));

        assertThat(SessionFileDiscovery.discoverClaudeProjects(claudeRoot))
                .extracting(file -> file.path().getFileName().toString())
                .containsExactly("real.jsonl");
        assertThat(SessionFileDiscovery.discoverCodexSessions(codexRoot)).isEmpty();
        assertThat(SessionFileDiscovery.isSessionLog(".jsonl")).isFalse();
        assertThat(SessionFileDiscovery.isSessionLog("a.jsonl")).isTrue();
    }

    @Test
    void missingRootsShouldYieldEmptyLists() {
        assertThat(SessionFileDiscovery.discoverClaudeProjects(tempDir.resolve("absent"))).isEmpty();
        assertThat(SessionFileDiscovery.discoverCodexSessions(tempDir.resolve("absent"))).isEmpty();
        assertThat(SessionFileDiscovery.discoverClaudeProjects(null)).isEmpty();
    }

    @Test
    void findClaudeSourceFileShouldMatchExactStem() throws IOException {
        Path root = tempDir.resolve("projects");
        Path target = touch(root.resolve("-Users-wesm-code-app/abc-123.jsonl"));
        touch(root.resolve("-Users-wesm-code-app/abc-1234.jsonl"));

        assertThat(SessionFileDiscovery.findClaudeSourceFile(root, "abc-123")).contains(target);
        assertThat(SessionFileDiscovery.findClaudeSourceFile(root, "abc")).isEmpty();
    }

    @Test
    void findClaudeSourceFileShouldRejectUnsafeIds() throws IOException {
        Path root = tempDir.resolve("projects");
        touch(root.resolve("proj/ok.jsonl"));
        touch(tempDir.resolve("secret.jsonl"));

        assertThat(SessionFileDiscovery.findClaudeSourceFile(root, "../secret")).isEmpty();
        assertThat(SessionFileDiscovery.findClaudeSourceFile(root, "../etc/passwd")).isEmpty();
        assertThat(SessionFileDiscovery.findClaudeSourceFile(root, "proj/ok")).isEmpty();
        assertThat(SessionFileDiscovery.findClaudeSourceFile(root, "a b")).isEmpty();
        assertThat(SessionFileDiscovery.findClaudeSourceFile(root, "")).isEmpty();
        assertThat(SessionFileDiscovery.findClaudeSourceFile(root, null)).isEmpty();
    }

    @Test
    void findCodexSourceFileShouldMatchRolloutUuid() throws IOException {
        Path root = tempDir.resolve("sessions");
        touch(root.resolve("2024/01/15/rollout-2024-01-15T10-00-00-11111111-2222-3333-4444-555555555555.jsonl"));
        Path target = touch(root.resolve("2024/02/01/rollout-2024-02-01T08-00-00-" + UUID + ".jsonl"));
        touch(root.resolve("2024/02/02/rollout-2024-02-02T08-00-00-" + UUID + "-extra.jsonl"));

        assertThat(SessionFileDiscovery.findCodexSourceFile(root, UUID)).contains(target);
        assertThat(SessionFileDiscovery.findCodexSourceFile(root, "99999999-2222-3333-4444-555555555555")).isEmpty();
        assertThat(SessionFileDiscovery.findCodexSourceFile(root, "../" + UUID)).isEmpty();
    }

    @Test
    void sessionIdValidationShouldAllowOnlySafeCharacters() {
        assertThat(SessionFileDiscovery.isValidSessionId("abc_DEF-123")).isTrue();
        assertThat(SessionFileDiscovery.isValidSessionId(UUID)).isTrue();
        assertThat(SessionFileDiscovery.isValidSessionId("a.b")).isFalse();
        assertThat(SessionFileDiscovery.isValidSessionId("a/b")).isFalse();
        assertThat(SessionFileDiscovery.isValidSessionId("a\\b")).isFalse();
        assertThat(SessionFileDiscovery.isValidSessionId("é")).isFalse();
        assertThat(SessionFileDiscovery.isValidSessionId("")).isFalse();
    }

    @Test
    void isDigitsShouldRequireNonEmptyDigitString() {
        assertThat(SessionFileDiscovery.isDigits("2024")).isTrue();
        assertThat(SessionFileDiscovery.isDigits("01")).isTrue();
        assertThat(SessionFileDiscovery.isDigits("")).isFalse();
        assertThat(SessionFileDiscovery.isDigits("20a4")).isFalse();
        assertThat(SessionFileDiscovery.extractUuidFromRollout("rollout-x-" + UUID + ".jsonl")).isEqualTo(UUID);
    }

    private static Path touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{}\n");
        return file;
    }
}
