package com.linlay.agentsview.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SyncPropertiesBindingTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(AgentsViewConfiguration.class);

    @Test
    void defaultsShouldPointAtAgentHomeDirectories() {
        contextRunner.run(context -> {
            SyncProperties properties = context.getBean(SyncProperties.class);
            String home = System.getProperty("user.home");
            assertThat(properties.getClaudeProjectsDir()).isEqualTo(home + "/.claude/projects");
            assertThat(properties.getCodexSessionsDir()).isEqualTo(home + "/.codex/sessions");
            assertThat(properties.getMachine()).isEqualTo("local");
            assertThat(properties.isInitialSyncEnabled()).isTrue();
            assertThat(properties.getPeriodic().isEnabled()).isTrue();
            assertThat(properties.getPeriodic().getInterval()).isEqualTo(Duration.ofMinutes(15));

            SessionStoreProperties storeProperties = context.getBean(SessionStoreProperties.class);
            assertThat(storeProperties.getSqliteFile()).isEqualTo("agentsview.db");
        });
    }

    @Test
    void kebabCasePropertiesShouldBind(@TempDir Path tempDir) {
        contextRunner
                .withPropertyValues(
                        "agentsview.sync.claude-projects-dir=" + tempDir.resolve("claude"),
                        "agentsview.sync.codex-sessions-dir=" + tempDir.resolve("codex"),
                        "agentsview.sync.machine=laptop",
                        "agentsview.sync.initial-sync-enabled=false",
                        "agentsview.sync.periodic.enabled=false",
                        "agentsview.sync.periodic.interval=5m",
                        "agentsview.store.sqlite-file=" + tempDir.resolve("index.db")
                )
                .run(context -> {
                    SyncProperties properties = context.getBean(SyncProperties.class);
                    assertThat(properties.getClaudeProjectsDir()).isEqualTo(tempDir.resolve("claude").toString());
                    assertThat(properties.getCodexSessionsDir()).isEqualTo(tempDir.resolve("codex").toString());
                    assertThat(properties.getMachine()).isEqualTo("laptop");
                    assertThat(properties.isInitialSyncEnabled()).isFalse();
                    assertThat(properties.getPeriodic().isEnabled()).isFalse();
                    assertThat(properties.getPeriodic().getInterval()).isEqualTo(Duration.ofMinutes(5));
                    assertThat(context.getBean(SessionStoreProperties.class).getSqliteFile())
                            .isEqualTo(tempDir.resolve("index.db").toString());
                });
    }

    @Test
    void nonPositiveIntervalShouldFallBackToDefault() {
        contextRunner
                .withPropertyValues("agentsview.sync.periodic.interval=0s")
                .run(context -> assertThat(context.getBean(SyncProperties.class).getPeriodic().getInterval())
                        .isEqualTo(SyncProperties.DEFAULT_PERIODIC_INTERVAL));
    }
}
