package com.linlay.agentsview.model;

import java.nio.file.Path;

/**
 * A candidate session log found during discovery. {@code projectHint} is the raw Claude
 * project directory name and is {@code null} for Codex files.
 */
public record DiscoveredFile(Path path, String projectHint, AgentType agent) {
}
