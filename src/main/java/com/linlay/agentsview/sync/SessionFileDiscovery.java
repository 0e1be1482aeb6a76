package com.linlay.agentsview.sync;

import com.linlay.agentsview.model.AgentType;
import com.linlay.agentsview.model.DiscoveredFile;
import com.linlay.agentsview.parser.CodexSessionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Enumerates session logs under the two agent roots.
 * <ul>
 *     <li>Claude: {@code <root>/<encoded-project-dir>/<session-id>.jsonl}; {@code agent-*} files are
 *     sub-agent transcripts and are excluded.</li>
 *     <li>Codex: {@code <root>/YYYY/MM/DD/*.jsonl}; non-numeric directories are ignored.</li>
 * </ul>
 * A missing or unreadable root yields an empty list.
 */
public final class SessionFileDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SessionFileDiscovery.class);
    private static final String JSONL_SUFFIX = ".jsonl";
    private static final String SUBAGENT_PREFIX = "agent-";
    private static final String ROLLOUT_PREFIX = "rollout-";

    private SessionFileDiscovery() {
    }

    public static List<DiscoveredFile> discoverClaudeProjects(Path projectsDir) {
        List<DiscoveredFile> files = new ArrayList<>();
        for (Path projectDir : listDirectories(projectsDir, name -> true)) {
            String projectHint = projectDir.getFileName().toString();
            for (Path file : listFiles(projectDir)) {
                String name = file.getFileName().toString();
                if (!isSessionLog(name) || name.startsWith(SUBAGENT_PREFIX)) {
                    continue;
                }
                files.add(new DiscoveredFile(file, projectHint, AgentType.CLAUDE));
            }
        }
        files.sort(Comparator.comparing(file -> file.path().toString()));
        return files;
    }

    public static List<DiscoveredFile> discoverCodexSessions(Path sessionsDir) {
        List<DiscoveredFile> files = new ArrayList<>();
        walkCodexDayDirs(sessionsDir, dayDir -> {
            for (Path file : listFiles(dayDir)) {
                if (isSessionLog(file.getFileName().toString())) {
                    files.add(new DiscoveredFile(file, null, AgentType.CODEX));
                }
            }
            return true;
        });
        files.sort(Comparator.comparing(file -> file.path().toString()));
        return files;
    }

    public static Optional<Path> findClaudeSourceFile(Path projectsDir, String sessionId) {
        if (!isValidSessionId(sessionId)) {
            return Optional.empty();
        }
        String target = sessionId + JSONL_SUFFIX;
        for (Path projectDir : listDirectories(projectsDir, name -> true)) {
            Path candidate = projectDir.resolve(target);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * @param sessionId the bare rollout UUID, without the {@code codex:} prefix
     */
    public static Optional<Path> findCodexSourceFile(Path sessionsDir, String sessionId) {
        if (!isValidSessionId(sessionId)) {
            return Optional.empty();
        }
        Path[] found = new Path[1];
        walkCodexDayDirs(sessionsDir, dayDir -> {
            for (Path file : listFiles(dayDir)) {
                String name = file.getFileName().toString();
                if (!name.startsWith(ROLLOUT_PREFIX) || !name.endsWith(JSONL_SUFFIX)) {
                    continue;
                }
                if (sessionId.equals(CodexSessionParser.extractUuidFromRollout(name))) {
                    found[0] = file;
                    return false;
                }
            }
            return true;
        });
        return Optional.ofNullable(found[0]);
    }

    public static String extractUuidFromRollout(String filename) {
        return CodexSessionParser.extractUuidFromRollout(filename);
    }

    /**
     * Session IDs end up in path construction, so only {@code [A-Za-z0-9_-]} is accepted.
     */
    public static boolean isValidSessionId(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            return false;
        }
        for (int i = 0; i < sessionId.length(); i++) {
            char c = sessionId.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z')
                    || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9')
                    || c == '-'
                    || c == '_';
            if (!allowed) {
                return false;
            }
        }
        return true;
    }

    /**
     * A {@code .jsonl} file with a non-empty stem; the stem becomes the session ID.
     */
    static boolean isSessionLog(String fileName) {
        return fileName.endsWith(JSONL_SUFFIX) && fileName.length() > JSONL_SUFFIX.length();
    }

    static boolean isDigits(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return value.codePoints().allMatch(Character::isDigit);
    }

    /**
     * Calls {@code visitor} for every {@code YYYY/MM/DD} leaf; the visitor returns
     * {@code false} to stop the walk.
     */
    private static void walkCodexDayDirs(Path root, Predicate<Path> visitor) {
        for (Path year : listDirectories(root, SessionFileDiscovery::isDigits)) {
            for (Path month : listDirectories(year, SessionFileDiscovery::isDigits)) {
                for (Path day : listDirectories(month, SessionFileDiscovery::isDigits)) {
                    if (!visitor.test(day)) {
                        return;
                    }
                }
            }
        }
    }

    private static List<Path> listDirectories(Path dir, Predicate<String> nameFilter) {
        return list(dir, path -> Files.isDirectory(path) && nameFilter.test(path.getFileName().toString()));
    }

    private static List<Path> listFiles(Path dir) {
        return list(dir, Files::isRegularFile);
    }

    private static List<Path> list(Path dir, Predicate<Path> filter) {
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(filter)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException ex) {
            log.warn("Cannot list directory {}", dir, ex);
            return List.of();
        }
    }
}
