package com.linlay.agentsview.sync;

import com.linlay.agentsview.config.SyncProperties;
import com.linlay.agentsview.model.AgentType;
import com.linlay.agentsview.model.DiscoveredFile;
import com.linlay.agentsview.model.ParseResult;
import com.linlay.agentsview.model.ParsedMessage;
import com.linlay.agentsview.model.ParsedSession;
import com.linlay.agentsview.parser.ClaudeSessionParser;
import com.linlay.agentsview.parser.CodexSessionParser;
import com.linlay.agentsview.parser.ProjectIdentity;
import com.linlay.agentsview.store.SessionFileInfo;
import com.linlay.agentsview.store.SessionRecord;
import com.linlay.agentsview.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Drives discovery, change detection, parsing and persistence of agent session logs.
 * <p>
 * A full pass skips files whose stored {@code (size, hash)} still matches; a single-session
 * pass always reparses. Both keep a stored project label unless it is empty or still looks
 * like an undecoded path. Passes are serialized; each session is written in one transaction.
 */
@Service
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final SessionStore store;
    private final ClaudeSessionParser claudeParser;
    private final CodexSessionParser codexParser;
    private final SyncProperties properties;
    private final Object syncLock = new Object();
    // path -> mtime of files whose last read failed
    private final Map<Path, Long> failedFiles = new ConcurrentHashMap<>();
    private volatile Instant lastSyncAt;

    public SyncEngine(
            SessionStore store,
            ClaudeSessionParser claudeParser,
            CodexSessionParser codexParser,
            SyncProperties properties
    ) {
        this.store = store;
        this.claudeParser = claudeParser;
        this.codexParser = codexParser;
        this.properties = properties;
    }

    /**
     * Runs a full pass over both agent roots.
     *
     * @param progressSink receives progress snapshots; may be {@code null}
     */
    public SyncStats syncAll(Consumer<SyncProgress> progressSink) {
        synchronized (syncLock) {
            long startedAt = System.nanoTime();
            emit(progressSink, new SyncProgress(SyncProgress.Phase.DISCOVERING, 0, 0, 0, 0, 0));

            List<DiscoveredFile> files = new ArrayList<>();
            files.addAll(SessionFileDiscovery.discoverClaudeProjects(claudeProjectsDir()));
            files.addAll(SessionFileDiscovery.discoverCodexSessions(codexSessionsDir()));
            log.debug("Discovered {} session files", files.size());

            SyncStats stats = new SyncStats();
            stats.setTotalSessions(files.size());
            int done = 0;
            for (DiscoveredFile file : files) {
                if (Thread.currentThread().isInterrupted()) {
                    log.info("Sync pass interrupted after {}/{} files", done, files.size());
                    break;
                }
                processFile(file, stats);
                done++;
                emit(progressSink, new SyncProgress(
                        SyncProgress.Phase.SYNCING,
                        files.size(),
                        done,
                        stats.synced(),
                        stats.skipped(),
                        stats.messagesIndexed()
                ));
            }

            emit(progressSink, new SyncProgress(
                    SyncProgress.Phase.DONE,
                    files.size(),
                    done,
                    stats.synced(),
                    stats.skipped(),
                    stats.messagesIndexed()
            ));
            lastSyncAt = Instant.now();
            log.info("Sync pass finished: total={}, synced={}, skipped={}, failed={}, elapsed={}ms",
                    stats.totalSessions(), stats.synced(), stats.skipped(), stats.failed(),
                    Duration.ofNanos(System.nanoTime() - startedAt).toMillis());
            return stats;
        }
    }

    /**
     * Reparses and rewrites one session regardless of its stored hash.
     *
     * @throws IllegalArgumentException when no source file exists for {@code sessionId}
     * @throws IOException              when the source file cannot be read
     * @throws IllegalStateException    when the store write fails
     */
    public void syncSingleSession(String sessionId) throws IOException {
        Path file = findSourceFile(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("No source file for session " + sessionId));
        AgentType agent = isCodexSession(sessionId) ? AgentType.CODEX : AgentType.CLAUDE;
        String projectHint = agent == AgentType.CLAUDE ? file.getParent().getFileName().toString() : null;
        DiscoveredFile discovered = new DiscoveredFile(file, projectHint, agent);

        synchronized (syncLock) {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            String hash = FileHashes.computeFileHash(file);
            int messageCount = parseAndStore(discovered, attributes, hash);
            failedFiles.remove(file);
            log.info("Resynced session {} ({} messages)", sessionId, messageCount);
        }
    }

    /**
     * Locates the source log of a session; {@code codex:}-prefixed IDs are looked up in the
     * Codex tree, everything else in the Claude projects.
     */
    public Optional<Path> findSourceFile(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        if (isCodexSession(sessionId)) {
            String uuid = sessionId.substring(CodexSessionParser.SESSION_ID_PREFIX.length());
            return SessionFileDiscovery.findCodexSourceFile(codexSessionsDir(), uuid);
        }
        return SessionFileDiscovery.findClaudeSourceFile(claudeProjectsDir(), sessionId);
    }

    public Optional<Instant> lastSyncAt() {
        return Optional.ofNullable(lastSyncAt);
    }

    private void processFile(DiscoveredFile file, SyncStats stats) {
        Path path = file.path();
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (IOException ex) {
            if (isGone(path, ex)) {
                failedFiles.remove(path);
                log.debug("Session file disappeared: {}", path);
            } else {
                log.debug("Cannot stat {}, keeping previous state", path, ex);
            }
            stats.recordSkip();
            return;
        }

        long mtime = attributes.lastModifiedTime().toMillis();
        Long failedMtime = failedFiles.get(path);
        if (failedMtime != null && failedMtime == mtime) {
            log.debug("Skip previously failed file {}", path);
            stats.recordSkip();
            return;
        }

        try {
            String sessionId = sessionIdOf(file);
            String hash = FileHashes.computeFileHash(path);
            if (isUnchanged(sessionId, attributes.size(), hash)) {
                log.debug("Skip unchanged session {}", sessionId);
                stats.recordSkip();
                failedFiles.remove(path);
                return;
            }
            int messageCount = parseAndStore(file, attributes, hash);
            failedFiles.remove(path);
            stats.recordSynced(messageCount);
        } catch (IOException ex) {
            if (isGone(path, ex)) {
                failedFiles.remove(path);
                log.debug("Session file disappeared while reading: {}", path);
                stats.recordSkip();
                return;
            }
            failedFiles.put(path, mtime);
            log.warn("Cannot read session file {}: {}", path, ex.getMessage());
            stats.recordFailure(path.toString(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Cannot sync session file {}", path, ex);
            stats.recordFailure(path.toString(), String.valueOf(ex.getMessage()));
        }
    }

    /**
     * A missing file, or a parent that is no longer a directory, means the file was deleted
     * or moved. Wrapped causes count as well, since hashing wraps the open failure.
     */
    static boolean isGone(Path path, IOException ex) {
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof NoSuchFileException || cause instanceof NotDirectoryException) {
                return true;
            }
            cause = cause.getCause();
        }
        Path parent = path.getParent();
        return parent != null && !Files.isDirectory(parent);
    }

    /**
     * Size is compared first; equal sizes still need an equal hash to count as unchanged.
     */
    private boolean isUnchanged(String sessionId, long size, String hash) {
        Optional<SessionFileInfo> stored = store.getSessionFileInfo(sessionId);
        if (stored.isEmpty()) {
            return false;
        }
        SessionFileInfo info = stored.get();
        return info.size() == size && StringUtils.hasText(info.hash()) && info.hash().equals(hash);
    }

    private int parseAndStore(DiscoveredFile file, BasicFileAttributes attributes, String hash) throws IOException {
        ParseResult result = parse(file);
        ParsedSession parsed = result.session();
        List<ParsedMessage> messages = MessagePostProcessor.pairAndFilter(result.messages());
        MessagePostProcessor.MessageCounts counts = MessagePostProcessor.postFilterCounts(messages);

        String storedProject = store.getSessionFull(parsed.id())
                .map(SessionRecord::project)
                .orElse(null);
        String project = ProjectIdentity.resolveProject(storedProject, parsed.project());

        SessionRecord record = new SessionRecord(
                parsed.id(),
                project,
                parsed.machine(),
                parsed.agent(),
                parsed.firstMessage(),
                parsed.startedAt(),
                parsed.endedAt(),
                counts.total(),
                counts.user(),
                parsed.parentSessionId(),
                parsed.tokenUsage(),
                MessagePostProcessor.extractMcpServers(messages),
                file.path().toString(),
                attributes.size(),
                attributes.lastModifiedTime().toMillis(),
                hash
        );
        store.syncSession(record, messages);
        if (record.isTombstone()) {
            log.debug("Stored empty session {} from {}", record.id(), file.path());
        }
        return counts.total();
    }

    private ParseResult parse(DiscoveredFile file) throws IOException {
        if (file.agent() == AgentType.CODEX) {
            return codexParser.parse(file.path(), machine());
        }
        return claudeParser.parse(file.path(), ProjectIdentity.projectName(file.projectHint()), machine());
    }

    private String sessionIdOf(DiscoveredFile file) throws IOException {
        if (file.agent() == AgentType.CODEX) {
            return codexParser.peekSessionId(file.path());
        }
        return ClaudeSessionParser.sessionIdFromFile(file.path());
    }

    private static boolean isCodexSession(String sessionId) {
        return sessionId.startsWith(CodexSessionParser.SESSION_ID_PREFIX);
    }

    private static void emit(Consumer<SyncProgress> progressSink, SyncProgress progress) {
        if (progressSink != null) {
            progressSink.accept(progress);
        }
    }

    private String machine() {
        String machine = properties.getMachine();
        return StringUtils.hasText(machine) ? machine.trim() : SyncProperties.DEFAULT_MACHINE;
    }

    private Path claudeProjectsDir() {
        return resolveDir(properties.getClaudeProjectsDir());
    }

    private Path codexSessionsDir() {
        return resolveDir(properties.getCodexSessionsDir());
    }

    private static Path resolveDir(String configured) {
        if (!StringUtils.hasText(configured)) {
            return null;
        }
        String value = configured.trim();
        if (value.equals("~") || value.startsWith("~/")) {
            value = System.getProperty("user.home") + value.substring(1);
        }
        return Paths.get(value).toAbsolutePath().normalize();
    }
}
