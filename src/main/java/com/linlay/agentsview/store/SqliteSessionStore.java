package com.linlay.agentsview.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentsview.config.SessionStoreProperties;
import com.linlay.agentsview.model.AgentType;
import com.linlay.agentsview.model.MessageRole;
import com.linlay.agentsview.model.ParsedMessage;
import com.linlay.agentsview.model.TokenUsage;
import com.linlay.agentsview.model.ToolCall;
import com.linlay.agentsview.model.ToolResult;
import com.linlay.agentsview.parser.TimestampParser;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite-backed session index.
 * <p>
 * One connection per call, every call under a single lock, so the database only ever sees
 * one writer. Messages are always replaced wholesale; the session row is upserted and
 * keeps its original creation time.
 */
@Service
public class SqliteSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteSessionStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private static final String CREATE_SESSION_SQL = """
            CREATE TABLE IF NOT EXISTS SESSION_ (
              ID_ TEXT PRIMARY KEY,
              PROJECT_ TEXT NOT NULL,
              AGENT_ TEXT NOT NULL,
              FIRST_MESSAGE_ TEXT,
              STARTED_AT_ TEXT,
              ENDED_AT_ TEXT,
              MESSAGE_COUNT_ INTEGER NOT NULL DEFAULT 0,
              USER_MESSAGE_COUNT_ INTEGER NOT NULL DEFAULT 0,
              PARENT_SESSION_ID_ TEXT,
              INPUT_TOKENS_ INTEGER NOT NULL DEFAULT 0,
              OUTPUT_TOKENS_ INTEGER NOT NULL DEFAULT 0,
              CACHE_CREATION_INPUT_TOKENS_ INTEGER NOT NULL DEFAULT 0,
              CACHE_READ_INPUT_TOKENS_ INTEGER NOT NULL DEFAULT 0,
              FILE_PATH_ TEXT,
              FILE_SIZE_ INTEGER,
              FILE_MTIME_ INTEGER,
              FILE_HASH_ TEXT,
              CREATED_AT_ INTEGER NOT NULL,
              UPDATED_AT_ INTEGER NOT NULL
            )
            """;
    private static final String CREATE_SESSION_PROJECT_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS IDX_SESSION_PROJECT_
              ON SESSION_(PROJECT_)
            """;
    private static final String CREATE_SESSION_ENDED_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS IDX_SESSION_ENDED_AT_
              ON SESSION_(ENDED_AT_ DESC)
            """;
    private static final String CREATE_MESSAGE_SQL = """
            CREATE TABLE IF NOT EXISTS MESSAGE_ (
              SESSION_ID_ TEXT NOT NULL,
              ORDINAL_ INTEGER NOT NULL,
              ROLE_ TEXT NOT NULL,
              CONTENT_ TEXT NOT NULL DEFAULT '',
              TIMESTAMP_ TEXT,
              HAS_THINKING_ INTEGER NOT NULL DEFAULT 0,
              HAS_TOOL_USE_ INTEGER NOT NULL DEFAULT 0,
              CONTENT_LENGTH_ INTEGER NOT NULL DEFAULT 0,
              PRIMARY KEY (SESSION_ID_, ORDINAL_)
            )
            """;
    private static final String CREATE_TOOL_CALL_SQL = """
            CREATE TABLE IF NOT EXISTS TOOL_CALL_ (
              SESSION_ID_ TEXT NOT NULL,
              MESSAGE_ORDINAL_ INTEGER NOT NULL,
              CALL_INDEX_ INTEGER NOT NULL,
              TOOL_USE_ID_ TEXT,
              TOOL_NAME_ TEXT NOT NULL,
              CATEGORY_ TEXT NOT NULL,
              INPUT_JSON_ TEXT,
              RESULT_CONTENT_LENGTH_ INTEGER NOT NULL DEFAULT 0,
              RESULT_CONTENT_ TEXT NOT NULL DEFAULT '',
              PRIMARY KEY (SESSION_ID_, MESSAGE_ORDINAL_, CALL_INDEX_)
            )
            """;
    private static final String CREATE_TOOL_CALL_NAME_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS IDX_TOOL_CALL_TOOL_NAME_
              ON TOOL_CALL_(TOOL_NAME_)
            """;
    private static final String CREATE_TOOL_RESULT_SQL = """
            CREATE TABLE IF NOT EXISTS TOOL_RESULT_ (
              SESSION_ID_ TEXT NOT NULL,
              MESSAGE_ORDINAL_ INTEGER NOT NULL,
              RESULT_INDEX_ INTEGER NOT NULL,
              TOOL_USE_ID_ TEXT,
              CONTENT_LENGTH_ INTEGER NOT NULL DEFAULT 0,
              CONTENT_ TEXT NOT NULL DEFAULT '',
              PRIMARY KEY (SESSION_ID_, MESSAGE_ORDINAL_, RESULT_INDEX_)
            )
            """;

    private static final String UPSERT_SESSION_SQL = """
            INSERT INTO SESSION_(
              ID_, PROJECT_, MACHINE_, AGENT_, FIRST_MESSAGE_, STARTED_AT_, ENDED_AT_,
              MESSAGE_COUNT_, USER_MESSAGE_COUNT_, PARENT_SESSION_ID_,
              INPUT_TOKENS_, OUTPUT_TOKENS_, CACHE_CREATION_INPUT_TOKENS_, CACHE_READ_INPUT_TOKENS_,
              MCP_SERVERS_, FILE_PATH_, FILE_SIZE_, FILE_MTIME_, FILE_HASH_, CREATED_AT_, UPDATED_AT_
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(ID_) DO UPDATE SET
              PROJECT_ = excluded.PROJECT_,
              MACHINE_ = excluded.MACHINE_,
              AGENT_ = excluded.AGENT_,
              FIRST_MESSAGE_ = excluded.FIRST_MESSAGE_,
              STARTED_AT_ = excluded.STARTED_AT_,
              ENDED_AT_ = excluded.ENDED_AT_,
              MESSAGE_COUNT_ = excluded.MESSAGE_COUNT_,
              USER_MESSAGE_COUNT_ = excluded.USER_MESSAGE_COUNT_,
              PARENT_SESSION_ID_ = excluded.PARENT_SESSION_ID_,
              INPUT_TOKENS_ = excluded.INPUT_TOKENS_,
              OUTPUT_TOKENS_ = excluded.OUTPUT_TOKENS_,
              CACHE_CREATION_INPUT_TOKENS_ = excluded.CACHE_CREATION_INPUT_TOKENS_,
              CACHE_READ_INPUT_TOKENS_ = excluded.CACHE_READ_INPUT_TOKENS_,
              MCP_SERVERS_ = excluded.MCP_SERVERS_,
              FILE_PATH_ = excluded.FILE_PATH_,
              FILE_SIZE_ = excluded.FILE_SIZE_,
              FILE_MTIME_ = excluded.FILE_MTIME_,
              FILE_HASH_ = excluded.FILE_HASH_,
              UPDATED_AT_ = excluded.UPDATED_AT_
            """;

    private final ObjectMapper objectMapper;
    private final SessionStoreProperties properties;
    private final Object lock = new Object();

    public SqliteSessionStore(ObjectMapper objectMapper, SessionStoreProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostConstruct
    public void initializeDatabase() {
        synchronized (lock) {
            Path dbPath = resolveSqlitePath();
            Path parent = dbPath.getParent();
            try {
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (IOException ex) {
                throw new IllegalStateException("Cannot create sqlite directory for " + dbPath, ex);
            }

            try (Connection connection = openConnection();
                 Statement statement = connection.createStatement()) {
                statement.execute(CREATE_SESSION_SQL);
                statement.execute(CREATE_SESSION_PROJECT_INDEX_SQL);
                statement.execute(CREATE_SESSION_ENDED_INDEX_SQL);
                statement.execute(CREATE_MESSAGE_SQL);
                statement.execute(CREATE_TOOL_CALL_SQL);
                statement.execute(CREATE_TOOL_CALL_NAME_INDEX_SQL);
                statement.execute(CREATE_TOOL_RESULT_SQL);
                ensureColumnExists(connection, "SESSION_", "MACHINE_", "TEXT NOT NULL DEFAULT 'local'");
                ensureColumnExists(connection, "SESSION_", "MCP_SERVERS_", "TEXT NOT NULL DEFAULT '[]'");
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot initialize sqlite session store", ex);
            }
            log.debug("Session store ready at {}", dbPath);
        }
    }

    @Override
    public Optional<SessionFileInfo> getSessionFileInfo(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        synchronized (lock) {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(
                         "SELECT FILE_SIZE_, FILE_HASH_ FROM SESSION_ WHERE ID_ = ?")) {
                statement.setString(1, sessionId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new SessionFileInfo(
                            resultSet.getLong("FILE_SIZE_"),
                            nullToEmpty(resultSet.getString("FILE_HASH_"))
                    ));
                }
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot query file info for sessionId=" + sessionId, ex);
            }
        }
    }

    @Override
    public Optional<SessionRecord> getSessionFull(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        synchronized (lock) {
            try (Connection connection = openConnection()) {
                return Optional.ofNullable(findSessionById(connection, sessionId));
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot query session for sessionId=" + sessionId, ex);
            }
        }
    }

    @Override
    public void upsertSession(SessionRecord session) {
        requireSession(session);
        synchronized (lock) {
            try (Connection connection = openConnection()) {
                upsertSession(connection, session, System.currentTimeMillis());
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot upsert session for sessionId=" + session.id(), ex);
            }
        }
    }

    @Override
    public void replaceSessionMessages(String sessionId, List<ParsedMessage> messages) {
        if (!StringUtils.hasText(sessionId)) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        synchronized (lock) {
            try (Connection connection = openConnection()) {
                connection.setAutoCommit(false);
                try {
                    replaceMessages(connection, sessionId, messages);
                    connection.commit();
                } catch (SQLException ex) {
                    rollbackQuietly(connection, ex);
                    throw ex;
                }
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot replace messages for sessionId=" + sessionId, ex);
            }
        }
    }

    @Override
    public void syncSession(SessionRecord session, List<ParsedMessage> messages) {
        requireSession(session);
        synchronized (lock) {
            try (Connection connection = openConnection()) {
                connection.setAutoCommit(false);
                try {
                    upsertSession(connection, session, System.currentTimeMillis());
                    replaceMessages(connection, session.id(), messages);
                    connection.commit();
                } catch (SQLException ex) {
                    rollbackQuietly(connection, ex);
                    throw ex;
                }
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot sync session for sessionId=" + session.id(), ex);
            }
        }
    }

    @Override
    public List<ParsedMessage> getAllMessages(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return List.of();
        }
        synchronized (lock) {
            try (Connection connection = openConnection()) {
                Map<Integer, List<ToolCall>> toolCalls = loadToolCalls(connection, sessionId);
                Map<Integer, List<ToolResult>> toolResults = loadToolResults(connection, sessionId);
                List<ParsedMessage> messages = new ArrayList<>();
                try (PreparedStatement statement = connection.prepareStatement("""
                        SELECT ORDINAL_, ROLE_, CONTENT_, TIMESTAMP_, HAS_THINKING_, HAS_TOOL_USE_, CONTENT_LENGTH_
                        FROM MESSAGE_
                        WHERE SESSION_ID_ = ?
                        ORDER BY ORDINAL_ ASC
                        """)) {
                    statement.setString(1, sessionId);
                    try (ResultSet resultSet = statement.executeQuery()) {
                        while (resultSet.next()) {
                            int ordinal = resultSet.getInt("ORDINAL_");
                            messages.add(new ParsedMessage(
                                    ordinal,
                                    MessageRole.fromValue(resultSet.getString("ROLE_")),
                                    resultSet.getString("CONTENT_"),
                                    TimestampParser.parse(resultSet.getString("TIMESTAMP_")),
                                    resultSet.getInt("HAS_THINKING_") != 0,
                                    resultSet.getInt("HAS_TOOL_USE_") != 0,
                                    resultSet.getInt("CONTENT_LENGTH_"),
                                    toolCalls.getOrDefault(ordinal, List.of()),
                                    toolResults.getOrDefault(ordinal, List.of())
                            ));
                        }
                    }
                }
                return messages;
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot load messages for sessionId=" + sessionId, ex);
            }
        }
    }

    @Override
    public boolean deleteSession(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return false;
        }
        synchronized (lock) {
            try (Connection connection = openConnection()) {
                connection.setAutoCommit(false);
                try {
                    deleteMessages(connection, sessionId);
                    int deleted;
                    try (PreparedStatement statement = connection.prepareStatement(
                            "DELETE FROM SESSION_ WHERE ID_ = ?")) {
                        statement.setString(1, sessionId);
                        deleted = statement.executeUpdate();
                    }
                    connection.commit();
                    return deleted > 0;
                } catch (SQLException ex) {
                    rollbackQuietly(connection, ex);
                    throw ex;
                }
            } catch (SQLException ex) {
                throw new IllegalStateException("Cannot delete session for sessionId=" + sessionId, ex);
            }
        }
    }

    private void upsertSession(Connection connection, SessionRecord session, long now) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(UPSERT_SESSION_SQL)) {
            TokenUsage usage = session.tokenUsage();
            int index = 1;
            statement.setString(index++, session.id());
            statement.setString(index++, nullToEmpty(session.project()));
            statement.setString(index++, StringUtils.hasText(session.machine()) ? session.machine() : "local");
            statement.setString(index++, session.agent() == null ? AgentType.CLAUDE.value() : session.agent().value());
            statement.setString(index++, session.firstMessage());
            setTimestamp(statement, index++, session.startedAt());
            setTimestamp(statement, index++, session.endedAt());
            statement.setInt(index++, session.messageCount());
            statement.setInt(index++, session.userMessageCount());
            statement.setString(index++, StringUtils.hasText(session.parentSessionId()) ? session.parentSessionId() : null);
            statement.setLong(index++, usage.inputTokens());
            statement.setLong(index++, usage.outputTokens());
            statement.setLong(index++, usage.cacheCreationInputTokens());
            statement.setLong(index++, usage.cacheReadInputTokens());
            statement.setString(index++, writeServers(session.mcpServers()));
            statement.setString(index++, session.filePath());
            statement.setLong(index++, session.fileSize());
            statement.setLong(index++, session.fileMtime());
            statement.setString(index++, session.fileHash());
            statement.setLong(index++, now);
            statement.setLong(index, now);
            statement.executeUpdate();
        }
    }

    private void replaceMessages(Connection connection, String sessionId, List<ParsedMessage> messages) throws SQLException {
        deleteMessages(connection, sessionId);
        if (messages == null || messages.isEmpty()) {
            return;
        }
        try (PreparedStatement messageStatement = connection.prepareStatement("""
                INSERT INTO MESSAGE_(
                  SESSION_ID_, ORDINAL_, ROLE_, CONTENT_, TIMESTAMP_, HAS_THINKING_, HAS_TOOL_USE_, CONTENT_LENGTH_
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """);
             PreparedStatement callStatement = connection.prepareStatement("""
                     INSERT INTO TOOL_CALL_(
                       SESSION_ID_, MESSAGE_ORDINAL_, CALL_INDEX_, TOOL_USE_ID_, TOOL_NAME_, CATEGORY_,
                       INPUT_JSON_, RESULT_CONTENT_LENGTH_, RESULT_CONTENT_
                     ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                     """);
             PreparedStatement resultStatement = connection.prepareStatement("""
                     INSERT INTO TOOL_RESULT_(
                       SESSION_ID_, MESSAGE_ORDINAL_, RESULT_INDEX_, TOOL_USE_ID_, CONTENT_LENGTH_, CONTENT_
                     ) VALUES (?, ?, ?, ?, ?, ?)
                     """)) {
            for (ParsedMessage message : messages) {
                messageStatement.setString(1, sessionId);
                messageStatement.setInt(2, message.ordinal());
                messageStatement.setString(3, message.role().value());
                messageStatement.setString(4, message.content());
                setTimestamp(messageStatement, 5, message.timestamp());
                messageStatement.setInt(6, message.hasThinking() ? 1 : 0);
                messageStatement.setInt(7, message.hasToolUse() ? 1 : 0);
                messageStatement.setInt(8, message.contentLength());
                messageStatement.addBatch();

                List<ToolCall> calls = message.toolCalls();
                for (int i = 0; i < calls.size(); i++) {
                    ToolCall call = calls.get(i);
                    callStatement.setString(1, sessionId);
                    callStatement.setInt(2, message.ordinal());
                    callStatement.setInt(3, i);
                    callStatement.setString(4, call.toolUseId());
                    callStatement.setString(5, nullToEmpty(call.toolName()));
                    callStatement.setString(6, nullToEmpty(call.category()));
                    callStatement.setString(7, call.inputJson());
                    callStatement.setInt(8, call.resultContentLength());
                    callStatement.setString(9, call.resultContent());
                    callStatement.addBatch();
                }

                List<ToolResult> results = message.toolResults();
                for (int i = 0; i < results.size(); i++) {
                    ToolResult result = results.get(i);
                    resultStatement.setString(1, sessionId);
                    resultStatement.setInt(2, message.ordinal());
                    resultStatement.setInt(3, i);
                    resultStatement.setString(4, result.toolUseId());
                    resultStatement.setInt(5, result.contentLength());
                    resultStatement.setString(6, nullToEmpty(result.content()));
                    resultStatement.addBatch();
                }
            }
            messageStatement.executeBatch();
            callStatement.executeBatch();
            resultStatement.executeBatch();
        }
    }

    private void deleteMessages(Connection connection, String sessionId) throws SQLException {
        for (String table : List.of("TOOL_RESULT_", "TOOL_CALL_", "MESSAGE_")) {
            try (PreparedStatement statement = connection.prepareStatement(
                    "DELETE FROM " + table + " WHERE SESSION_ID_ = ?")) {
                statement.setString(1, sessionId);
                statement.executeUpdate();
            }
        }
    }

    private SessionRecord findSessionById(Connection connection, String sessionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT ID_, PROJECT_, MACHINE_, AGENT_, FIRST_MESSAGE_, STARTED_AT_, ENDED_AT_,
                       MESSAGE_COUNT_, USER_MESSAGE_COUNT_, PARENT_SESSION_ID_,
                       INPUT_TOKENS_, OUTPUT_TOKENS_, CACHE_CREATION_INPUT_TOKENS_, CACHE_READ_INPUT_TOKENS_,
                       MCP_SERVERS_, FILE_PATH_, FILE_SIZE_, FILE_MTIME_, FILE_HASH_
                FROM SESSION_
                WHERE ID_ = ?
                """)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return null;
                }
                return new SessionRecord(
                        resultSet.getString("ID_"),
                        resultSet.getString("PROJECT_"),
                        resultSet.getString("MACHINE_"),
                        AgentType.fromValue(resultSet.getString("AGENT_")),
                        resultSet.getString("FIRST_MESSAGE_"),
                        TimestampParser.parse(resultSet.getString("STARTED_AT_")),
                        TimestampParser.parse(resultSet.getString("ENDED_AT_")),
                        resultSet.getInt("MESSAGE_COUNT_"),
                        resultSet.getInt("USER_MESSAGE_COUNT_"),
                        resultSet.getString("PARENT_SESSION_ID_"),
                        new TokenUsage(
                                resultSet.getLong("INPUT_TOKENS_"),
                                resultSet.getLong("OUTPUT_TOKENS_"),
                                resultSet.getLong("CACHE_CREATION_INPUT_TOKENS_"),
                                resultSet.getLong("CACHE_READ_INPUT_TOKENS_")
                        ),
                        readServers(resultSet.getString("MCP_SERVERS_")),
                        resultSet.getString("FILE_PATH_"),
                        resultSet.getLong("FILE_SIZE_"),
                        resultSet.getLong("FILE_MTIME_"),
                        resultSet.getString("FILE_HASH_")
                );
            }
        }
    }

    private Map<Integer, List<ToolCall>> loadToolCalls(Connection connection, String sessionId) throws SQLException {
        Map<Integer, List<ToolCall>> byOrdinal = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT MESSAGE_ORDINAL_, TOOL_USE_ID_, TOOL_NAME_, CATEGORY_, INPUT_JSON_,
                       RESULT_CONTENT_LENGTH_, RESULT_CONTENT_
                FROM TOOL_CALL_
                WHERE SESSION_ID_ = ?
                ORDER BY MESSAGE_ORDINAL_ ASC, CALL_INDEX_ ASC
                """)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    byOrdinal.computeIfAbsent(resultSet.getInt("MESSAGE_ORDINAL_"), key -> new ArrayList<>())
                            .add(new ToolCall(
                                    resultSet.getString("TOOL_USE_ID_"),
                                    resultSet.getString("TOOL_NAME_"),
                                    resultSet.getString("CATEGORY_"),
                                    resultSet.getString("INPUT_JSON_"),
                                    resultSet.getInt("RESULT_CONTENT_LENGTH_"),
                                    resultSet.getString("RESULT_CONTENT_")
                            ));
                }
            }
        }
        return byOrdinal;
    }

    private Map<Integer, List<ToolResult>> loadToolResults(Connection connection, String sessionId) throws SQLException {
        Map<Integer, List<ToolResult>> byOrdinal = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT MESSAGE_ORDINAL_, TOOL_USE_ID_, CONTENT_LENGTH_, CONTENT_
                FROM TOOL_RESULT_
                WHERE SESSION_ID_ = ?
                ORDER BY MESSAGE_ORDINAL_ ASC, RESULT_INDEX_ ASC
                """)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    byOrdinal.computeIfAbsent(resultSet.getInt("MESSAGE_ORDINAL_"), key -> new ArrayList<>())
                            .add(new ToolResult(
                                    resultSet.getString("TOOL_USE_ID_"),
                                    resultSet.getInt("CONTENT_LENGTH_"),
                                    resultSet.getString("CONTENT_")
                            ));
                }
            }
        }
        return byOrdinal;
    }

    private String writeServers(List<String> servers) {
        try {
            return objectMapper.writeValueAsString(servers == null ? List.of() : servers);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize mcp servers " + servers, ex);
        }
    }

    private List<String> readServers(String raw) {
        if (!StringUtils.hasText(raw)) {
            return List.of();
        }
        try {
            return objectMapper.readValue(raw, STRING_LIST);
        } catch (JsonProcessingException ex) {
            log.warn("Ignore unreadable mcp server list: {}", raw);
            return List.of();
        }
    }

    private void setTimestamp(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.VARCHAR);
            return;
        }
        statement.setString(index, TimestampParser.format(value));
    }

    private void rollbackQuietly(Connection connection, SQLException cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackEx) {
            cause.addSuppressed(rollbackEx);
        }
    }

    private void requireSession(SessionRecord session) {
        if (session == null || !StringUtils.hasText(session.id())) {
            throw new IllegalArgumentException("session id must not be blank");
        }
    }

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + resolveSqlitePath());
    }

    private Path resolveSqlitePath() {
        String configured = properties.getSqliteFile();
        if (!StringUtils.hasText(configured)) {
            configured = "agentsview.db";
        }
        Path path = Paths.get(configured.trim());
        if (!path.isAbsolute()) {
            path = Paths.get(System.getProperty("user.dir")).resolve(path).normalize();
        }
        return path.toAbsolutePath().normalize();
    }

    private void ensureColumnExists(
            Connection connection,
            String tableName,
            String columnName,
            String columnDefinition
    ) throws SQLException {
        boolean exists = false;
        try (PreparedStatement statement = connection.prepareStatement("PRAGMA table_info(" + tableName + ")");
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                if (columnName.equalsIgnoreCase(resultSet.getString("name"))) {
                    exists = true;
                    break;
                }
            }
        }
        if (exists) {
            return;
        }
        try (Statement statement = connection.createStatement()) {
            statement.execute("ALTER TABLE " + tableName + " ADD COLUMN " + columnName + " " + columnDefinition);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
