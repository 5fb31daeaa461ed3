package io.memoria.core.store;

import io.memoria.core.model.ConversationMessage;
import io.memoria.core.model.MessageRole;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public final class SqliteMessageLog implements MessageLog {
    private final String jdbcUrl;

    public SqliteMessageLog(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    @Override
    public synchronized void append(String iin, String sessionId, ConversationMessage message) throws IOException {
        String sql = """
            INSERT INTO session_messages (iin, session_id, created_at, role, content)
            VALUES (?, ?, ?, ?, ?)
            """;
        Instant timestamp = message.timestamp() == null ? Instant.now() : message.timestamp();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, iin);
            statement.setString(2, sessionId);
            statement.setString(3, timestamp.toString());
            statement.setString(4, message.role().name().toLowerCase(Locale.ROOT));
            statement.setString(5, message.content());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to append session message", e);
        }
    }

    @Override
    public synchronized List<ConversationMessage> recent(String iin, String sessionId, int limit) throws IOException {
        String sql = """
            SELECT created_at, role, content
            FROM session_messages
            WHERE iin = ? AND session_id = ?
            ORDER BY seq DESC
            LIMIT ?
            """;
        List<ConversationMessage> newestFirst = query(sql, iin, sessionId, Math.max(0, limit));
        List<ConversationMessage> messages = new ArrayList<>(newestFirst);
        Collections.reverse(messages);
        return messages;
    }

    @Override
    public synchronized List<ConversationMessage> all(String iin, String sessionId) throws IOException {
        String sql = """
            SELECT created_at, role, content
            FROM session_messages
            WHERE iin = ? AND session_id = ?
            ORDER BY seq ASC
            """;
        return query(sql, iin, sessionId, -1);
    }

    private List<ConversationMessage> query(String sql, String iin, String sessionId, int limit) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, iin);
            statement.setString(2, sessionId);
            if (limit >= 0) {
                statement.setInt(3, limit);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ConversationMessage> messages = new ArrayList<>();
                while (resultSet.next()) {
                    MessageRole role = "assistant".equals(resultSet.getString("role")) ? MessageRole.ASSISTANT : MessageRole.USER;
                    messages.add(new ConversationMessage(
                        role,
                        resultSet.getString("content"),
                        Instant.parse(resultSet.getString("created_at"))
                    ));
                }
                return messages;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read session messages", e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS session_messages (
                seq INTEGER PRIMARY KEY AUTOINCREMENT,
                iin TEXT NOT NULL,
                session_id TEXT NOT NULL,
                created_at TEXT NOT NULL,
                role TEXT NOT NULL,
                content TEXT NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_session_messages_session
            ON session_messages(iin, session_id, seq)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite message log", e);
        }
    }
}
