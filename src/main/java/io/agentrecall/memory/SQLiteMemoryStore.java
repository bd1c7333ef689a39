package io.agentrecall.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * SQLite-backed agent memory store.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code agent_memories} — one row per {@code (agent_id, key)}; timestamps in epoch millis,
 *       embedding as a JSON array (NULL when not computed yet)</li>
 * </ul>
 *
 * <p>Rows are listed newest first ({@code updated_at DESC, key ASC}). Access to the single
 * connection is serialised.</p>
 */
@Component
public class SQLiteMemoryStore implements MutableMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteMemoryStore.class);

    private static final String COLUMNS = "key, value, category, embedding, updated_at, expires_at";
    private static final String ACTIVE = "(expires_at IS NULL OR expires_at > ?)";

    private final String dbPath;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private Connection connection;

    @Autowired
    public SQLiteMemoryStore(@Value("${agent.memory.path:./data/memory}") String memoryPath, Clock clock) {
        Path dir = Path.of(memoryPath);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Failed to create memory directory: {}", dir, e);
        }
        this.dbPath = dir.resolve("memories.db").toString();
        this.clock = clock;
    }

    /** Constructor for testing with explicit db path. */
    public SQLiteMemoryStore(String dbPath, Clock clock, boolean isDirect) {
        this.dbPath = dbPath;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
            }
            createSchema();
            log.info("SQLiteMemoryStore initialized at: {}", dbPath);
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite memory store at {}", dbPath, e);
            throw new MemoryStoreException("Memory store initialization failed", e);
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS agent_memories (
                    agent_id TEXT NOT NULL,
                    key TEXT NOT NULL,
                    value TEXT NOT NULL,
                    category TEXT NOT NULL DEFAULT 'GENERAL',
                    embedding TEXT,
                    updated_at INTEGER NOT NULL,
                    expires_at INTEGER,
                    PRIMARY KEY (agent_id, key)
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_agent_memories_category ON agent_memories(agent_id, category)
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_agent_memories_expiry ON agent_memories(agent_id, expires_at)
                """);
        }
    }

    @Override
    public synchronized int countActive(String agentId) {
        String sql = "SELECT COUNT(*) FROM agent_memories WHERE agent_id = ? AND " + ACTIVE;

        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, agentId);
            stmt.setLong(2, clock.millis());
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to count memories for agent " + agentId, e);
        }
    }

    @Override
    public synchronized List<MemoryRecord> listActive(String agentId, MemoryScope scope) {
        List<MemoryCategory> categories = Arrays.stream(MemoryCategory.values())
                .filter(scope::includes)
                .toList();

        var sql = new StringBuilder("SELECT " + COLUMNS + " FROM agent_memories WHERE agent_id = ? AND " + ACTIVE);
        if (scope != MemoryScope.ALL) {
            StringJoiner placeholders = new StringJoiner(", ", " AND category IN (", ")");
            categories.forEach(c -> placeholders.add("?"));
            sql.append(placeholders);
        }
        sql.append(" ORDER BY updated_at DESC, key ASC");

        List<MemoryRecord> results = new ArrayList<>();
        try (var stmt = connection.prepareStatement(sql.toString())) {
            stmt.setString(1, agentId);
            stmt.setLong(2, clock.millis());
            if (scope != MemoryScope.ALL) {
                int index = 3;
                for (MemoryCategory category : categories) {
                    stmt.setString(index++, category.name());
                }
            }
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(toRecord(rs));
                }
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to list %s memories for agent %s".formatted(scope, agentId), e);
        }

        return results;
    }

    @Override
    public synchronized void upsert(String agentId, MemoryRecord record) {
        String sql = """
            INSERT INTO agent_memories (agent_id, key, value, category, embedding, updated_at, expires_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(agent_id, key) DO UPDATE SET
                value = excluded.value,
                category = excluded.category,
                embedding = excluded.embedding,
                updated_at = excluded.updated_at,
                expires_at = excluded.expires_at
            """;

        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, agentId);
            stmt.setString(2, record.key());
            stmt.setString(3, record.value());
            stmt.setString(4, record.category().name());
            stmt.setString(5, record.embedding().map(this::writeEmbedding).orElse(null));
            stmt.setLong(6, clock.millis());
            setNullableInstant(stmt, 7, record.expiresAt());
            stmt.executeUpdate();
            log.debug("Stored memory: agent={}, key='{}', category={}", agentId, record.key(), record.category());
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to store memory '%s' for agent %s".formatted(record.key(), agentId), e);
        }
    }

    @Override
    public synchronized Optional<MemoryRecord> get(String agentId, String key) {
        String sql = "SELECT " + COLUMNS + " FROM agent_memories WHERE agent_id = ? AND key = ?";

        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, agentId);
            stmt.setString(2, key);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(toRecord(rs));
                }
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to get memory '%s' for agent %s".formatted(key, agentId), e);
        }

        return Optional.empty();
    }

    @Override
    public synchronized boolean forget(String agentId, String key) {
        String sql = "DELETE FROM agent_memories WHERE agent_id = ? AND key = ?";

        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, agentId);
            stmt.setString(2, key);
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                log.debug("Forgot memory: agent={}, key='{}'", agentId, key);
                return true;
            }
        } catch (SQLException e) {
            throw new MemoryStoreException("Failed to forget memory '%s' for agent %s".formatted(key, agentId), e);
        }

        return false;
    }

    @PreDestroy
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("SQLiteMemoryStore closed");
            } catch (SQLException e) {
                log.error("Failed to close SQLite connection", e);
            }
        }
    }

    private MemoryRecord toRecord(ResultSet rs) throws SQLException {
        String key = rs.getString("key");
        long expiresAt = rs.getLong("expires_at");
        boolean neverExpires = rs.wasNull();

        return new MemoryRecord(
                key,
                rs.getString("value"),
                readCategory(rs.getString("category")),
                readEmbedding(key, rs.getString("embedding")),
                Instant.ofEpochMilli(rs.getLong("updated_at")),
                neverExpires ? null : Instant.ofEpochMilli(expiresAt)
        );
    }

    /** Rows written by this store hold enum names; anything else goes through the lenient parser. */
    private static MemoryCategory readCategory(String stored) {
        for (MemoryCategory category : MemoryCategory.values()) {
            if (category.name().equals(stored)) {
                return category;
            }
        }
        return MemoryCategory.fromString(stored);
    }

    private String writeEmbedding(Embedding embedding) {
        try {
            return mapper.writeValueAsString(embedding.vector());
        } catch (JsonProcessingException e) {
            throw new MemoryStoreException("Failed to serialize embedding", e);
        }
    }

    /** A stored embedding that cannot be parsed is read as absent. */
    private Optional<Embedding> readEmbedding(String key, String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Embedding(mapper.readValue(json, float[].class)));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable embedding for memory '{}': {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static void setNullableInstant(PreparedStatement stmt, int index, Instant instant) throws SQLException {
        if (instant == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, instant.toEpochMilli());
        }
    }
}
