package com.mailrag.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import javax.sql.DataSource;

public class MetadataStore {
    private static final String COLUMNS =
            "source_id, sender, subject, date_sent_ms, body_text, summary, embedding, insertion_sequence";

    private final DataSource dataSource;
    private final SqlDialect dialect;

    public MetadataStore(DataSource dataSource, SqlDialect dialect) {
        this.dataSource = dataSource;
        this.dialect = dialect;
    }

    public Connection connection() throws SQLException {
        return dataSource.getConnection();
    }

    public void createSchema() throws SQLException {
        try (Connection conn = dataSource.getConnection();
                Statement statement = conn.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS emails (
                        id %s,
                        source_id VARCHAR(255) NOT NULL UNIQUE,
                        sender VARCHAR(255),
                        subject TEXT,
                        date_sent_ms BIGINT,
                        body_text TEXT,
                        summary TEXT NOT NULL,
                        embedding %s NOT NULL,
                        insertion_sequence BIGINT NOT NULL UNIQUE,
                        created_at_ms BIGINT NOT NULL
                    )
                    """.formatted(dialect.autoIncrementKey(), dialect.blobType()));
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS app_metadata (
                        meta_key VARCHAR(255) PRIMARY KEY,
                        meta_value TEXT,
                        updated_at_ms BIGINT NOT NULL
                    )
                    """);
        }
    }

    public boolean exists(Connection conn, String sourceId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM emails WHERE source_id = ?")) {
            stmt.setString(1, sourceId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    public long nextSequence(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT MAX(insertion_sequence) FROM emails")) {
            if (rs.next()) {
                long max = rs.getLong(1);
                return rs.wasNull() ? 0L : max + 1;
            }
            return 0L;
        }
    }

    public void insert(Connection conn, VectorRecord record, long insertionSequence) throws SQLException {
        String sql = "INSERT INTO emails (" + COLUMNS + ", created_at_ms) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, record.sourceId());
            stmt.setString(2, record.sender());
            stmt.setString(3, record.subject());
            if (record.sentAt() == null) {
                stmt.setNull(4, Types.BIGINT);
            } else {
                stmt.setLong(4, record.sentAt().toEpochMilli());
            }
            stmt.setString(5, record.bodyText());
            stmt.setString(6, record.summary());
            stmt.setBytes(7, EmbeddingCodec.encode(record.embedding()));
            stmt.setLong(8, insertionSequence);
            stmt.setLong(9, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    public Optional<String> findSummary(Connection conn, String sourceId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT summary FROM emails WHERE source_id = ?")) {
            stmt.setString(1, sourceId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    public Optional<VectorRecord> findBySequence(long insertionSequence) throws SQLException {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(
                        "SELECT " + COLUMNS + " FROM emails WHERE insertion_sequence = ?")) {
            stmt.setLong(1, insertionSequence);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        }
    }

    public Optional<VectorRecord> findBySourceId(String sourceId) throws SQLException {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(
                        "SELECT " + COLUMNS + " FROM emails WHERE source_id = ?")) {
            stmt.setString(1, sourceId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        }
    }

    public List<VectorRecord> recent(int limit) throws SQLException {
        List<VectorRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(
                        "SELECT " + COLUMNS + " FROM emails ORDER BY insertion_sequence DESC LIMIT ?")) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(read(rs));
                }
            }
        }
        return records;
    }

    public int count() throws SQLException {
        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM emails")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    public Optional<String> readSetting(String key) throws SQLException {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement("SELECT meta_value FROM app_metadata WHERE meta_key = ?")) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    public void writeSetting(String key, String value) throws SQLException {
        String sql = """
                INSERT INTO app_metadata (meta_key, meta_value, updated_at_ms) VALUES (?, ?, ?)
                ON CONFLICT (meta_key) DO UPDATE SET meta_value = excluded.meta_value, updated_at_ms = excluded.updated_at_ms
                """;
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            stmt.setString(2, value);
            stmt.setLong(3, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    private static VectorRecord read(ResultSet rs) throws SQLException {
        long sentAtMs = rs.getLong("date_sent_ms");
        Instant sentAt = rs.wasNull() ? null : Instant.ofEpochMilli(sentAtMs);
        return new VectorRecord(
                rs.getString("source_id"),
                rs.getString("sender"),
                rs.getString("subject"),
                sentAt,
                rs.getString("body_text"),
                rs.getString("summary"),
                EmbeddingCodec.decode(rs.getBytes("embedding")),
                rs.getLong("insertion_sequence"));
    }
}
